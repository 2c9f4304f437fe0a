package me.golemcore.pipeline.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pipeline.domain.exception.InsightValidationException;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.InsightDraft;
import me.golemcore.pipeline.domain.model.ScoreDimension;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Range and presence checks on generated output. A structurally valid but
 * out-of-range draft is a validation failure like a malformed one.
 */
@Component
public class InsightValidator {

    public void validate(InsightDraft draft) {
        List<String> violations = violations(draft);
        if (!violations.isEmpty()) {
            throw new InsightValidationException(violations);
        }
    }

    public List<String> violations(InsightDraft draft) {
        List<String> violations = new ArrayList<>();
        if (draft == null) {
            violations.add("no structured output");
            return violations;
        }
        if (isBlank(draft.getProblemStatement())) {
            violations.add("problem statement is missing");
        }
        if (isBlank(draft.getProposedSolution())) {
            violations.add("proposed solution is missing");
        }
        if (draft.getMarketSize() == null) {
            violations.add("market size is missing");
        }
        Double relevance = draft.getRelevanceScore();
        if (relevance == null || relevance.isNaN() || relevance < 0.0 || relevance > 1.0) {
            violations.add("relevance score must be within [0, 1], got " + relevance);
        }
        if (draft.getCompetitors() != null && draft.getCompetitors().size() > Insight.MAX_COMPETITORS) {
            violations.add("at most " + Insight.MAX_COMPETITORS + " competitors allowed, got "
                    + draft.getCompetitors().size());
        }
        if (draft.getDimensionScores() != null) {
            for (Map.Entry<String, Integer> entry : draft.getDimensionScores().entrySet()) {
                Integer score = entry.getValue();
                if (score == null || score < ScoreDimension.MIN_SCORE || score > ScoreDimension.MAX_SCORE) {
                    violations.add("dimension '" + entry.getKey() + "' must be within [1, 10], got " + score);
                }
            }
        }
        return violations;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
