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

import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.ScoreDimension;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Heuristic quality score of an insight in [0, 1] with two decimals.
 *
 * <p>
 * Points out of 100:
 * <ul>
 * <li>problem statement length - 20</li>
 * <li>dimension score average - 30</li>
 * <li>relevance - 25</li>
 * <li>proposed solution length - 15</li>
 * <li>competitor coverage - 10</li>
 * <li>-10 per consistency error, -2 per consistency warning</li>
 * </ul>
 */
@Component
public class QualityScorer {

    private static final Pattern WORDS = Pattern.compile("\\s+");

    public BigDecimal score(Insight insight) {
        double points = 0.0;

        int problemWords = wordCount(insight.getProblemStatement());
        if (problemWords >= 150) {
            points += 20;
        } else if (problemWords >= 100) {
            points += 15;
        } else if (problemWords >= 50) {
            points += 10;
        } else {
            points += problemWords / 5.0;
        }

        Map<String, Integer> dimensions = insight.getDimensionScores();
        if (dimensions != null && !dimensions.isEmpty()) {
            double average = dimensions.values().stream()
                    .filter(v -> v != null)
                    .mapToInt(Integer::intValue)
                    .average()
                    .orElse(0);
            points += average / ScoreDimension.MAX_SCORE * 30;
        }

        points += Math.max(0.0, Math.min(1.0, insight.getRelevanceScore())) * 25;

        int solutionWords = wordCount(insight.getProposedSolution());
        if (solutionWords >= 30) {
            points += 15;
        } else if (solutionWords >= 10) {
            points += 10;
        } else if (solutionWords > 0) {
            points += 5;
        }

        int competitors = insight.getCompetitors() != null ? insight.getCompetitors().size() : 0;
        points += Math.min(10.0, competitors * 10.0 / Insight.MAX_COMPETITORS);

        points -= 10.0 * consistencyErrors(insight).size();
        points -= 2.0 * consistencyWarnings(insight).size();

        double clamped = Math.max(0.0, Math.min(100.0, points));
        return BigDecimal.valueOf(clamped / 100.0).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * High opportunity requires a significant problem.
     */
    public List<String> consistencyErrors(Insight insight) {
        List<String> errors = new ArrayList<>();
        Integer opportunity = dimension(insight, ScoreDimension.OPPORTUNITY);
        Integer problem = dimension(insight, ScoreDimension.PROBLEM);
        if (opportunity != null && problem != null && opportunity >= 8 && problem < 5) {
            errors.add("high opportunity (" + opportunity + ") with weak problem (" + problem + ")");
        }
        return errors;
    }

    public List<String> consistencyWarnings(Insight insight) {
        List<String> warnings = new ArrayList<>();
        Integer feasibility = dimension(insight, ScoreDimension.FEASIBILITY);
        Integer difficulty = dimension(insight, ScoreDimension.EXECUTION_DIFFICULTY);
        if (feasibility != null && difficulty != null && feasibility >= 8 && difficulty > 7) {
            warnings.add("high feasibility (" + feasibility + ") with high execution difficulty ("
                    + difficulty + ")");
        }
        return warnings;
    }

    private static Integer dimension(Insight insight, ScoreDimension dimension) {
        return insight.getDimensionScores() != null ? insight.getDimensionScores().get(dimension.key()) : null;
    }

    private static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WORDS.split(text.trim()).length;
    }
}
