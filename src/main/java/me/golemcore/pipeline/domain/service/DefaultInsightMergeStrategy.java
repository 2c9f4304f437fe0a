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

import me.golemcore.pipeline.domain.model.Competitor;
import me.golemcore.pipeline.domain.model.Insight;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keeps the survivor as is and appends competitors it does not list yet,
 * matched by name, up to {@link Insight#MAX_COMPETITORS}.
 */
@Component
public class DefaultInsightMergeStrategy implements InsightMergeStrategy {

    @Override
    public Insight merge(Insight survivor, Insight absorbed) {
        List<Competitor> competitors = new ArrayList<>(survivor.getCompetitors());
        Set<String> names = new HashSet<>();
        for (Competitor competitor : competitors) {
            names.add(key(competitor));
        }
        for (Competitor candidate : absorbed.getCompetitors()) {
            if (competitors.size() >= Insight.MAX_COMPETITORS) {
                break;
            }
            if (names.add(key(candidate))) {
                competitors.add(candidate);
            }
        }
        survivor.setCompetitors(competitors);
        return survivor;
    }

    private static String key(Competitor competitor) {
        return competitor.getName() == null ? "" : competitor.getName().trim().toLowerCase(Locale.ROOT);
    }
}
