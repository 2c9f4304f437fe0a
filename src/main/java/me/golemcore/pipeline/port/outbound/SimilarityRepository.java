package me.golemcore.pipeline.port.outbound;

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

import me.golemcore.pipeline.domain.model.ContentSimilarity;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface SimilarityRepository {

    /**
     * Insert the pair unless a row with the same unordered pair key exists.
     *
     * @return the stored row, or empty when the pair was already recorded
     */
    Optional<ContentSimilarity> insertIfAbsent(ContentSimilarity similarity);

    Optional<ContentSimilarity> findById(String id);

    List<ContentSimilarity> findAll();

    ContentSimilarity update(String id, UnaryOperator<ContentSimilarity> mutation);

    /**
     * Remove the open pairs that reference an insight. Resolved pairs are
     * kept as triage history.
     */
    int deleteUnresolvedByInsightId(String insightId);
}
