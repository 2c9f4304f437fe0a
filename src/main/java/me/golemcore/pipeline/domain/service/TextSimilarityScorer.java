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

import java.math.BigDecimal;
import java.util.Map;

/**
 * Pairwise text similarity over a fixed set of documents.
 */
public interface TextSimilarityScorer {

    /**
     * Build an index over the documents, keyed by document id.
     */
    Index index(Map<String, String> documents);

    interface Index {

        /**
         * Similarity in [0, 1] with three decimal places. Unknown ids score
         * zero.
         */
        BigDecimal similarity(String firstId, String secondId);
    }
}
