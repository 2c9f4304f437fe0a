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

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Cosine similarity of L2-normalized TF-IDF vectors.
 *
 * <p>
 * Tokens are lower-cased alphanumeric runs of at least two characters with
 * English stop words removed. Inverse document frequency uses the smoothed
 * form {@code ln((1 + n) / (1 + df)) + 1}.
 */
@Component
public class TfIdfSimilarityScorer implements TextSimilarityScorer {

    private static final int SCALE = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "after", "all", "also", "an", "and", "any", "are", "as", "at", "be", "because",
            "been", "but", "by", "can", "could", "do", "does", "for", "from", "had", "has", "have", "how",
            "if", "in", "into", "is", "it", "its", "just", "more", "most", "no", "not", "of", "on", "or",
            "other", "our", "out", "over", "so", "some", "such", "than", "that", "the", "their", "them",
            "then", "there", "these", "they", "this", "those", "to", "too", "up", "very", "was", "we",
            "were", "what", "when", "which", "while", "who", "will", "with", "would", "you", "your");

    @Override
    public Index index(Map<String, String> documents) {
        Map<String, Map<String, Integer>> termCounts = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (Map.Entry<String, String> document : documents.entrySet()) {
            Map<String, Integer> counts = new HashMap<>();
            for (String token : tokenize(document.getValue())) {
                counts.merge(token, 1, Integer::sum);
            }
            termCounts.put(document.getKey(), counts);
            for (String term : counts.keySet()) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        int n = documents.size();
        Map<String, Map<String, Double>> vectors = new HashMap<>();
        termCounts.forEach((id, counts) -> {
            Map<String, Double> vector = new HashMap<>();
            double norm = 0.0;
            for (Map.Entry<String, Integer> term : counts.entrySet()) {
                double idf = Math.log((1.0 + n) / (1.0 + documentFrequency.get(term.getKey()))) + 1.0;
                double weight = term.getValue() * idf;
                vector.put(term.getKey(), weight);
                norm += weight * weight;
            }
            double length = Math.sqrt(norm);
            if (length > 0) {
                vector.replaceAll((term, weight) -> weight / length);
            }
            vectors.put(id, vector);
        });

        return (firstId, secondId) -> cosine(vectors.get(firstId), vectors.get(secondId));
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static BigDecimal cosine(Map<String, Double> first, Map<String, Double> second) {
        if (first == null || second == null || first.isEmpty() || second.isEmpty()) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        Map<String, Double> smaller = first.size() <= second.size() ? first : second;
        Map<String, Double> larger = smaller == first ? second : first;
        double dot = 0.0;
        for (Map.Entry<String, Double> term : smaller.entrySet()) {
            Double other = larger.get(term.getKey());
            if (other != null) {
                dot += term.getValue() * other;
            }
        }
        double bounded = Math.max(0.0, Math.min(1.0, dot));
        return BigDecimal.valueOf(bounded).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
