package me.golemcore.pipeline.adapter.outbound.storage;

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
import me.golemcore.pipeline.port.outbound.SimilarityRepository;
import me.golemcore.pipeline.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Repository
public class JsonSimilarityRepository extends JsonDocumentRepository<ContentSimilarity>
        implements SimilarityRepository {

    public JsonSimilarityRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, "similarity", "pairs.json", ContentSimilarity.class);
    }

    @Override
    public Optional<ContentSimilarity> insertIfAbsent(ContentSimilarity similarity) {
        return write(items -> {
            ContentSimilarity stored = canonical(copy(similarity));
            String key = stored.pairKey();
            boolean known = items.stream().anyMatch(existing -> existing.pairKey().equals(key));
            if (known) {
                return Optional.<ContentSimilarity>empty();
            }
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            items.add(stored);
            return Optional.of(copy(stored));
        });
    }

    @Override
    public Optional<ContentSimilarity> findById(String id) {
        return read(items -> items.stream()
                .filter(s -> s.getId().equals(id))
                .findFirst()
                .map(this::copy));
    }

    @Override
    public List<ContentSimilarity> findAll() {
        return read(this::copyAll);
    }

    @Override
    public ContentSimilarity update(String id, UnaryOperator<ContentSimilarity> mutation) {
        return write(items -> {
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).getId().equals(id)) {
                    ContentSimilarity updated = mutation.apply(copy(items.get(i)));
                    items.set(i, updated);
                    return copy(updated);
                }
            }
            throw new IllegalArgumentException("Similarity record not found: " + id);
        });
    }

    @Override
    public int deleteUnresolvedByInsightId(String insightId) {
        return write(items -> {
            int before = items.size();
            items.removeIf(s -> !s.isResolved() && s.involves(insightId));
            return before - items.size();
        });
    }

    private static ContentSimilarity canonical(ContentSimilarity similarity) {
        String source = similarity.getSourceInsightId();
        String similar = similarity.getSimilarInsightId();
        if (source.compareTo(similar) > 0) {
            similarity.setSourceInsightId(similar);
            similarity.setSimilarInsightId(source);
        }
        return similarity;
    }
}
