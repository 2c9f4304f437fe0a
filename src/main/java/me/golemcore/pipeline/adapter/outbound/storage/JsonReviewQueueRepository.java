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

import me.golemcore.pipeline.domain.model.ContentReviewEntry;
import me.golemcore.pipeline.domain.model.ContentType;
import me.golemcore.pipeline.port.outbound.ReviewQueueRepository;
import me.golemcore.pipeline.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Repository
public class JsonReviewQueueRepository extends JsonDocumentRepository<ContentReviewEntry>
        implements ReviewQueueRepository {

    public JsonReviewQueueRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, "review", "queue.json", ContentReviewEntry.class);
    }

    @Override
    public ContentReviewEntry compute(ContentType contentType, String contentId,
            UnaryOperator<ContentReviewEntry> remapping) {
        return write(items -> {
            int index = indexOf(items, contentType, contentId);
            ContentReviewEntry current = index >= 0 ? copy(items.get(index)) : null;
            ContentReviewEntry next = remapping.apply(current);
            if (next == null) {
                throw new IllegalStateException("Review entry remapping returned null");
            }
            next.setContentType(contentType);
            next.setContentId(contentId);
            if (next.getId() == null) {
                next.setId(current != null ? current.getId() : UUID.randomUUID().toString());
            }
            if (index >= 0) {
                items.set(index, next);
            } else {
                items.add(next);
            }
            return copy(next);
        });
    }

    @Override
    public ContentReviewEntry update(String id, UnaryOperator<ContentReviewEntry> mutation) {
        return write(items -> {
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).getId().equals(id)) {
                    ContentReviewEntry updated = mutation.apply(copy(items.get(i)));
                    items.set(i, updated);
                    return copy(updated);
                }
            }
            throw new IllegalArgumentException("Review entry not found: " + id);
        });
    }

    @Override
    public Optional<ContentReviewEntry> findById(String id) {
        return read(items -> items.stream()
                .filter(e -> e.getId().equals(id))
                .findFirst()
                .map(this::copy));
    }

    @Override
    public Optional<ContentReviewEntry> findByContent(ContentType contentType, String contentId) {
        return read(items -> {
            int index = indexOf(items, contentType, contentId);
            return index >= 0 ? Optional.of(copy(items.get(index))) : Optional.empty();
        });
    }

    @Override
    public List<ContentReviewEntry> findAll() {
        return read(this::copyAll);
    }

    @Override
    public int deleteByContent(ContentType contentType, String contentId) {
        return write(items -> {
            int before = items.size();
            items.removeIf(e -> e.matches(contentType, contentId));
            return before - items.size();
        });
    }

    private static int indexOf(List<ContentReviewEntry> items, ContentType contentType, String contentId) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).matches(contentType, contentId)) {
                return i;
            }
        }
        return -1;
    }
}
