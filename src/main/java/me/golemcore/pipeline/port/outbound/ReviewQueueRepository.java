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

import me.golemcore.pipeline.domain.model.ContentReviewEntry;
import me.golemcore.pipeline.domain.model.ContentType;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface ReviewQueueRepository {

    /**
     * Atomically create or update the single entry of a (content type,
     * content id) pair. The remapping function receives the current entry or
     * {@code null} and returns the entry to store.
     */
    ContentReviewEntry compute(ContentType contentType, String contentId,
            UnaryOperator<ContentReviewEntry> remapping);

    /**
     * Atomically update an existing entry.
     *
     * @throws IllegalArgumentException
     *             when no entry has the id
     */
    ContentReviewEntry update(String id, UnaryOperator<ContentReviewEntry> mutation);

    Optional<ContentReviewEntry> findById(String id);

    Optional<ContentReviewEntry> findByContent(ContentType contentType, String contentId);

    List<ContentReviewEntry> findAll();

    int deleteByContent(ContentType contentType, String contentId);
}
