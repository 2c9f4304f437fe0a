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

import me.golemcore.pipeline.domain.model.RawSignal;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RawSignalRepository {

    /**
     * Insert a new signal, assigning id and creation time when absent.
     *
     * @throws me.golemcore.pipeline.domain.exception.DuplicateContentException
     *             when a signal with the same non-null content hash exists
     */
    RawSignal insert(RawSignal signal);

    Optional<RawSignal> findById(String id);

    Optional<RawSignal> findByContentHash(String contentHash);

    boolean existsBySourceAndUrl(String source, String url);

    /**
     * Unprocessed signals, oldest first.
     */
    List<RawSignal> findUnprocessed(int limit);

    int markProcessed(Collection<String> ids);

    /**
     * Remove signals created before the cutoff.
     *
     * @return ids of the removed signals
     */
    List<String> purgeOlderThan(Instant cutoff);

    long count();
}
