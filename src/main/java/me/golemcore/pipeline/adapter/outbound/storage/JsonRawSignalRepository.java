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

import me.golemcore.pipeline.domain.exception.DuplicateContentException;
import me.golemcore.pipeline.domain.model.RawSignal;
import me.golemcore.pipeline.port.outbound.RawSignalRepository;
import me.golemcore.pipeline.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
public class JsonRawSignalRepository extends JsonDocumentRepository<RawSignal> implements RawSignalRepository {

    public JsonRawSignalRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, "signals", "signals.json", RawSignal.class);
    }

    @Override
    public RawSignal insert(RawSignal signal) {
        return write(items -> {
            String hash = signal.getContentHash();
            if (hash != null) {
                for (RawSignal existing : items) {
                    if (hash.equals(existing.getContentHash())) {
                        throw new DuplicateContentException(hash, existing.getId());
                    }
                }
            }
            RawSignal stored = copy(signal);
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            items.add(stored);
            return copy(stored);
        });
    }

    @Override
    public Optional<RawSignal> findById(String id) {
        return read(items -> items.stream()
                .filter(s -> s.getId().equals(id))
                .findFirst()
                .map(this::copy));
    }

    @Override
    public Optional<RawSignal> findByContentHash(String contentHash) {
        if (contentHash == null) {
            return Optional.empty();
        }
        return read(items -> items.stream()
                .filter(s -> contentHash.equals(s.getContentHash()))
                .findFirst()
                .map(this::copy));
    }

    @Override
    public boolean existsBySourceAndUrl(String source, String url) {
        if (url == null) {
            return false;
        }
        return read(items -> items.stream()
                .anyMatch(s -> Objects.equals(s.getSource(), source) && url.equals(s.getUrl())));
    }

    @Override
    public List<RawSignal> findUnprocessed(int limit) {
        return read(items -> copyAll(items.stream()
                .filter(s -> !s.isProcessed())
                .sorted(Comparator.comparing(RawSignal::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(limit)
                .toList()));
    }

    @Override
    public int markProcessed(Collection<String> ids) {
        Set<String> targets = new HashSet<>(ids);
        return write(items -> {
            int marked = 0;
            for (RawSignal signal : items) {
                if (targets.contains(signal.getId()) && !signal.isProcessed()) {
                    signal.setProcessed(true);
                    marked++;
                }
            }
            return marked;
        });
    }

    @Override
    public List<String> purgeOlderThan(Instant cutoff) {
        return write(items -> {
            List<String> removed = new ArrayList<>();
            Iterator<RawSignal> iterator = items.iterator();
            while (iterator.hasNext()) {
                RawSignal signal = iterator.next();
                if (signal.getCreatedAt() != null && signal.getCreatedAt().isBefore(cutoff)) {
                    removed.add(signal.getId());
                    iterator.remove();
                }
            }
            return removed;
        });
    }

    @Override
    public long count() {
        return read(items -> (long) items.size());
    }
}
