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

import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.port.outbound.InsightRepository;
import me.golemcore.pipeline.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
public class JsonInsightRepository extends JsonDocumentRepository<Insight> implements InsightRepository {

    public JsonInsightRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, "insights", "insights.json", Insight.class);
    }

    @Override
    public Insight save(Insight insight) {
        return write(items -> {
            Insight stored = copy(insight);
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            items.removeIf(existing -> existing.getId().equals(stored.getId()));
            items.add(stored);
            return copy(stored);
        });
    }

    @Override
    public Optional<Insight> findById(String id) {
        return read(items -> items.stream()
                .filter(i -> i.getId().equals(id))
                .findFirst()
                .map(this::copy));
    }

    @Override
    public List<Insight> findAll() {
        return read(this::copyAll);
    }

    @Override
    public List<Insight> findCreatedSince(Instant since) {
        return read(items -> copyAll(items.stream()
                .filter(i -> i.getCreatedAt() != null && !i.getCreatedAt().isBefore(since))
                .toList()));
    }

    @Override
    public List<Insight> findByRawSignalIds(Collection<String> rawSignalIds) {
        Set<String> ids = new HashSet<>(rawSignalIds);
        return read(items -> copyAll(items.stream()
                .filter(i -> ids.contains(i.getRawSignalId()))
                .toList()));
    }

    @Override
    public boolean deleteById(String id) {
        return write(items -> items.removeIf(i -> i.getId().equals(id)));
    }
}
