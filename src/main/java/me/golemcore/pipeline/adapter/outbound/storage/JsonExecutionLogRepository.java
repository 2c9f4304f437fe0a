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

import me.golemcore.pipeline.domain.model.AgentExecutionLog;
import me.golemcore.pipeline.port.outbound.ExecutionLogRepository;
import me.golemcore.pipeline.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Repository
public class JsonExecutionLogRepository extends JsonDocumentRepository<AgentExecutionLog>
        implements ExecutionLogRepository {

    private static final Comparator<AgentExecutionLog> NEWEST_FIRST = Comparator.comparing(
            AgentExecutionLog::getStartedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    public JsonExecutionLogRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, "agents", "executions.json", AgentExecutionLog.class);
    }

    @Override
    public AgentExecutionLog create(AgentExecutionLog log) {
        return write(items -> {
            AgentExecutionLog stored = copy(log);
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            items.add(stored);
            return copy(stored);
        });
    }

    @Override
    public AgentExecutionLog update(String id, UnaryOperator<AgentExecutionLog> mutation) {
        return write(items -> {
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).getId().equals(id)) {
                    AgentExecutionLog updated = mutation.apply(copy(items.get(i)));
                    items.set(i, updated);
                    return copy(updated);
                }
            }
            throw new IllegalArgumentException("Execution log not found: " + id);
        });
    }

    @Override
    public Optional<AgentExecutionLog> findById(String id) {
        return read(items -> items.stream()
                .filter(l -> l.getId().equals(id))
                .findFirst()
                .map(this::copy));
    }

    @Override
    public List<AgentExecutionLog> findByAgentSince(String agentType, Instant since) {
        return read(items -> copyAll(items.stream()
                .filter(l -> l.getAgentType().equals(agentType))
                .filter(l -> l.getStartedAt() != null && !l.getStartedAt().isBefore(since))
                .sorted(NEWEST_FIRST)
                .toList()));
    }

    @Override
    public List<AgentExecutionLog> findRecent(String agentType, int limit) {
        return read(items -> copyAll(items.stream()
                .filter(l -> agentType == null || l.getAgentType().equals(agentType))
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList()));
    }
}
