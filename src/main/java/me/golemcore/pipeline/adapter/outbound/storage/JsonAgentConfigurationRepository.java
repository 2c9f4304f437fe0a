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

import me.golemcore.pipeline.domain.model.AgentConfiguration;
import me.golemcore.pipeline.port.outbound.AgentConfigurationRepository;
import me.golemcore.pipeline.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

@Repository
public class JsonAgentConfigurationRepository extends JsonDocumentRepository<AgentConfiguration>
        implements AgentConfigurationRepository {

    public JsonAgentConfigurationRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, "agents", "configurations.json", AgentConfiguration.class);
    }

    @Override
    public Optional<AgentConfiguration> findByName(String agentName) {
        return read(items -> items.stream()
                .filter(c -> c.getAgentName().equals(agentName))
                .findFirst()
                .map(this::copy));
    }

    @Override
    public AgentConfiguration getOrCreate(String agentName, Supplier<AgentConfiguration> defaults) {
        Optional<AgentConfiguration> existing = findByName(agentName);
        if (existing.isPresent()) {
            return existing.get();
        }
        return write(items -> {
            for (AgentConfiguration configuration : items) {
                if (configuration.getAgentName().equals(agentName)) {
                    return copy(configuration);
                }
            }
            AgentConfiguration created = copy(defaults.get());
            created.setAgentName(agentName);
            items.add(created);
            return copy(created);
        });
    }

    @Override
    public AgentConfiguration update(String agentName, UnaryOperator<AgentConfiguration> mutation) {
        return write(items -> {
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).getAgentName().equals(agentName)) {
                    AgentConfiguration updated = mutation.apply(copy(items.get(i)));
                    items.set(i, updated);
                    return copy(updated);
                }
            }
            throw new IllegalArgumentException("Agent configuration not found: " + agentName);
        });
    }

    @Override
    public List<AgentConfiguration> findAll() {
        return read(items -> copyAll(items.stream()
                .sorted(Comparator.comparing(AgentConfiguration::getAgentName))
                .toList()));
    }
}
