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

import me.golemcore.pipeline.domain.model.AgentConfiguration;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

public interface AgentConfigurationRepository {

    Optional<AgentConfiguration> findByName(String agentName);

    /**
     * Return the stored configuration, inserting the defaults first when the
     * agent has none.
     */
    AgentConfiguration getOrCreate(String agentName, Supplier<AgentConfiguration> defaults);

    AgentConfiguration update(String agentName, UnaryOperator<AgentConfiguration> mutation);

    List<AgentConfiguration> findAll();
}
