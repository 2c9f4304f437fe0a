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

import me.golemcore.pipeline.domain.model.AgentExecutionLog;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface ExecutionLogRepository {

    AgentExecutionLog create(AgentExecutionLog log);

    AgentExecutionLog update(String id, UnaryOperator<AgentExecutionLog> mutation);

    Optional<AgentExecutionLog> findById(String id);

    List<AgentExecutionLog> findByAgentSince(String agentType, Instant since);

    /**
     * Most recent first; a null agent type matches every agent.
     */
    List<AgentExecutionLog> findRecent(String agentType, int limit);
}
