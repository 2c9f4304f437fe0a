package me.golemcore.pipeline.agent;

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

import me.golemcore.pipeline.domain.model.AgentRunResult;

/**
 * A unit of pipeline work that the scheduler can run by name. Every run is
 * wrapped by {@link AgentRunService}, which writes the execution log.
 */
public interface PipelineAgent {

    String name();

    /**
     * Do one batch of work. Exceptions fail the run; partial progress belongs
     * in the returned counts.
     */
    AgentRunResult run(AgentRunContext context);
}
