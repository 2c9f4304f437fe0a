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

import me.golemcore.pipeline.domain.model.AgentConfiguration;
import me.golemcore.pipeline.domain.model.TriggerKind;
import lombok.Getter;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-run view handed to an agent.
 */
@Getter
public class AgentRunContext {

    private final AgentConfiguration configuration;
    private final TriggerKind trigger;
    private final String executionLogId;
    private final Supplier<Optional<String>> budgetCheck;

    public AgentRunContext(AgentConfiguration configuration, TriggerKind trigger, String executionLogId,
            Supplier<Optional<String>> budgetCheck) {
        this.configuration = configuration;
        this.trigger = trigger;
        this.executionLogId = executionLogId;
        this.budgetCheck = budgetCheck;
    }

    /**
     * Re-check the hourly call ceiling and the daily cost ceiling.
     *
     * @return the exceeded limit as a skip reason, or empty when within budget
     */
    public Optional<String> budgetExceeded() {
        return budgetCheck.get();
    }
}
