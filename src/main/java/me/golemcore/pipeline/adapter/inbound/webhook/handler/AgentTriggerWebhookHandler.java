package me.golemcore.pipeline.adapter.inbound.webhook.handler;

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

import me.golemcore.pipeline.agent.AgentRunService;
import me.golemcore.pipeline.domain.model.AgentExecutionLog;
import me.golemcore.pipeline.domain.model.TriggerKind;
import me.golemcore.pipeline.port.inbound.WebhookEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs an agent on request: {@code {"data": {"agent": "signal_analyzer"}}}.
 * The run goes through the same wrapper as scheduled runs.
 */
@Component
@RequiredArgsConstructor
public class AgentTriggerWebhookHandler implements WebhookEventHandler {

    public static final String EVENT_TYPE = "agent.trigger";

    private final AgentRunService agentRunService;

    @Override
    public String eventType() {
        return EVENT_TYPE;
    }

    @Override
    public Map<String, Object> handle(Map<String, Object> payload) {
        String agentName = WebhookPayloads.requireString(WebhookPayloads.requireData(payload), "agent");
        AgentExecutionLog execution = agentRunService.run(agentName, TriggerKind.WEBHOOK);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("agent", agentName);
        result.put("execution_log_id", execution.getId());
        result.put("status", execution.getStatus().name());
        result.put("items_processed", execution.getItemsProcessed());
        return result;
    }
}
