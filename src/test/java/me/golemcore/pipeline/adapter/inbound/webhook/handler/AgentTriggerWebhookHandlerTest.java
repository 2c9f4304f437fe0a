package me.golemcore.pipeline.adapter.inbound.webhook.handler;

import me.golemcore.pipeline.agent.AgentRunService;
import me.golemcore.pipeline.domain.model.AgentExecutionLog;
import me.golemcore.pipeline.domain.model.ExecutionStatus;
import me.golemcore.pipeline.domain.model.TriggerKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentTriggerWebhookHandlerTest {

    private AgentRunService agentRunService;
    private AgentTriggerWebhookHandler handler;

    @BeforeEach
    void setUp() {
        agentRunService = mock(AgentRunService.class);
        handler = new AgentTriggerWebhookHandler(agentRunService);
    }

    @Test
    void shouldRunAgentWithWebhookTrigger() {
        when(agentRunService.run("signal_analyzer", TriggerKind.WEBHOOK)).thenReturn(AgentExecutionLog.builder()
                .id("log-9")
                .agentType("signal_analyzer")
                .status(ExecutionStatus.COMPLETED)
                .itemsProcessed(4)
                .build());

        Map<String, Object> result = handler.handle(Map.of("data", Map.of("agent", "signal_analyzer")));

        assertEquals("signal_analyzer", result.get("agent"));
        assertEquals("log-9", result.get("execution_log_id"));
        assertEquals("COMPLETED", result.get("status"));
        assertEquals(4, result.get("items_processed"));
    }

    @Test
    void shouldRejectMissingAgentName() {
        assertThrows(IllegalArgumentException.class, () -> handler.handle(Map.of("data", Map.of())));
        assertThrows(IllegalArgumentException.class, () -> handler.handle(Map.of()));
        verify(agentRunService, never()).run(anyString(), any());
    }

    @Test
    void shouldHandleAgentTriggerEvents() {
        assertEquals("agent.trigger", handler.eventType());
    }
}
