package me.golemcore.pipeline.auto;

import me.golemcore.pipeline.agent.AgentRunService;
import me.golemcore.pipeline.domain.model.AgentConfiguration;
import me.golemcore.pipeline.domain.model.TriggerKind;
import me.golemcore.pipeline.domain.service.AgentConfigurationService;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentSchedulerTest {

    private static final Set<String> AGENTS = Set.of("signal_collector", "signal_analyzer");

    private AgentRunService agentRunService;
    private AgentConfigurationService configurationService;
    private Deque<Runnable> queued;
    private AgentScheduler scheduler;

    @BeforeEach
    void setUp() {
        agentRunService = mock(AgentRunService.class);
        configurationService = mock(AgentConfigurationService.class);
        when(agentRunService.agentNames()).thenReturn(AGENTS);
        queued = new ArrayDeque<>();
        scheduler = new AgentScheduler(agentRunService, configurationService, new PipelineProperties(),
                queued::add);
    }

    @Test
    void shouldDispatchEveryDueAgent() {
        when(configurationService.findDue(AGENTS)).thenReturn(List.of(due("signal_collector"),
                due("signal_analyzer")));

        scheduler.tick();
        runQueued();

        verify(agentRunService).run("signal_collector", TriggerKind.SCHEDULED);
        verify(agentRunService).run("signal_analyzer", TriggerKind.SCHEDULED);
    }

    @Test
    void shouldDoNothingWhenNothingIsDue() {
        when(configurationService.findDue(AGENTS)).thenReturn(List.of());

        scheduler.tick();

        assertTrue(queued.isEmpty());
        verify(agentRunService, never()).run(anyString(), any());
    }

    @Test
    void shouldNotDispatchAgentThatIsStillRunning() {
        when(configurationService.findDue(AGENTS)).thenReturn(List.of(due("signal_collector")));

        scheduler.tick();
        scheduler.tick();

        assertEquals(1, queued.size());
        assertTrue(scheduler.isInFlight("signal_collector"));

        runQueued();
        assertFalse(scheduler.isInFlight("signal_collector"));

        scheduler.tick();
        runQueued();
        verify(agentRunService, times(2)).run("signal_collector", TriggerKind.SCHEDULED);
    }

    @Test
    void failedRunShouldReleaseAgent() {
        when(configurationService.findDue(AGENTS)).thenReturn(List.of(due("signal_collector")));
        when(agentRunService.run("signal_collector", TriggerKind.SCHEDULED))
                .thenThrow(new IllegalStateException("storage unavailable"));

        scheduler.tick();
        runQueued();

        assertFalse(scheduler.isInFlight("signal_collector"));
    }

    @Test
    void tickShouldSurviveConfigurationFailure() {
        when(configurationService.findDue(AGENTS))
                .thenThrow(new IllegalStateException("corrupt document"))
                .thenReturn(List.of(due("signal_analyzer")));

        assertDoesNotThrow(() -> scheduler.tick());
        assertTrue(queued.isEmpty());

        scheduler.tick();
        assertEquals(1, queued.size());
    }

    @Test
    void rejectedDispatchShouldReleaseAgent() {
        AgentScheduler rejecting = new AgentScheduler(agentRunService, configurationService,
                new PipelineProperties(), task -> {
                    throw new RejectedExecutionException("pool shut down");
                });
        when(configurationService.findDue(AGENTS)).thenReturn(List.of(due("signal_collector")));

        rejecting.tick();

        assertFalse(rejecting.isInFlight("signal_collector"));
    }

    private void runQueued() {
        while (!queued.isEmpty()) {
            queued.poll().run();
        }
    }

    private static AgentConfiguration due(String agentName) {
        return AgentConfiguration.builder().agentName(agentName).build();
    }
}
