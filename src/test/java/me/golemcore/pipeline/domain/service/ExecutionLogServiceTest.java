package me.golemcore.pipeline.domain.service;

import me.golemcore.pipeline.adapter.outbound.storage.JsonExecutionLogRepository;
import me.golemcore.pipeline.domain.model.AgentExecutionLog;
import me.golemcore.pipeline.domain.model.AgentRunResult;
import me.golemcore.pipeline.domain.model.AgentStats;
import me.golemcore.pipeline.domain.model.ExecutionStatus;
import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.TriggerKind;
import me.golemcore.pipeline.infrastructure.config.PipelineConfiguration;
import me.golemcore.pipeline.testsupport.InMemoryStoragePort;
import me.golemcore.pipeline.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionLogServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private ExecutionLogService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FIXED_NOW);
        service = new ExecutionLogService(
                new JsonExecutionLogRepository(new InMemoryStoragePort(), PipelineConfiguration.objectMapper()),
                clock);
    }

    @Test
    void shouldStartRunningLog() {
        AgentExecutionLog log = service.start("signal_collector", TriggerKind.SCHEDULED);

        assertNotNull(log.getId());
        assertEquals(ExecutionStatus.RUNNING, log.getStatus());
        assertEquals("scheduled", log.getSource());
        assertEquals(FIXED_NOW, log.getStartedAt());
        assertNull(log.getCompletedAt());
    }

    @Test
    void shouldCompleteWithCountsAndDuration() {
        AgentExecutionLog started = service.start("signal_analyzer", TriggerKind.MANUAL);
        clock.advance(Duration.ofMillis(1500));

        AgentExecutionLog completed = service.complete(started.getId(), AgentRunResult.builder()
                .itemsProcessed(7)
                .itemsFailed(2)
                .metadata(Map.of(MetadataKeys.BUDGET_EXHAUSTED, true))
                .build());

        assertEquals(ExecutionStatus.COMPLETED, completed.getStatus());
        assertEquals(7, completed.getItemsProcessed());
        assertEquals(2, completed.getItemsFailed());
        assertEquals(1500L, completed.getDurationMs());
        assertEquals(true, completed.getMetadata().get(MetadataKeys.BUDGET_EXHAUSTED));
    }

    @Test
    void shouldFailWithTruncatedMessage() {
        AgentExecutionLog started = service.start("signal_analyzer", TriggerKind.WEBHOOK);

        AgentExecutionLog failed = service.fail(started.getId(), new IllegalStateException("x".repeat(5000)));

        assertEquals(ExecutionStatus.FAILED, failed.getStatus());
        assertEquals(2000, failed.getErrorMessage().length());
    }

    @Test
    void shouldUseExceptionNameWhenMessageMissing() {
        AgentExecutionLog started = service.start("signal_analyzer", TriggerKind.MANUAL);

        AgentExecutionLog failed = service.fail(started.getId(), new NullPointerException());

        assertEquals("NullPointerException", failed.getErrorMessage());
    }

    @Test
    void shouldSkipWithReason() {
        AgentExecutionLog started = service.start("signal_analyzer", TriggerKind.SCHEDULED);

        AgentExecutionLog skipped = service.skip(started.getId(), MetadataKeys.REASON_RATE_LIMIT_EXCEEDED,
                Map.of(MetadataKeys.CALLS_LAST_HOUR, 100));

        assertEquals(ExecutionStatus.SKIPPED, skipped.getStatus());
        assertEquals("rate_limit_exceeded", skipped.getMetadata().get(MetadataKeys.REASON));
        assertEquals(100, skipped.getMetadata().get(MetadataKeys.CALLS_LAST_HOUR));
    }

    @Test
    void shouldFinishLogOnlyOnce() {
        AgentExecutionLog started = service.start("signal_analyzer", TriggerKind.MANUAL);
        service.complete(started.getId(), AgentRunResult.empty());

        assertThrows(IllegalStateException.class, () -> service.fail(started.getId(), new RuntimeException("late")));
        assertThrows(IllegalArgumentException.class, () -> service.complete("missing", AgentRunResult.empty()));
    }

    @Test
    void recentShouldReturnNewestFirst() {
        AgentExecutionLog first = service.start("signal_collector", TriggerKind.SCHEDULED);
        clock.advance(Duration.ofMinutes(1));
        AgentExecutionLog second = service.start("signal_collector", TriggerKind.SCHEDULED);
        clock.advance(Duration.ofMinutes(1));
        service.start("signal_analyzer", TriggerKind.SCHEDULED);

        List<AgentExecutionLog> recent = service.recent("signal_collector", 10);

        assertEquals(List.of(second.getId(), first.getId()), recent.stream().map(AgentExecutionLog::getId).toList());
        assertEquals(2, service.recent(null, 2).size());
    }

    @Test
    void statsShouldAggregateRunsInPeriod() {
        AgentExecutionLog old = service.start("signal_analyzer", TriggerKind.SCHEDULED);
        service.complete(old.getId(), AgentRunResult.builder().itemsProcessed(50).build());
        clock.advance(Duration.ofHours(30));

        AgentExecutionLog completed = service.start("signal_analyzer", TriggerKind.SCHEDULED);
        clock.advance(Duration.ofSeconds(2));
        service.complete(completed.getId(), AgentRunResult.builder().itemsProcessed(4).itemsFailed(1).build());
        AgentExecutionLog failed = service.start("signal_analyzer", TriggerKind.SCHEDULED);
        clock.advance(Duration.ofSeconds(4));
        service.fail(failed.getId(), new IllegalStateException("boom"));
        AgentExecutionLog skipped = service.start("signal_analyzer", TriggerKind.SCHEDULED);
        clock.advance(Duration.ofSeconds(60));
        service.skip(skipped.getId(), MetadataKeys.REASON_AGENT_DISABLED, Map.of());

        AgentStats stats = service.stats("signal_analyzer", Duration.ofHours(24));

        assertEquals(3, stats.getTotalRuns());
        assertEquals(1, stats.getCompletedRuns());
        assertEquals(1, stats.getFailedRuns());
        assertEquals(1, stats.getSkippedRuns());
        assertEquals(3000, stats.getAverageDurationMs());
        assertEquals(4, stats.getItemsProcessed());
        assertEquals(1, stats.getItemsFailed());
    }
}
