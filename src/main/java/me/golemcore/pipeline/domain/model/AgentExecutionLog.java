package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit row of one agent run. Created as {@code RUNNING} and finished exactly
 * once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentExecutionLog {

    private String id;
    private String agentType;
    private String source;

    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private int itemsProcessed;
    private int itemsFailed;
    private String errorMessage;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
