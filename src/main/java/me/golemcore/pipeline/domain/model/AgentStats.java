package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStats {

    private String agentType;
    private Duration period;
    private long totalRuns;
    private long completedRuns;
    private long failedRuns;
    private long skippedRuns;
    private long averageDurationMs;
    private long itemsProcessed;
    private long itemsFailed;
}
