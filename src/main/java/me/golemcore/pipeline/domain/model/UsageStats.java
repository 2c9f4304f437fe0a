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
public class UsageStats {

    private String key;
    private Duration period;
    private long totalCalls;
    private long failedCalls;
    private long totalInputTokens;
    private long totalOutputTokens;
    private long totalTokens;
    private Duration avgLatency;
    private double totalCostUsd;
}
