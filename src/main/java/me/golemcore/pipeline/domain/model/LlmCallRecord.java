package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Telemetry of one generation attempt, successful or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmCallRecord {

    private Instant timestamp;
    private String providerId;
    private String model;
    private String agentName;
    private String signalId;
    private int attempt;
    private int inputTokens;
    private int outputTokens;
    private int totalTokens;
    private Duration latency;
    private boolean success;
    private String errorType;
    private double costUsd;
}
