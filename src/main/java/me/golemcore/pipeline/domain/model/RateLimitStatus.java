package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Side-effect free snapshot of one source window and its counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitStatus {

    private String source;
    private String name;
    private int limit;
    private int windowSeconds;
    private int currentWindowCount;
    private int remaining;
    private Duration resetIn;
    private long totalRequests;
    private long totalDenied;
    private long totalWaits;
    private long totalWaitMs;
}
