package me.golemcore.pipeline.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Result of a rate limit check operation.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the request was recorded and may proceed</li>
 * <li>{@code remaining} - slots left in the current window, {@code -1} when
 * the source is unlimited</li>
 * <li>{@code waitTime} - if denied, how long until the oldest request ages
 * out; {@link Duration#ZERO} when allowed</li>
 * <li>{@code reason} - explanation for denial</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class RateLimitResult {

    public static final int UNLIMITED = -1;

    private boolean allowed;
    private int remaining;
    private Duration waitTime;
    private String reason;

    public static RateLimitResult allowed(int remaining) {
        return RateLimitResult.builder()
                .allowed(true)
                .remaining(remaining)
                .waitTime(Duration.ZERO)
                .build();
    }

    public static RateLimitResult unlimited() {
        return allowed(UNLIMITED);
    }

    public static RateLimitResult denied(Duration waitTime, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .remaining(0)
                .waitTime(waitTime)
                .reason(reason)
                .build();
    }

    /**
     * Wait in fractional seconds, {@code 0} when allowed.
     */
    public double waitSeconds() {
        return waitTime == null ? 0.0 : waitTime.toMillis() / 1000.0;
    }
}
