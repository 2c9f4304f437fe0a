package me.golemcore.pipeline.ratelimit;

/**
 * At most {@code maxRequests} within any rolling {@code windowSeconds}.
 */
public record WindowLimit(int maxRequests, int windowSeconds, String name) {

    public WindowLimit {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1, got " + maxRequests);
        }
        if (windowSeconds < 1) {
            throw new IllegalArgumentException("windowSeconds must be >= 1, got " + windowSeconds);
        }
    }
}
