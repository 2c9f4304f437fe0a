package me.golemcore.pipeline.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pipeline.domain.model.RateLimitResult;
import me.golemcore.pipeline.domain.model.RateLimitStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Thread-safe rolling window of request timestamps for one source.
 *
 * <p>
 * A timestamp {@code t} is inside the window at {@code now} while
 * {@code t > now - window}. Expired timestamps are evicted lazily on each
 * call, oldest first.
 *
 * @since 1.0
 */
class SlidingWindow {

    private final WindowLimit limit;
    private final Duration window;
    private final Deque<Instant> timestamps = new ArrayDeque<>();

    private long totalRequests;
    private long totalDenied;
    private long totalWaits;
    private long totalWaitMs;

    SlidingWindow(WindowLimit limit) {
        this.limit = limit;
        this.window = Duration.ofSeconds(limit.windowSeconds());
    }

    WindowLimit limit() {
        return limit;
    }

    synchronized RateLimitResult tryAcquire(Instant now) {
        evict(now);
        if (timestamps.size() < limit.maxRequests()) {
            timestamps.addLast(now);
            totalRequests++;
            return RateLimitResult.allowed(limit.maxRequests() - timestamps.size());
        }
        totalDenied++;
        return RateLimitResult.denied(waitUntilFree(now), "Rate limit exceeded for " + limit.name());
    }

    synchronized void recordWait(Duration waited) {
        totalWaits++;
        totalWaitMs += waited.toMillis();
    }

    synchronized int remaining(Instant now) {
        evict(now);
        return limit.maxRequests() - timestamps.size();
    }

    synchronized RateLimitStatus status(String source, Instant now) {
        evict(now);
        Duration resetIn = waitUntilFree(now);
        return RateLimitStatus.builder()
                .source(source)
                .name(limit.name())
                .limit(limit.maxRequests())
                .windowSeconds(limit.windowSeconds())
                .currentWindowCount(timestamps.size())
                .remaining(limit.maxRequests() - timestamps.size())
                .resetIn(resetIn)
                .totalRequests(totalRequests)
                .totalDenied(totalDenied)
                .totalWaits(totalWaits)
                .totalWaitMs(totalWaitMs)
                .build();
    }

    synchronized void reset() {
        timestamps.clear();
        totalRequests = 0;
        totalDenied = 0;
        totalWaits = 0;
        totalWaitMs = 0;
    }

    private void evict(Instant now) {
        Instant windowStart = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(windowStart)) {
            timestamps.removeFirst();
        }
    }

    private Duration waitUntilFree(Instant now) {
        Instant oldest = timestamps.peekFirst();
        if (oldest == null) {
            return Duration.ZERO;
        }
        Duration wait = Duration.between(now, oldest.plus(window));
        return wait.isNegative() ? Duration.ZERO : wait;
    }
}
