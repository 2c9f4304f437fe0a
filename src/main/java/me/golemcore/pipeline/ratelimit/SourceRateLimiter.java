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
import java.util.Map;
import java.util.Optional;

/**
 * Per-source throttle for calls to external APIs. Sources are independent:
 * acquiring for one never blocks another.
 */
public interface SourceRateLimiter {

    /**
     * Record a request if the window has room. When it is full nothing is
     * recorded and the result carries the wait until the oldest request ages
     * out. Unconfigured sources always succeed.
     */
    RateLimitResult acquire(String source);

    /**
     * Wait as needed until a request is recorded.
     *
     * @return total time waited
     */
    Duration acquireBlocking(String source) throws InterruptedException;

    /**
     * Slots left in the current window, {@code -1} for unlimited sources.
     */
    int getRemaining(String source);

    Optional<RateLimitStatus> getStatus(String source);

    Map<String, RateLimitStatus> getAllStatuses();

    void configure(String source, WindowLimit limit);

    void reset(String source);

    void resetAll();
}
