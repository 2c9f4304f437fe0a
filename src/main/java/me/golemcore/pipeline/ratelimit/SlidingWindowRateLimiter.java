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
import me.golemcore.pipeline.domain.service.Sleeper;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window rate limiter keyed by source id.
 *
 * <p>
 * Maintains one {@link SlidingWindow} per configured source in a concurrent
 * map; each window is its own lock, so sources never contend. Built-in
 * defaults:
 * <ul>
 * <li><b>reddit</b> - 60 requests per 60s</li>
 * <li><b>hackernews</b> - 30 requests per 60s</li>
 * <li><b>firecrawl</b> - 10 requests per 60s</li>
 * <li><b>google_trends</b> - 30 requests per 60s</li>
 * <li><b>twitter</b> - 450 requests per 900s</li>
 * <li><b>product_hunt</b> - 30 requests per 60s</li>
 * </ul>
 * Entries under {@code pipeline.rate-limit.sources.*} override or extend them.
 *
 * <p>
 * Can be disabled via {@code pipeline.rate-limit.enabled=false}.
 *
 * @since 1.0
 * @see SlidingWindow
 */
@Component
@Slf4j
public class SlidingWindowRateLimiter implements SourceRateLimiter {

    static final Map<String, WindowLimit> DEFAULT_LIMITS = defaultLimits();

    private final boolean enabled;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, SlidingWindow> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(PipelineProperties properties, Clock clock, Sleeper sleeper) {
        this.enabled = properties.getRateLimit().isEnabled();
        this.clock = clock;
        this.sleeper = sleeper;
        DEFAULT_LIMITS.forEach((source, limit) -> windows.put(source, new SlidingWindow(limit)));
        properties.getRateLimit().getSources().forEach((source, window) -> configure(source,
                new WindowLimit(window.getRequests(), window.getWindowSeconds(),
                        window.getName() != null ? window.getName() : source)));
        log.info("[RateLimit] {} source windows configured (enabled={})", windows.size(), enabled);
    }

    @Override
    public RateLimitResult acquire(String source) {
        SlidingWindow window = windows.get(source);
        if (!enabled || window == null) {
            return RateLimitResult.unlimited();
        }
        RateLimitResult result = window.tryAcquire(clock.instant());
        if (!result.isAllowed()) {
            log.debug("[RateLimit] {} at capacity, wait {}ms", source, result.getWaitTime().toMillis());
        }
        return result;
    }

    @Override
    public Duration acquireBlocking(String source) throws InterruptedException {
        Duration waited = Duration.ZERO;
        while (true) {
            RateLimitResult result = acquire(source);
            if (result.isAllowed()) {
                return waited;
            }
            Duration wait = result.getWaitTime();
            log.info("[RateLimit] Rate limit reached for {}, waiting {}ms", source, wait.toMillis());
            sleeper.sleep(wait);
            SlidingWindow window = windows.get(source);
            if (window != null) {
                window.recordWait(wait);
            }
            waited = waited.plus(wait);
        }
    }

    @Override
    public int getRemaining(String source) {
        SlidingWindow window = windows.get(source);
        if (!enabled || window == null) {
            return RateLimitResult.UNLIMITED;
        }
        return window.remaining(clock.instant());
    }

    @Override
    public Optional<RateLimitStatus> getStatus(String source) {
        SlidingWindow window = windows.get(source);
        if (window == null) {
            return Optional.empty();
        }
        return Optional.of(window.status(source, clock.instant()));
    }

    @Override
    public Map<String, RateLimitStatus> getAllStatuses() {
        Map<String, RateLimitStatus> statuses = new TreeMap<>();
        windows.forEach((source, window) -> statuses.put(source, window.status(source, clock.instant())));
        return statuses;
    }

    @Override
    public void configure(String source, WindowLimit limit) {
        windows.compute(source, (key, existing) -> {
            if (existing != null && existing.limit().equals(limit)) {
                return existing;
            }
            return new SlidingWindow(limit);
        });
        log.debug("[RateLimit] Configured {}: {} requests per {}s", source, limit.maxRequests(),
                limit.windowSeconds());
    }

    @Override
    public void reset(String source) {
        SlidingWindow window = windows.get(source);
        if (window != null) {
            window.reset();
            log.info("[RateLimit] Reset window for {}", source);
        }
    }

    @Override
    public void resetAll() {
        windows.values().forEach(SlidingWindow::reset);
        log.info("[RateLimit] Reset all windows");
    }

    private static Map<String, WindowLimit> defaultLimits() {
        Map<String, WindowLimit> limits = new LinkedHashMap<>();
        limits.put("reddit", new WindowLimit(60, 60, "Reddit API"));
        limits.put("hackernews", new WindowLimit(30, 60, "Hacker News Search"));
        limits.put("firecrawl", new WindowLimit(10, 60, "Firecrawl"));
        limits.put("google_trends", new WindowLimit(30, 60, "Google Trends"));
        limits.put("twitter", new WindowLimit(450, 900, "Twitter API"));
        limits.put("product_hunt", new WindowLimit(30, 60, "Product Hunt"));
        return Map.copyOf(limits);
    }
}
