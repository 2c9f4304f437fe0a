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

package me.golemcore.pipeline.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff around a single call.
 *
 * <p>
 * The backoff after the n-th failed attempt is
 * {@code min(maxBackoff, max(initialBackoff, initialBackoff * multiplier^(n-1)))}.
 */
@Getter
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;
    private final Predicate<Throwable> retryable;

    @Builder
    private RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier,
            Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff != null ? initialBackoff : Duration.ZERO;
        this.maxBackoff = maxBackoff != null ? maxBackoff : this.initialBackoff;
        this.multiplier = multiplier > 0 ? multiplier : 1.0;
        this.retryable = retryable != null ? retryable : t -> false;
    }

    public Duration backoff(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("attempt numbers start at 1");
        }
        double initialMs = initialBackoff.toMillis();
        double exponential = initialMs * Math.pow(multiplier, failedAttempt - 1);
        long millis = (long) Math.min(maxBackoff.toMillis(), Math.max(initialMs, exponential));
        return Duration.ofMillis(millis);
    }

    public boolean isRetryable(Throwable throwable) {
        return throwable != null && retryable.test(throwable);
    }

    public boolean shouldRetry(Throwable throwable, int failedAttempt) {
        return failedAttempt < maxAttempts && isRetryable(throwable);
    }
}
