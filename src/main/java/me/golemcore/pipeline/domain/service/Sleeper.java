package me.golemcore.pipeline.domain.service;

import java.time.Duration;

/**
 * Blocking wait used for rate-limit and retry backoff. Tests substitute an
 * implementation that advances a clock instead.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
