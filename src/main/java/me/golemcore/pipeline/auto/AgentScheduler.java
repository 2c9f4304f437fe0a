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

package me.golemcore.pipeline.auto;

import me.golemcore.pipeline.agent.AgentRunService;
import me.golemcore.pipeline.domain.model.AgentConfiguration;
import me.golemcore.pipeline.domain.model.TriggerKind;
import me.golemcore.pipeline.domain.service.AgentConfigurationService;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background scheduler that periodically dispatches due agents.
 *
 * <p>
 * This component runs a background thread that:
 * <ul>
 * <li>Ticks at a configurable interval (default 30 seconds)</li>
 * <li>Asks {@link AgentConfigurationService} which agents are due</li>
 * <li>Hands each due agent to a worker pool through
 * {@link AgentRunService}</li>
 * </ul>
 *
 * <p>
 * If a tick is already dispatching, subsequent ticks are skipped. An agent
 * that is still running is not dispatched again. Disabling an agent does not
 * stop a run already in progress; it only keeps the next one from doing work.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class AgentScheduler {

    private final AgentRunService agentRunService;
    private final AgentConfigurationService configurationService;
    private final PipelineProperties.SchedulerProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;
    private ExecutorService workers;
    private Executor dispatcher;

    @Autowired
    public AgentScheduler(AgentRunService agentRunService, AgentConfigurationService configurationService,
            PipelineProperties properties) {
        this.agentRunService = agentRunService;
        this.configurationService = configurationService;
        this.properties = properties.getScheduler();
    }

    AgentScheduler(AgentRunService agentRunService, AgentConfigurationService configurationService,
            PipelineProperties properties, Executor dispatcher) {
        this(agentRunService, configurationService, properties);
        this.dispatcher = dispatcher;
    }

    @PostConstruct
    public void init() {
        if (!properties.isEnabled()) {
            log.info("[AgentScheduler] Scheduler disabled");
            return;
        }

        AtomicInteger workerIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(properties.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "agent-worker-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        dispatcher = workers;

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agent-scheduler");
            t.setDaemon(true);
            return t;
        });

        int tickIntervalSeconds = properties.getTickIntervalSeconds();
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                tickIntervalSeconds,
                tickIntervalSeconds,
                TimeUnit.SECONDS);

        log.info("[AgentScheduler] Started with tick interval: {}s, {} workers", tickIntervalSeconds,
                properties.getWorkerThreads());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        shutdownExecutor(scheduler);
        shutdownExecutor(workers);
        log.info("[AgentScheduler] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[AgentScheduler] Tick skipped: previous dispatch still in progress");
            return;
        }
        try {
            List<AgentConfiguration> due = configurationService.findDue(agentRunService.agentNames());
            if (due.isEmpty()) {
                return;
            }
            log.info("[AgentScheduler] Tick: {} due agents", due.size());
            for (AgentConfiguration configuration : due) {
                dispatch(configuration.getAgentName());
            }
        } catch (RuntimeException e) {
            log.error("[AgentScheduler] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    boolean isInFlight(String agentName) {
        return inFlight.contains(agentName);
    }

    private void dispatch(String agentName) {
        if (!inFlight.add(agentName)) {
            log.debug("[AgentScheduler] {} still running, not dispatched", agentName);
            return;
        }
        try {
            dispatcher.execute(() -> {
                try {
                    agentRunService.run(agentName, TriggerKind.SCHEDULED);
                } catch (RuntimeException e) {
                    log.error("[AgentScheduler] Run of {} failed: {}", agentName, e.getMessage(), e);
                } finally {
                    inFlight.remove(agentName);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(agentName);
            log.warn("[AgentScheduler] {} not dispatched: {}", agentName, e.getMessage());
        }
    }

    private static void shutdownExecutor(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
