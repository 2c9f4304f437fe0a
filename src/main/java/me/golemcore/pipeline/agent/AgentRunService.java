package me.golemcore.pipeline.agent;

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

import me.golemcore.pipeline.domain.model.AgentConfiguration;
import me.golemcore.pipeline.domain.model.AgentExecutionLog;
import me.golemcore.pipeline.domain.model.AgentRunResult;
import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.TriggerKind;
import me.golemcore.pipeline.domain.service.AgentConfigurationService;
import me.golemcore.pipeline.domain.service.ExecutionLogService;
import me.golemcore.pipeline.port.outbound.UsageTrackingPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs agents by name inside the execution-log wrapper.
 *
 * <p>
 * Every call produces exactly one finished log row: {@code COMPLETED} when the
 * agent returns, {@code FAILED} when it throws, {@code SKIPPED} when the agent
 * is unknown, disabled, already running, or over its hourly call or daily
 * cost ceiling. The agent's {@code last_run_at} and {@code next_run_at} move
 * forward after every attempt. An {@link Error} is logged as a failure and
 * then rethrown.
 */
@Service
@Slf4j
public class AgentRunService {

    private static final Duration RATE_WINDOW = Duration.ofHours(1);
    private static final Duration COST_WINDOW = Duration.ofDays(1);

    private final Map<String, PipelineAgent> agents;
    private final AgentConfigurationService configurationService;
    private final ExecutionLogService executionLogService;
    private final UsageTrackingPort usageTrackingPort;
    private final Clock clock;
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public AgentRunService(List<PipelineAgent> agents, AgentConfigurationService configurationService,
            ExecutionLogService executionLogService, UsageTrackingPort usageTrackingPort, Clock clock) {
        Map<String, PipelineAgent> byName = new TreeMap<>();
        for (PipelineAgent agent : agents) {
            byName.put(agent.name(), agent);
        }
        this.agents = Collections.unmodifiableMap(byName);
        this.configurationService = configurationService;
        this.executionLogService = executionLogService;
        this.usageTrackingPort = usageTrackingPort;
        this.clock = clock;
        log.info("[AgentRun] Registered agents: {}", this.agents.keySet());
    }

    public Set<String> agentNames() {
        return agents.keySet();
    }

    public AgentExecutionLog runNow(String agentName) {
        return run(agentName, TriggerKind.MANUAL);
    }

    public AgentExecutionLog run(String agentName, TriggerKind trigger) {
        Instant startedAt = clock.instant();
        AgentExecutionLog started = executionLogService.start(agentName, trigger);
        String logId = started.getId();

        PipelineAgent agent = agents.get(agentName);
        if (agent == null) {
            log.warn("[AgentRun] Unknown agent: {}", agentName);
            return executionLogService.skip(logId, MetadataKeys.REASON_UNKNOWN_AGENT, Map.of());
        }
        if (!running.add(agentName)) {
            log.info("[AgentRun] {} skipped: previous run still in progress", agentName);
            return executionLogService.skip(logId, MetadataKeys.REASON_ALREADY_RUNNING, Map.of());
        }

        try {
            return runWrapped(agent, trigger, logId);
        } finally {
            running.remove(agentName);
            advanceSchedule(agentName, startedAt);
        }
    }

    private AgentExecutionLog runWrapped(PipelineAgent agent, TriggerKind trigger, String logId) {
        try {
            AgentConfiguration configuration = configurationService.getOrSeed(agent.name());
            if (!configuration.isEnabled()) {
                log.info("[AgentRun] {} skipped: disabled", agent.name());
                return executionLogService.skip(logId, MetadataKeys.REASON_AGENT_DISABLED,
                        Map.of(MetadataKeys.TRIGGER, trigger.name()));
            }

            Optional<String> exceeded = checkBudget(configuration);
            if (exceeded.isPresent()) {
                log.warn("[AgentRun] {} skipped: {}", agent.name(), exceeded.get());
                return executionLogService.skip(logId, exceeded.get(), budgetDetails(agent.name(), trigger));
            }

            AgentRunContext context = new AgentRunContext(configuration, trigger, logId,
                    () -> checkBudget(configuration));
            AgentRunResult result = agent.run(context);
            result.getMetadata().putIfAbsent(MetadataKeys.TRIGGER, trigger.name());
            return executionLogService.complete(logId, result);
        } catch (RuntimeException e) {
            log.error("[AgentRun] {} failed: {}", agent.name(), e.getMessage(), e);
            return executionLogService.fail(logId, e);
        } catch (Error e) {
            log.error("[AgentRun] {} failed with {}", agent.name(), e.getClass().getSimpleName(), e);
            executionLogService.fail(logId, e);
            throw e;
        }
    }

    /**
     * Advisory ceilings: calls in the last hour and cost over the last day.
     */
    Optional<String> checkBudget(AgentConfiguration configuration) {
        Instant now = clock.instant();
        Integer rateLimit = configuration.getRateLimitPerHour();
        if (rateLimit != null
                && usageTrackingPort.getCallCountSince(configuration.getAgentName(), now.minus(RATE_WINDOW))
                        >= rateLimit) {
            return Optional.of(MetadataKeys.REASON_RATE_LIMIT_EXCEEDED);
        }
        BigDecimal costLimit = configuration.getCostLimitDailyUsd();
        if (costLimit != null
                && usageTrackingPort.getCostSince(configuration.getAgentName(), now.minus(COST_WINDOW))
                        .compareTo(costLimit) >= 0) {
            return Optional.of(MetadataKeys.REASON_COST_LIMIT_EXCEEDED);
        }
        return Optional.empty();
    }

    private Map<String, Object> budgetDetails(String agentName, TriggerKind trigger) {
        Instant now = clock.instant();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(MetadataKeys.TRIGGER, trigger.name());
        details.put(MetadataKeys.CALLS_LAST_HOUR, usageTrackingPort.getCallCountSince(agentName,
                now.minus(RATE_WINDOW)));
        details.put(MetadataKeys.COST_LAST_DAY_USD, usageTrackingPort.getCostSince(agentName,
                now.minus(COST_WINDOW)).toPlainString());
        return details;
    }

    private void advanceSchedule(String agentName, Instant startedAt) {
        try {
            configurationService.recordRun(agentName, startedAt);
        } catch (RuntimeException e) {
            log.error("[AgentRun] Failed to advance schedule of {}: {}", agentName, e.getMessage(), e);
        }
    }
}
