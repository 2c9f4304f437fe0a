package me.golemcore.pipeline.domain.service;

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

import me.golemcore.pipeline.domain.model.AgentExecutionLog;
import me.golemcore.pipeline.domain.model.AgentRunResult;
import me.golemcore.pipeline.domain.model.AgentStats;
import me.golemcore.pipeline.domain.model.ExecutionStatus;
import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.TriggerKind;
import me.golemcore.pipeline.port.outbound.ExecutionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Writes the start/finish pair of every agent run. A log row is finished
 * exactly once; finishing it again is an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionLogService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final ExecutionLogRepository repository;
    private final Clock clock;

    public AgentExecutionLog start(String agentType, TriggerKind trigger) {
        AgentExecutionLog created = repository.create(AgentExecutionLog.builder()
                .agentType(agentType)
                .source(trigger.name().toLowerCase(Locale.ROOT))
                .status(ExecutionStatus.RUNNING)
                .startedAt(clock.instant())
                .build());
        log.debug("[ExecutionLog] {} started ({}), log {}", agentType, trigger, created.getId());
        return created;
    }

    public AgentExecutionLog complete(String logId, AgentRunResult result) {
        return finish(logId, ExecutionStatus.COMPLETED, entry -> {
            entry.setItemsProcessed(result.getItemsProcessed());
            entry.setItemsFailed(result.getItemsFailed());
            entry.getMetadata().putAll(result.getMetadata());
            return entry;
        });
    }

    public AgentExecutionLog fail(String logId, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return finish(logId, ExecutionStatus.FAILED, entry -> {
            entry.setErrorMessage(truncate(message));
            return entry;
        });
    }

    public AgentExecutionLog skip(String logId, String reason, Map<String, Object> details) {
        return finish(logId, ExecutionStatus.SKIPPED, entry -> {
            entry.getMetadata().putAll(details);
            entry.getMetadata().put(MetadataKeys.REASON, reason);
            return entry;
        });
    }

    public List<AgentExecutionLog> recent(String agentType, int limit) {
        return repository.findRecent(agentType, limit);
    }

    public AgentStats stats(String agentType, Duration period) {
        List<AgentExecutionLog> logs = repository.findByAgentSince(agentType, clock.instant().minus(period));
        long completed = 0;
        long failed = 0;
        long skipped = 0;
        long itemsProcessed = 0;
        long itemsFailed = 0;
        long durationSum = 0;
        long timed = 0;
        for (AgentExecutionLog entry : logs) {
            switch (entry.getStatus()) {
            case COMPLETED -> completed++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
            case RUNNING -> {
                // still in flight
            }
            }
            itemsProcessed += entry.getItemsProcessed();
            itemsFailed += entry.getItemsFailed();
            if (entry.getDurationMs() != null && entry.getStatus() != ExecutionStatus.SKIPPED) {
                durationSum += entry.getDurationMs();
                timed++;
            }
        }
        return AgentStats.builder()
                .agentType(agentType)
                .period(period)
                .totalRuns(logs.size())
                .completedRuns(completed)
                .failedRuns(failed)
                .skippedRuns(skipped)
                .averageDurationMs(timed == 0 ? 0 : durationSum / timed)
                .itemsProcessed(itemsProcessed)
                .itemsFailed(itemsFailed)
                .build();
    }

    private AgentExecutionLog finish(String logId, ExecutionStatus status,
            UnaryOperator<AgentExecutionLog> details) {
        Instant now = clock.instant();
        AgentExecutionLog finished = repository.update(logId, entry -> {
            if (entry.getStatus().isFinished()) {
                throw new IllegalStateException("Execution log " + logId + " already finished as "
                        + entry.getStatus());
            }
            AgentExecutionLog updated = details.apply(entry);
            updated.setStatus(status);
            updated.setCompletedAt(now);
            if (updated.getStartedAt() != null) {
                updated.setDurationMs(Duration.between(updated.getStartedAt(), now).toMillis());
            }
            return updated;
        });
        log.info("[ExecutionLog] {} {} in {} ms (processed: {}, failed: {}){}", finished.getAgentType(), status,
                finished.getDurationMs(), finished.getItemsProcessed(), finished.getItemsFailed(),
                finished.getErrorMessage() != null ? " error: " + finished.getErrorMessage() : "");
        return finished;
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
