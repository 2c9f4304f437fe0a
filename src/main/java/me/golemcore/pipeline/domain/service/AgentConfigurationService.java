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

import me.golemcore.pipeline.domain.model.AgentConfiguration;
import me.golemcore.pipeline.domain.model.AgentSettingsUpdate;
import me.golemcore.pipeline.domain.model.ScheduleType;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.AgentConfigurationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;

/**
 * Per-agent settings and schedules.
 *
 * <p>
 * Configurations are seeded with defaults the first time an agent is
 * referenced. A {@code CRON} agent runs at the next cron match, an
 * {@code INTERVAL} agent a fixed number of hours after its last run, and a
 * {@code MANUAL} agent only when triggered explicitly.
 */
@Service
@Slf4j
public class AgentConfigurationService {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;
    private static final int MIN_INTERVAL_HOURS = 1;
    private static final int MAX_INTERVAL_HOURS = 168;
    private static final BigDecimal MAX_TEMPERATURE = new BigDecimal("2.0");

    private final AgentConfigurationRepository repository;
    private final PipelineProperties properties;
    private final Clock clock;

    public AgentConfigurationService(AgentConfigurationRepository repository, PipelineProperties properties,
            Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public AgentConfiguration getOrSeed(String agentName) {
        return repository.getOrCreate(agentName, () -> defaults(agentName));
    }

    public List<AgentConfiguration> listAll() {
        return repository.findAll();
    }

    /**
     * Configurations of the given agents whose next run is due, seeding
     * missing ones first. Disabled agents are included so that their skipped
     * run gets logged.
     */
    public List<AgentConfiguration> findDue(Collection<String> agentNames) {
        Instant now = clock.instant();
        return agentNames.stream()
                .map(this::getOrSeed)
                .filter(configuration -> isDue(configuration, now))
                .toList();
    }

    public boolean isDue(AgentConfiguration configuration, Instant now) {
        if (configuration.getScheduleType() == ScheduleType.MANUAL) {
            return false;
        }
        Instant next = configuration.getNextRunAt();
        if (next == null) {
            next = computeNextRun(configuration, configuration.getLastRunAt());
        }
        return next != null && !next.isAfter(now);
    }

    public AgentConfiguration setEnabled(String agentName, boolean enabled, String updatedBy) {
        getOrSeed(agentName);
        AgentConfiguration updated = repository.update(agentName, configuration -> {
            configuration.setEnabled(enabled);
            configuration.setUpdatedBy(updatedBy);
            configuration.setUpdatedAt(clock.instant());
            return configuration;
        });
        log.info("[AgentConfig] {} {} by {}", agentName, enabled ? "enabled" : "disabled", updatedBy);
        return updated;
    }

    /**
     * Change the schedule of an agent and recompute its next run.
     *
     * @throws IllegalArgumentException
     *             when the cron expression is missing or invalid, or the
     *             interval is outside 1..168 hours
     */
    public AgentConfiguration updateSchedule(String agentName, ScheduleType scheduleType, String cronExpression,
            Integer intervalHours, String updatedBy) {
        if (scheduleType == null) {
            throw new IllegalArgumentException("Schedule type is required");
        }
        String normalizedCron = scheduleType == ScheduleType.CRON ? normalizeCronExpression(cronExpression) : null;
        if (scheduleType == ScheduleType.INTERVAL) {
            validateInterval(intervalHours);
        }

        getOrSeed(agentName);
        Instant now = clock.instant();
        AgentConfiguration updated = repository.update(agentName, configuration -> {
            configuration.setScheduleType(scheduleType);
            switch (scheduleType) {
            case CRON -> {
                configuration.setScheduleCron(normalizedCron);
                configuration.setNextRunAt(computeNextExecution(normalizedCron, now));
            }
            case INTERVAL -> {
                configuration.setScheduleIntervalHours(intervalHours);
                Instant base = configuration.getLastRunAt();
                configuration.setNextRunAt(base != null ? base.plus(Duration.ofHours(intervalHours)) : now);
            }
            case MANUAL -> configuration.setNextRunAt(null);
            }
            configuration.setUpdatedBy(updatedBy);
            configuration.setUpdatedAt(now);
            return configuration;
        });
        log.info("[AgentConfig] {} schedule set to {} (next run: {})", agentName, scheduleType,
                updated.getNextRunAt());
        return updated;
    }

    /**
     * Apply the non-null fields of a settings update.
     *
     * @throws IllegalArgumentException
     *             when a value is out of range
     */
    public AgentConfiguration updateSettings(String agentName, AgentSettingsUpdate update) {
        validateSettings(update);
        getOrSeed(agentName);
        AgentConfiguration updated = repository.update(agentName, configuration -> {
            if (update.getModelName() != null) {
                configuration.setModelName(update.getModelName());
            }
            if (update.getTemperature() != null) {
                configuration.setTemperature(update.getTemperature());
            }
            if (update.getMaxTokens() != null) {
                configuration.setMaxTokens(update.getMaxTokens());
            }
            if (update.getRateLimitPerHour() != null) {
                configuration.setRateLimitPerHour(update.getRateLimitPerHour());
            }
            if (update.getCostLimitDailyUsd() != null) {
                configuration.setCostLimitDailyUsd(update.getCostLimitDailyUsd());
            }
            configuration.setUpdatedBy(update.getUpdatedBy());
            configuration.setUpdatedAt(clock.instant());
            return configuration;
        });
        log.info("[AgentConfig] {} settings updated by {}", agentName, update.getUpdatedBy());
        return updated;
    }

    /**
     * Record an attempted run, whatever its outcome, and advance the
     * schedule.
     */
    public AgentConfiguration recordRun(String agentName, Instant startedAt) {
        return repository.update(agentName, configuration -> {
            configuration.setLastRunAt(startedAt);
            configuration.setNextRunAt(computeNextRun(configuration, startedAt));
            return configuration;
        });
    }

    /**
     * Next run after the given reference instant, or {@code null} for manual
     * schedules. A null reference means the agent never ran.
     */
    public Instant computeNextRun(AgentConfiguration configuration, Instant after) {
        return switch (configuration.getScheduleType()) {
        case CRON -> configuration.getScheduleCron() == null ? null
                : computeNextExecution(configuration.getScheduleCron(),
                        after != null ? after : creationOrNow(configuration));
        case INTERVAL -> after == null || configuration.getScheduleIntervalHours() == null
                ? creationOrNow(configuration)
                : after.plus(Duration.ofHours(configuration.getScheduleIntervalHours()));
        case MANUAL -> null;
        };
    }

    /**
     * Normalize a cron expression: converts 5-field (minute-level) to 6-field
     * (Spring format with seconds). Validates the result.
     *
     * @throws IllegalArgumentException
     *             if the cron expression is invalid
     */
    static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Cron expression is required for a cron schedule");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new IllegalArgumentException("Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + trimmed + "': " + e.getMessage());
        }

        return sixFieldCron;
    }

    /**
     * @return next execution instant, or null if no future execution exists
     */
    static Instant computeNextExecution(String cronExpression, Instant after) {
        CronExpression cron = CronExpression.parse(cronExpression);
        LocalDateTime afterLocal = LocalDateTime.ofInstant(after, ZoneOffset.UTC);
        LocalDateTime next = cron.next(afterLocal);
        if (next == null) {
            return null;
        }
        return next.toInstant(ZoneOffset.UTC);
    }

    private AgentConfiguration defaults(String agentName) {
        PipelineProperties.SchedulerProperties scheduler = properties.getScheduler();
        Integer intervalHours = scheduler.getDefaultIntervalHours().get(agentName);
        Instant now = clock.instant();
        return AgentConfiguration.builder()
                .agentName(agentName)
                .enabled(true)
                .modelName(properties.getAnalysis().getModel())
                .temperature(BigDecimal.valueOf(scheduler.getDefaultTemperature()))
                .maxTokens(scheduler.getDefaultMaxTokens())
                .rateLimitPerHour(scheduler.getDefaultRateLimitPerHour())
                .costLimitDailyUsd(scheduler.getDefaultCostLimitDailyUsd())
                .scheduleType(intervalHours != null ? ScheduleType.INTERVAL : ScheduleType.MANUAL)
                .scheduleIntervalHours(intervalHours)
                .nextRunAt(intervalHours != null ? now : null)
                .updatedBy("system")
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private Instant creationOrNow(AgentConfiguration configuration) {
        return configuration.getCreatedAt() != null ? configuration.getCreatedAt() : clock.instant();
    }

    private static void validateInterval(Integer intervalHours) {
        if (intervalHours == null || intervalHours < MIN_INTERVAL_HOURS || intervalHours > MAX_INTERVAL_HOURS) {
            throw new IllegalArgumentException("Interval must be between " + MIN_INTERVAL_HOURS + " and "
                    + MAX_INTERVAL_HOURS + " hours, got " + intervalHours);
        }
    }

    private static void validateSettings(AgentSettingsUpdate update) {
        BigDecimal temperature = update.getTemperature();
        if (temperature != null
                && (temperature.signum() < 0 || temperature.compareTo(MAX_TEMPERATURE) > 0)) {
            throw new IllegalArgumentException("Temperature must be within [0, 2], got " + temperature);
        }
        if (update.getMaxTokens() != null && update.getMaxTokens() <= 0) {
            throw new IllegalArgumentException("Max tokens must be positive");
        }
        if (update.getRateLimitPerHour() != null && update.getRateLimitPerHour() <= 0) {
            throw new IllegalArgumentException("Rate limit per hour must be positive");
        }
        if (update.getCostLimitDailyUsd() != null && update.getCostLimitDailyUsd().signum() < 0) {
            throw new IllegalArgumentException("Daily cost limit must not be negative");
        }
    }
}
