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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-agent settings and schedule. Seeded with defaults on first reference
 * and never deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentConfiguration {

    private String agentName;

    @Builder.Default
    private boolean enabled = true;

    private String modelName;
    private BigDecimal temperature;
    private Integer maxTokens;
    private Integer rateLimitPerHour;
    private BigDecimal costLimitDailyUsd;

    @Builder.Default
    private ScheduleType scheduleType = ScheduleType.MANUAL;

    private String scheduleCron;
    private Integer scheduleIntervalHours;
    private Instant nextRunAt;
    private Instant lastRunAt;

    @Builder.Default
    private Map<String, Object> customPrompts = new LinkedHashMap<>();

    private String updatedBy;
    private Instant createdAt;
    private Instant updatedAt;
}
