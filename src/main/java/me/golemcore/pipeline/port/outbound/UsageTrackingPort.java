package me.golemcore.pipeline.port.outbound;

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

import me.golemcore.pipeline.domain.model.LlmCallRecord;
import me.golemcore.pipeline.domain.model.UsageStats;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Metrics sink for generation calls. Recording is fire-and-forget and must
 * never fail the caller.
 */
public interface UsageTrackingPort {

    void recordCall(LlmCallRecord record);

    /**
     * Aggregate over all calls within the period.
     */
    UsageStats getStats(Duration period);

    Map<String, UsageStats> getStatsByModel(Duration period);

    Map<String, UsageStats> getStatsByAgent(Duration period);

    long getCallCountSince(String agentName, Instant since);

    BigDecimal getCostSince(String agentName, Instant since);
}
