package me.golemcore.pipeline.usage;

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
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.StoragePort;
import me.golemcore.pipeline.port.outbound.UsageTrackingPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Default implementation of {@link UsageTrackingPort} with persistence to
 * JSONL files.
 *
 * <p>
 * Features:
 * <ul>
 * <li>In-memory aggregation with concurrent access support</li>
 * <li>Appends one line per call to {@code usage/<yyyy-MM-dd>.jsonl} without
 * waiting for the write</li>
 * <li>Loads persisted records within the retention window on startup</li>
 * <li>Hourly eviction of records beyond retention</li>
 * <li>Per-model and per-agent breakdowns, hourly call counts and daily cost
 * for agent budgets</li>
 * </ul>
 *
 * <p>
 * Can be disabled via {@code pipeline.usage.enabled=false}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class LlmUsageTrackerImpl implements UsageTrackingPort {

    private static final String USAGE_DIR = "usage";
    private static final String UNKNOWN = "unknown";
    private static final String LOG_PREFIX = "[Usage]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";
    private static final int EVICTION_INTERVAL_HOURS = 1;
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ModelPricingTable pricingTable;
    private final Clock clock;
    private final boolean enabled;
    private final Duration retention;

    private final ConcurrentLinkedQueue<LlmCallRecord> records = new ConcurrentLinkedQueue<>();

    private final ScheduledExecutorService evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "usage-eviction");
        t.setDaemon(true);
        return t;
    });

    public LlmUsageTrackerImpl(StoragePort storagePort, ObjectMapper objectMapper, ModelPricingTable pricingTable,
            Clock clock, PipelineProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.pricingTable = pricingTable;
        this.clock = clock;
        this.enabled = properties.getUsage().isEnabled();
        this.retention = Duration.ofDays(properties.getUsage().getRetentionDays());
    }

    @PostConstruct
    void init() {
        loadPersistedUsage();
        evictionExecutor.scheduleAtFixedRate(this::evictOldRecords,
                EVICTION_INTERVAL_HOURS, EVICTION_INTERVAL_HOURS, TimeUnit.HOURS);
    }

    @PreDestroy
    void destroy() {
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void recordCall(LlmCallRecord record) {
        if (!enabled || record == null) {
            return;
        }
        if (record.getTimestamp() == null) {
            record.setTimestamp(clock.instant());
        }
        record.setTotalTokens(record.getInputTokens() + record.getOutputTokens());
        if (record.getCostUsd() == 0.0 && record.getTotalTokens() > 0) {
            record.setCostUsd(pricingTable.cost(record.getModel(), record.getInputTokens(),
                    record.getOutputTokens()).doubleValue());
        }

        records.add(record);
        persist(record);

        log.debug("{} Recorded call: model={}, agent={}, attempt={}, success={}, tokens={}, latency={}ms",
                LOG_PREFIX, record.getModel(), record.getAgentName(), record.getAttempt(), record.isSuccess(),
                record.getTotalTokens(), record.getLatency() != null ? record.getLatency().toMillis() : "N/A");
    }

    @Override
    public UsageStats getStats(Duration period) {
        return aggregate("all", period, within(period));
    }

    @Override
    public Map<String, UsageStats> getStatsByModel(Duration period) {
        return groupedStats(period, r -> r.getModel() != null ? r.getModel() : UNKNOWN);
    }

    @Override
    public Map<String, UsageStats> getStatsByAgent(Duration period) {
        return groupedStats(period, r -> r.getAgentName() != null ? r.getAgentName() : UNKNOWN);
    }

    @Override
    public long getCallCountSince(String agentName, Instant since) {
        return records.stream()
                .filter(r -> agentName.equals(r.getAgentName()))
                .filter(r -> r.getTimestamp() != null && !r.getTimestamp().isBefore(since))
                .count();
    }

    @Override
    public BigDecimal getCostSince(String agentName, Instant since) {
        double cost = records.stream()
                .filter(r -> agentName.equals(r.getAgentName()))
                .filter(r -> r.getTimestamp() != null && !r.getTimestamp().isBefore(since))
                .mapToDouble(LlmCallRecord::getCostUsd)
                .sum();
        return BigDecimal.valueOf(cost);
    }

    private Map<String, UsageStats> groupedStats(Duration period, Function<LlmCallRecord, String> key) {
        Map<String, List<LlmCallRecord>> grouped = within(period).stream()
                .collect(Collectors.groupingBy(key));
        Map<String, UsageStats> result = new TreeMap<>();
        grouped.forEach((name, calls) -> result.put(name, aggregate(name, period, calls)));
        return result;
    }

    private List<LlmCallRecord> within(Duration period) {
        Instant cutoff = clock.instant().minus(period);
        return records.stream()
                .filter(r -> r.getTimestamp() != null && r.getTimestamp().isAfter(cutoff))
                .toList();
    }

    private UsageStats aggregate(String key, Duration period, List<LlmCallRecord> calls) {
        long totalInput = calls.stream().mapToLong(LlmCallRecord::getInputTokens).sum();
        long totalOutput = calls.stream().mapToLong(LlmCallRecord::getOutputTokens).sum();
        long avgLatencyMs = (long) calls.stream()
                .filter(r -> r.getLatency() != null)
                .mapToLong(r -> r.getLatency().toMillis())
                .average()
                .orElse(0);

        return UsageStats.builder()
                .key(key)
                .period(period)
                .totalCalls(calls.size())
                .failedCalls(calls.stream().filter(r -> !r.isSuccess()).count())
                .totalInputTokens(totalInput)
                .totalOutputTokens(totalOutput)
                .totalTokens(totalInput + totalOutput)
                .avgLatency(Duration.ofMillis(avgLatencyMs))
                .totalCostUsd(calls.stream().mapToDouble(LlmCallRecord::getCostUsd).sum())
                .build();
    }

    private void persist(LlmCallRecord record) {
        String file = LocalDate.ofInstant(record.getTimestamp(), ZoneOffset.UTC) + JSONL_EXTENSION;
        try {
            String json = objectMapper.writeValueAsString(record) + NEWLINE;
            storagePort.appendText(USAGE_DIR, file, json)
                    .exceptionally(e -> {
                        log.warn("{} Failed to persist call record: {}", LOG_PREFIX, e.getMessage());
                        return null;
                    });
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to persist call record", LOG_PREFIX, e);
        }
    }

    private void loadPersistedUsage() {
        if (!enabled) {
            return;
        }
        Instant cutoff = clock.instant().minus(retention);
        try {
            List<String> files = storagePort.listObjects(USAGE_DIR, "").join();
            int loaded = 0;
            for (String file : files) {
                if (!file.endsWith(JSONL_EXTENSION)) {
                    continue;
                }
                String content = storagePort.getText(USAGE_DIR, file).join();
                if (content == null) {
                    continue;
                }
                for (String line : content.split(NEWLINE)) {
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        LlmCallRecord record = objectMapper.readValue(line, LlmCallRecord.class);
                        if (record.getTimestamp() != null && !record.getTimestamp().isBefore(cutoff)) {
                            records.add(record);
                            loaded++;
                        }
                    } catch (JsonProcessingException e) {
                        log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
                    }
                }
            }
            log.info("{} Loaded {} call records from storage ({}d retention)", LOG_PREFIX, loaded,
                    retention.toDays());
        } catch (RuntimeException e) {
            log.warn("{} Failed to load persisted usage", LOG_PREFIX, e);
        }
    }

    void evictOldRecords() {
        Instant cutoff = clock.instant().minus(retention);
        boolean evicted = records.removeIf(r -> r.getTimestamp() != null && r.getTimestamp().isBefore(cutoff));
        if (evicted) {
            log.debug("{} Evicted records beyond {}d retention", LOG_PREFIX, retention.toDays());
        }
    }
}
