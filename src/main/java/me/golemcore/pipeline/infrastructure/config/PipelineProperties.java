package me.golemcore.pipeline.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the pipeline, bound from
 * application.properties.
 *
 * <p>
 * All configuration lives under the {@code pipeline.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - JSON-file store location</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link RateLimitProperties} - per-source request windows</li>
 * <li>{@link SourcesProperties} - built-in scrapers</li>
 * <li>{@link AnalysisProperties} - generation service and retry policy</li>
 * <li>{@link QualityProperties}, {@link SimilarityProperties} - thresholds</li>
 * <li>{@link SchedulerProperties}, {@link UsageProperties},
 * {@link WebhookProperties}</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private SourcesProperties sources = new SourcesProperties();
    private AnalysisProperties analysis = new AnalysisProperties();
    private QualityProperties quality = new QualityProperties();
    private SimilarityProperties similarity = new SimilarityProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private UsageProperties usage = new UsageProperties();
    private WebhookProperties webhook = new WebhookProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/pipeline";
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== RATE LIMIT ====================

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private Map<String, SourceWindowProperties> sources = new LinkedHashMap<>();
    }

    @Data
    public static class SourceWindowProperties {
        private int requests;
        private int windowSeconds;
        private String name;

        public static SourceWindowProperties of(int requests, int windowSeconds, String name) {
            SourceWindowProperties window = new SourceWindowProperties();
            window.setRequests(requests);
            window.setWindowSeconds(windowSeconds);
            window.setName(name);
            return window;
        }
    }

    // ==================== SOURCES ====================

    @Data
    public static class SourcesProperties {
        private HackerNewsProperties hackernews = new HackerNewsProperties();
        private RedditProperties reddit = new RedditProperties();
    }

    @Data
    public static class HackerNewsProperties {
        private boolean enabled = true;
        private String baseUrl = "https://hn.algolia.com/api/v1";
        private List<String> queries = new ArrayList<>(List.of("Ask HN", "startup"));
        private int hitsPerQuery = 20;
        private int minPoints = 10;
        private int hoursBack = 24;
    }

    @Data
    public static class RedditProperties {
        private boolean enabled = true;
        private String baseUrl = "https://www.reddit.com";
        private List<String> subreddits = new ArrayList<>(List.of("startups", "SaaS", "Entrepreneur"));
        private int limitPerSubreddit = 25;
        private String listing = "hot";
        private String userAgent = "golemcore-insight-pipeline/1.0";
    }

    // ==================== ANALYSIS ====================

    @Data
    public static class AnalysisProperties {
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private int maxTokens = 2048;
        private int maxAttempts = 3;
        private long initialBackoffMs = 4000;
        private long maxBackoffMs = 10000;
        private double backoffMultiplier = 2.0;
        private long attemptTimeoutMs = 60000;
        private int batchSize = 10;
    }

    // ==================== QUALITY ====================

    @Data
    public static class QualityProperties {
        private BigDecimal autoApproveThreshold = new BigDecimal("0.85");
        private BigDecimal autoFlagThreshold = new BigDecimal("0.40");
    }

    // ==================== SIMILARITY ====================

    @Data
    public static class SimilarityProperties {
        private double exactThreshold = 0.95;
        private double nearThreshold = 0.85;
        private double thematicThreshold = 0.70;
        private int candidateWindowHours = 24;
        private int corpusLimit = 500;
    }

    // ==================== SCHEDULER ====================

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private int tickIntervalSeconds = 30;
        private int workerThreads = 4;
        private Map<String, Integer> defaultIntervalHours = new LinkedHashMap<>(Map.of(
                "signal_collector", 6,
                "signal_analyzer", 1,
                "similarity_detector", 24));
        private double defaultTemperature = 0.7;
        private int defaultMaxTokens = 4096;
        private int defaultRateLimitPerHour = 100;
        private BigDecimal defaultCostLimitDailyUsd = new BigDecimal("50.00");
    }

    // ==================== USAGE ====================

    @Data
    public static class UsageProperties {
        private boolean enabled = true;
        private int retentionDays = 30;
        /** Model-name fragment to price; the first matching fragment wins. */
        private Map<String, ModelPricing> pricing = new LinkedHashMap<>(Map.of(
                "claude", ModelPricing.of("0.003", "0.015"),
                "gpt-4o", ModelPricing.of("0.005", "0.015")));
    }

    @Data
    public static class ModelPricing {
        private BigDecimal inputPer1k = BigDecimal.ZERO;
        private BigDecimal outputPer1k = BigDecimal.ZERO;

        public static ModelPricing of(String inputPer1k, String outputPer1k) {
            ModelPricing pricing = new ModelPricing();
            pricing.setInputPer1k(new BigDecimal(inputPer1k));
            pricing.setOutputPer1k(new BigDecimal(outputPer1k));
            return pricing;
        }
    }

    // ==================== WEBHOOK ====================

    @Data
    public static class WebhookProperties {
        private boolean enabled = true;
        private int maxPayloadBytes = 262144;
        private long concurrentWaitMs = 30000;
        private long processingLeaseMs = 600000;
        private List<String> sensitiveFields = new ArrayList<>(
                List.of("customer", "email", "name", "address", "phone", "metadata"));
    }
}
