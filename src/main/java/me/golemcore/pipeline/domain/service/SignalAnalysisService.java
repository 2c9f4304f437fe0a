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

import me.golemcore.pipeline.domain.exception.AnalysisException;
import me.golemcore.pipeline.domain.exception.ConfigurationException;
import me.golemcore.pipeline.domain.exception.NonRetryableAnalysisException;
import me.golemcore.pipeline.domain.exception.TransientIOException;
import me.golemcore.pipeline.domain.model.AgentConfiguration;
import me.golemcore.pipeline.domain.model.GenerationRequest;
import me.golemcore.pipeline.domain.model.GenerationResponse;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.InsightDraft;
import me.golemcore.pipeline.domain.model.LlmCallRecord;
import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.RawSignal;
import me.golemcore.pipeline.domain.model.RetryPolicy;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.GenerationPort;
import me.golemcore.pipeline.port.outbound.UsageTrackingPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a raw signal into a validated insight with one structured generation
 * call per attempt.
 *
 * <p>
 * Each attempt is bounded by a wall-clock timeout and produces one telemetry
 * record. Retryable failures (transient I/O, timeouts, invalid output) are
 * retried per {@link RetryPolicy}; the last failure is rethrown as the same
 * instance once the budget is spent. Configuration errors surface
 * immediately.
 */
@Service
@Slf4j
public class SignalAnalysisService {

    private static final String SYSTEM_PROMPT_KEY = "system";

    private final GenerationPort generationPort;
    private final UsageTrackingPort usageTrackingPort;
    private final InsightValidator validator;
    private final Clock clock;
    private final Sleeper sleeper;
    private final PipelineProperties.AnalysisProperties analysis;
    private final RetryPolicy retryPolicy;
    private final Duration attemptTimeout;
    private final ExecutorService attemptExecutor;

    public SignalAnalysisService(GenerationPort generationPort, UsageTrackingPort usageTrackingPort,
            InsightValidator validator, PipelineProperties properties, Clock clock, Sleeper sleeper) {
        this.generationPort = generationPort;
        this.usageTrackingPort = usageTrackingPort;
        this.validator = validator;
        this.clock = clock;
        this.sleeper = sleeper;
        this.analysis = properties.getAnalysis();
        this.retryPolicy = RetryPolicy.builder()
                .maxAttempts(analysis.getMaxAttempts())
                .initialBackoff(Duration.ofMillis(analysis.getInitialBackoffMs()))
                .maxBackoff(Duration.ofMillis(analysis.getMaxBackoffMs()))
                .multiplier(analysis.getBackoffMultiplier())
                .retryable(t -> t instanceof AnalysisException ae && ae.isRetryable())
                .build();
        this.attemptTimeout = Duration.ofMillis(analysis.getAttemptTimeoutMs());
        AtomicInteger threadIndex = new AtomicInteger();
        this.attemptExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "analysis-attempt-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        attemptExecutor.shutdownNow();
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Insight analyze(RawSignal signal) {
        return analyze(signal, null);
    }

    /**
     * Analyze a signal with the model settings of the calling agent.
     *
     * @throws AnalysisException
     *             the last failure once attempts are exhausted, or the first
     *             non-retryable one
     */
    public Insight analyze(RawSignal signal, AgentConfiguration configuration) {
        GenerationRequest request = buildRequest(signal, configuration);
        String agentName = configuration != null ? configuration.getAgentName() : null;

        for (int attempt = 1;; attempt++) {
            Instant started = clock.instant();
            GenerationResponse response = null;
            try {
                response = invokeWithTimeout(request);
                validator.validate(response.getDraft());
                recordAttempt(request, response, agentName, attempt, started, null);
                if (attempt > 1) {
                    log.info("[Analysis] Signal {} analyzed on attempt {}", signal.getId(), attempt);
                }
                return toInsight(signal, response);
            } catch (AnalysisException e) {
                recordAttempt(request, response, agentName, attempt, started, e);
                if (!retryPolicy.shouldRetry(e, attempt)) {
                    log.warn("[Analysis] Giving up on signal {} after {} attempt(s): {}", signal.getId(),
                            attempt, e.getMessage());
                    throw e;
                }
                Duration backoff = retryPolicy.backoff(attempt);
                log.warn("[Analysis] Attempt {}/{} for signal {} failed ({}), retrying in {}ms", attempt,
                        retryPolicy.getMaxAttempts(), signal.getId(), e.getMessage(), backoff.toMillis());
                pause(backoff);
            } catch (ConfigurationException e) {
                recordAttempt(request, response, agentName, attempt, started, e);
                log.error("[Analysis] Signal {} not analyzed, provider misconfigured: {}", signal.getId(),
                        e.getMessage());
                throw e;
            }
        }
    }

    private GenerationResponse invokeWithTimeout(GenerationRequest request) {
        Future<GenerationResponse> future = attemptExecutor.submit(() -> generationPort.generate(request));
        try {
            return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientIOException("Generation attempt timed out after " + attemptTimeout.toMillis() + "ms",
                    e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientIOException("Interrupted while waiting for generation", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    private RuntimeException unwrap(Throwable cause) {
        if (cause instanceof AnalysisException analysisException) {
            return analysisException;
        }
        if (cause instanceof ConfigurationException configurationException) {
            return configurationException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new NonRetryableAnalysisException("Unexpected generation failure: " + cause.getMessage(), cause);
    }

    private void pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientIOException("Interrupted during retry backoff", e);
        }
    }

    private void recordAttempt(GenerationRequest request, GenerationResponse response, String agentName,
            int attempt, Instant started, RuntimeException failure) {
        try {
            usageTrackingPort.recordCall(LlmCallRecord.builder()
                    .timestamp(clock.instant())
                    .providerId(generationPort.getProviderId())
                    .model(response != null && response.getModel() != null ? response.getModel()
                            : request.getModel())
                    .agentName(agentName)
                    .signalId(request.getSignalId())
                    .attempt(attempt)
                    .inputTokens(response != null ? response.getInputTokens() : 0)
                    .outputTokens(response != null ? response.getOutputTokens() : 0)
                    .latency(Duration.between(started, clock.instant()))
                    .success(failure == null)
                    .errorType(failure != null ? failure.getClass().getSimpleName() : null)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Analysis] Failed to record call telemetry: {}", e.getMessage());
        }
    }

    private GenerationRequest buildRequest(RawSignal signal, AgentConfiguration configuration) {
        String model = analysis.getModel();
        double temperature = analysis.getTemperature();
        int maxTokens = analysis.getMaxTokens();
        String systemPrompt = null;
        if (configuration != null) {
            if (configuration.getModelName() != null && !configuration.getModelName().isBlank()) {
                model = configuration.getModelName();
            }
            if (configuration.getTemperature() != null) {
                temperature = configuration.getTemperature().doubleValue();
            }
            if (configuration.getMaxTokens() != null) {
                maxTokens = configuration.getMaxTokens();
            }
            Object customPrompt = configuration.getCustomPrompts() != null
                    ? configuration.getCustomPrompts().get(SYSTEM_PROMPT_KEY)
                    : null;
            if (customPrompt instanceof String prompt && !prompt.isBlank()) {
                systemPrompt = prompt;
            }
        }
        Object title = signal.getMetadata() != null ? signal.getMetadata().get(MetadataKeys.TITLE) : null;
        return GenerationRequest.builder()
                .signalId(signal.getId())
                .source(signal.getSource())
                .title(title != null ? title.toString() : null)
                .content(signal.getContent())
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .systemPrompt(systemPrompt)
                .build();
    }

    private Insight toInsight(RawSignal signal, GenerationResponse response) {
        InsightDraft draft = response.getDraft();
        Instant now = clock.instant();
        String title = draft.getTitle();
        if (title == null || title.isBlank()) {
            Object signalTitle = signal.getMetadata() != null ? signal.getMetadata().get(MetadataKeys.TITLE) : null;
            title = signalTitle != null ? signalTitle.toString() : null;
        }
        return Insight.builder()
                .rawSignalId(signal.getId())
                .title(title)
                .problemStatement(draft.getProblemStatement().trim())
                .proposedSolution(draft.getProposedSolution().trim())
                .marketSize(draft.getMarketSize())
                .relevanceScore(draft.getRelevanceScore())
                .competitors(draft.getCompetitors() != null ? new ArrayList<>(draft.getCompetitors())
                        : new ArrayList<>())
                .dimensionScores(draft.getDimensionScores() != null
                        ? new LinkedHashMap<>(draft.getDimensionScores())
                        : new LinkedHashMap<>())
                .model(response.getModel())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
