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

import me.golemcore.pipeline.domain.model.WebhookClaim;
import me.golemcore.pipeline.domain.model.WebhookEvent;
import me.golemcore.pipeline.domain.model.WebhookEventStatus;
import me.golemcore.pipeline.domain.model.WebhookProcessingResult;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.inbound.WebhookEventHandler;
import me.golemcore.pipeline.port.outbound.WebhookEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Exactly-once processing of webhook deliveries keyed by the external event
 * id.
 *
 * <p>
 * The first delivery claims the id in the event store and runs the handler.
 * A later delivery of a processed event gets the stored result back without
 * running the handler again. A delivery that arrives while another caller in
 * this process is handling the same id waits, up to a bound, for that
 * caller's outcome. A failed event does not anchor idempotency: the next
 * delivery claims it again and retries. A processing row older than the
 * processing lease is treated as abandoned and claimed again as well.
 */
@Service
@Slf4j
public class WebhookIdempotencyGuard {

    private final WebhookEventRepository repository;
    private final WebhookPayloadSanitizer sanitizer;
    private final Clock clock;
    private final long concurrentWaitMs;
    private final Duration processingLease;
    private final ConcurrentMap<String, CompletableFuture<WebhookEvent>> inFlight = new ConcurrentHashMap<>();

    public WebhookIdempotencyGuard(WebhookEventRepository repository, WebhookPayloadSanitizer sanitizer,
            PipelineProperties properties, Clock clock) {
        this.repository = repository;
        this.sanitizer = sanitizer;
        this.clock = clock;
        this.concurrentWaitMs = properties.getWebhook().getConcurrentWaitMs();
        this.processingLease = Duration.ofMillis(properties.getWebhook().getProcessingLeaseMs());
    }

    /**
     * Run the handler at most once per successfully processed event id.
     *
     * @throws RuntimeException
     *             whatever the handler threw, after the failure is stored;
     *             an {@link Error} is stored and rethrown the same way
     */
    public WebhookProcessingResult process(String eventId, String eventType, Map<String, Object> payload,
            WebhookEventHandler handler) {
        CompletableFuture<WebhookEvent> outcome = new CompletableFuture<>();
        CompletableFuture<WebhookEvent> concurrent = inFlight.putIfAbsent(eventId, outcome);
        if (concurrent != null) {
            log.info("[Webhook] Event {} is being processed concurrently, waiting", eventId);
            return duplicate(awaitConcurrent(eventId, concurrent));
        }

        try {
            Instant now = clock.instant();
            WebhookClaim claim = repository.claim(WebhookEvent.builder()
                    .eventId(eventId)
                    .eventType(eventType)
                    .payload(sanitizer.sanitize(payload))
                    .receivedAt(now)
                    .build(), now.minus(processingLease));
            if (!claim.claimed()) {
                log.info("[Webhook] Duplicate event {} ({}), returning stored result", eventId,
                        claim.event().getStatus());
                outcome.complete(claim.event());
                return duplicate(claim.event());
            }
            if (claim.event().getAttempts() > 1) {
                log.info("[Webhook] Retrying event {} (attempt {})", eventId, claim.event().getAttempts());
            }
            return execute(claim.event(), payload, handler, outcome);
        } catch (Throwable e) {
            outcome.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(eventId, outcome);
        }
    }

    private WebhookProcessingResult execute(WebhookEvent event, Map<String, Object> payload,
            WebhookEventHandler handler, CompletableFuture<WebhookEvent> outcome) {
        String eventId = event.getEventId();
        Map<String, Object> result;
        try {
            result = handler.handle(payload);
        } catch (Throwable e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            WebhookEvent failed = repository.update(eventId, stored -> {
                stored.setStatus(WebhookEventStatus.FAILED);
                stored.setErrorMessage(message);
                stored.setProcessedAt(clock.instant());
                return stored;
            });
            log.warn("[Webhook] Event {} ({}) failed: {}", eventId, event.getEventType(), message);
            outcome.complete(failed);
            throw e;
        }

        WebhookEvent processed = repository.update(eventId, stored -> {
            stored.setStatus(WebhookEventStatus.PROCESSED);
            stored.setResult(result);
            stored.setErrorMessage(null);
            stored.setProcessedAt(clock.instant());
            return stored;
        });
        outcome.complete(processed);
        log.info("[Webhook] Event {} ({}) processed", eventId, event.getEventType());
        return toResult(processed, false);
    }

    private WebhookEvent awaitConcurrent(String eventId, CompletableFuture<WebhookEvent> concurrent) {
        try {
            return concurrent.get(concurrentWaitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Webhook] Interrupted while waiting for event {}", eventId);
        } catch (TimeoutException e) {
            log.warn("[Webhook] Event {} still processing after {} ms", eventId, concurrentWaitMs);
        } catch (ExecutionException e) {
            log.warn("[Webhook] Concurrent processing of event {} failed: {}", eventId,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
        return repository.findByEventId(eventId)
                .orElseThrow(() -> new IllegalStateException("Webhook event " + eventId + " was not stored"));
    }

    private static WebhookProcessingResult duplicate(WebhookEvent event) {
        return toResult(event, true);
    }

    private static WebhookProcessingResult toResult(WebhookEvent event, boolean duplicate) {
        return WebhookProcessingResult.builder()
                .eventId(event.getEventId())
                .status(event.getStatus())
                .duplicate(duplicate)
                .result(event.getResult())
                .errorMessage(event.getErrorMessage())
                .build();
    }
}
