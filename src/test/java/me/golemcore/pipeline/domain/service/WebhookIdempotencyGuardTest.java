package me.golemcore.pipeline.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pipeline.adapter.outbound.storage.JsonWebhookEventRepository;
import me.golemcore.pipeline.domain.model.WebhookEvent;
import me.golemcore.pipeline.domain.model.WebhookEventStatus;
import me.golemcore.pipeline.domain.model.WebhookProcessingResult;
import me.golemcore.pipeline.infrastructure.config.PipelineConfiguration;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.inbound.WebhookEventHandler;
import me.golemcore.pipeline.testsupport.InMemoryStoragePort;
import me.golemcore.pipeline.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class WebhookIdempotencyGuardTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String EVENT_ID = "evt_1";
    private static final String EVENT_TYPE = "signals.batch";

    private JsonWebhookEventRepository repository;
    private PipelineProperties properties;
    private MutableClock clock;
    private WebhookIdempotencyGuard guard;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = PipelineConfiguration.objectMapper();
        repository = new JsonWebhookEventRepository(new InMemoryStoragePort(), objectMapper);
        properties = new PipelineProperties();
        clock = new MutableClock(FIXED_NOW);
        guard = newGuard(objectMapper);
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldProcessNewEventAndStoreResult() {
        CountingHandler handler = new CountingHandler(payload -> Map.of("saved", 2));

        WebhookProcessingResult result = guard.process(EVENT_ID, EVENT_TYPE, payload(), handler);

        assertEquals(1, handler.calls.get());
        assertEquals(WebhookEventStatus.PROCESSED, result.getStatus());
        assertFalse(result.isDuplicate());
        assertEquals(2, result.getResult().get("saved"));
        WebhookEvent stored = repository.findByEventId(EVENT_ID).orElseThrow();
        assertEquals(1, stored.getAttempts());
        assertEquals(FIXED_NOW, stored.getProcessedAt());
    }

    @Test
    void shouldStoreRedactedPayloadButHandleOriginal() {
        CountingHandler handler = new CountingHandler(payload -> {
            assertEquals("ada@example.com", objectField(payload, "email"));
            return Map.of();
        });

        guard.process(EVENT_ID, EVENT_TYPE, payload(), handler);

        WebhookEvent stored = repository.findByEventId(EVENT_ID).orElseThrow();
        assertEquals(WebhookPayloadSanitizer.REDACTED, objectField(stored.getPayload(), "email"));
        assertEquals("inv_7", objectField(stored.getPayload(), "invoice"));
    }

    @Test
    void duplicateDeliveryShouldReturnStoredResultWithoutHandling() {
        CountingHandler handler = new CountingHandler(payload -> Map.of("saved", 2));
        guard.process(EVENT_ID, EVENT_TYPE, payload(), handler);

        WebhookProcessingResult again = guard.process(EVENT_ID, EVENT_TYPE, payload(), handler);

        assertEquals(1, handler.calls.get());
        assertTrue(again.isDuplicate());
        assertEquals(WebhookEventStatus.PROCESSED, again.getStatus());
        assertEquals(2, again.getResult().get("saved"));
    }

    @Test
    void failedEventShouldBeStoredAndRetriedOnRedelivery() {
        CountingHandler failing = new CountingHandler(payload -> {
            throw new IllegalArgumentException("'source' is required");
        });

        assertThrows(IllegalArgumentException.class, () -> guard.process(EVENT_ID, EVENT_TYPE, payload(), failing));

        WebhookEvent failed = repository.findByEventId(EVENT_ID).orElseThrow();
        assertEquals(WebhookEventStatus.FAILED, failed.getStatus());
        assertEquals("'source' is required", failed.getErrorMessage());

        CountingHandler succeeding = new CountingHandler(payload -> Map.of("saved", 1));
        WebhookProcessingResult retried = guard.process(EVENT_ID, EVENT_TYPE, payload(), succeeding);

        assertFalse(retried.isDuplicate());
        assertEquals(WebhookEventStatus.PROCESSED, retried.getStatus());
        assertNull(retried.getErrorMessage());
        assertEquals(2, repository.findByEventId(EVENT_ID).orElseThrow().getAttempts());
    }

    @Test
    void errorFromHandlerShouldBeStoredAndRetriedOnRedelivery() {
        CountingHandler crashing = new CountingHandler(payload -> {
            throw new StackOverflowError();
        });

        assertThrows(StackOverflowError.class, () -> guard.process(EVENT_ID, EVENT_TYPE, payload(), crashing));

        WebhookEvent failed = repository.findByEventId(EVENT_ID).orElseThrow();
        assertEquals(WebhookEventStatus.FAILED, failed.getStatus());
        assertEquals("StackOverflowError", failed.getErrorMessage());

        CountingHandler succeeding = new CountingHandler(payload -> Map.of("saved", 1));
        WebhookProcessingResult retried = guard.process(EVENT_ID, EVENT_TYPE, payload(), succeeding);

        assertEquals(1, succeeding.calls.get());
        assertFalse(retried.isDuplicate());
        assertEquals(WebhookEventStatus.PROCESSED, retried.getStatus());
    }

    @Test
    void abandonedProcessingRowShouldBeReclaimedAfterLease() {
        repository.claim(WebhookEvent.builder()
                .eventId(EVENT_ID)
                .eventType(EVENT_TYPE)
                .receivedAt(FIXED_NOW)
                .build(), null);
        CountingHandler handler = new CountingHandler(payload -> Map.of("saved", 1));

        clock.advance(Duration.ofMinutes(5));
        WebhookProcessingResult withinLease = guard.process(EVENT_ID, EVENT_TYPE, payload(), handler);

        assertTrue(withinLease.isDuplicate());
        assertEquals(WebhookEventStatus.PROCESSING, withinLease.getStatus());
        assertEquals(0, handler.calls.get());

        clock.advance(Duration.ofMinutes(6));
        WebhookProcessingResult afterLease = guard.process(EVENT_ID, EVENT_TYPE, payload(), handler);

        assertFalse(afterLease.isDuplicate());
        assertEquals(WebhookEventStatus.PROCESSED, afterLease.getStatus());
        assertEquals(1, handler.calls.get());
        assertEquals(2, repository.findByEventId(EVENT_ID).orElseThrow().getAttempts());
    }

    @Test
    void concurrentDeliveryShouldWaitForFirstOutcome() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountingHandler handler = new CountingHandler(payload -> {
            entered.countDown();
            await(release);
            return Map.of("saved", 3);
        });

        Future<WebhookProcessingResult> first = executor.submit(
                () -> guard.process(EVENT_ID, EVENT_TYPE, payload(), handler));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        Future<WebhookProcessingResult> second = executor.submit(
                () -> guard.process(EVENT_ID, EVENT_TYPE, payload(), handler));
        release.countDown();

        WebhookProcessingResult firstResult = first.get(5, TimeUnit.SECONDS);
        WebhookProcessingResult secondResult = second.get(5, TimeUnit.SECONDS);

        assertEquals(1, handler.calls.get());
        assertFalse(firstResult.isDuplicate());
        assertTrue(secondResult.isDuplicate());
        assertEquals(WebhookEventStatus.PROCESSED, secondResult.getStatus());
        assertEquals(3, secondResult.getResult().get("saved"));
    }

    @Test
    void concurrentDeliveryShouldReportProcessingAfterWaitTimeout() throws Exception {
        properties.getWebhook().setConcurrentWaitMs(50);
        guard = newGuard(PipelineConfiguration.objectMapper());
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountingHandler handler = new CountingHandler(payload -> {
            entered.countDown();
            await(release);
            return Map.of();
        });
        Future<WebhookProcessingResult> first = executor.submit(
                () -> guard.process(EVENT_ID, EVENT_TYPE, payload(), handler));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        WebhookProcessingResult waiting = guard.process(EVENT_ID, EVENT_TYPE, payload(), handler);

        assertTrue(waiting.isDuplicate());
        assertEquals(WebhookEventStatus.PROCESSING, waiting.getStatus());
        release.countDown();
        assertEquals(WebhookEventStatus.PROCESSED, first.get(5, TimeUnit.SECONDS).getStatus());
    }

    private WebhookIdempotencyGuard newGuard(ObjectMapper objectMapper) {
        return new WebhookIdempotencyGuard(repository, new WebhookPayloadSanitizer(objectMapper, properties),
                properties, clock);
    }

    private static Map<String, Object> payload() {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("email", "ada@example.com");
        object.put("invoice", "inv_7");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("object", object);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", EVENT_ID);
        payload.put("type", EVENT_TYPE);
        payload.put("data", data);
        return payload;
    }

    @SuppressWarnings("unchecked")
    private static Object objectField(Map<String, Object> payload, String field) {
        Map<String, Object> data = (Map<String, Object>) payload.get("data");
        return ((Map<String, Object>) data.get("object")).get(field);
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static final class CountingHandler implements WebhookEventHandler {

        private final AtomicInteger calls = new AtomicInteger();
        private final Function<Map<String, Object>, Map<String, Object>> behaviour;

        private CountingHandler(Function<Map<String, Object>, Map<String, Object>> behaviour) {
            this.behaviour = behaviour;
        }

        @Override
        public String eventType() {
            return EVENT_TYPE;
        }

        @Override
        public Map<String, Object> handle(Map<String, Object> payload) {
            calls.incrementAndGet();
            return behaviour.apply(payload);
        }
    }
}
