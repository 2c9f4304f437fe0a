package me.golemcore.pipeline.adapter.inbound.webhook.handler;

import me.golemcore.pipeline.adapter.outbound.storage.JsonRawSignalRepository;
import me.golemcore.pipeline.domain.model.RawSignal;
import me.golemcore.pipeline.domain.service.SignalIngestionService;
import me.golemcore.pipeline.infrastructure.config.PipelineConfiguration;
import me.golemcore.pipeline.testsupport.InMemoryStoragePort;
import me.golemcore.pipeline.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalBatchWebhookHandlerTest {

    private JsonRawSignalRepository repository;
    private SignalBatchWebhookHandler handler;

    @BeforeEach
    void setUp() {
        repository = new JsonRawSignalRepository(new InMemoryStoragePort(), PipelineConfiguration.objectMapper());
        handler = new SignalBatchWebhookHandler(new SignalIngestionService(repository,
                new MutableClock(Instant.parse("2026-03-01T12:00:00Z"))));
    }

    @Test
    void shouldIngestItemsUnderGivenSource() {
        Map<String, Object> result = handler.handle(payload("producthunt", List.of(
                Map.of("url", "https://ph/1", "title", "Invoices", "content", "Invoices are painful",
                        "metadata", Map.of("votes", 12)),
                Map.of("url", "https://ph/2", "content", "Invoices are painful"),
                Map.of("url", "https://ph/3", "content", " "))));

        assertEquals("producthunt", result.get("source"));
        assertEquals(1, result.get("saved"));
        assertEquals(1, result.get("duplicates"));
        assertEquals(1, result.get("failed"));
        RawSignal stored = repository.findUnprocessed(10).get(0);
        assertEquals("producthunt", stored.getSource());
        assertEquals(12, stored.getMetadata().get("votes"));
        assertEquals("Invoices", stored.getMetadata().get("title"));
    }

    @Test
    void shouldRejectPayloadWithoutData() {
        assertThrows(IllegalArgumentException.class, () -> handler.handle(Map.of("id", "evt_1")));
    }

    @Test
    void shouldRejectMissingSource() {
        assertThrows(IllegalArgumentException.class, () -> handler.handle(payload(" ", List.of())));
    }

    @Test
    void shouldRejectMalformedItems() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source", "producthunt");
        data.put("items", "not a list");

        assertThrows(IllegalArgumentException.class, () -> handler.handle(Map.of("data", data)));
        assertThrows(IllegalArgumentException.class,
                () -> handler.handle(payload("producthunt", List.of("plain string"))));
        assertEquals(0, repository.count());
    }

    private static Map<String, Object> payload(String source, List<?> items) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source", source);
        data.put("items", items);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", "evt_1");
        payload.put("type", SignalBatchWebhookHandler.EVENT_TYPE);
        payload.put("data", data);
        return payload;
    }
}
