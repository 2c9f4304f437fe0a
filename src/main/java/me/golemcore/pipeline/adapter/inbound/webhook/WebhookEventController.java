package me.golemcore.pipeline.adapter.inbound.webhook;

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

import me.golemcore.pipeline.adapter.inbound.webhook.dto.WebhookEventResponse;
import me.golemcore.pipeline.domain.model.WebhookProcessingResult;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound webhook endpoint (WebFlux).
 *
 * <p>
 * {@code POST /api/webhooks/events} accepts {@code {"id", "type", "data"}}.
 * Responses:
 * <ul>
 * <li>200 with the stored result, for first and duplicate deliveries</li>
 * <li>400 for malformed JSON, a missing id or type, or a payload the handler
 * rejects</li>
 * <li>404 when webhooks are disabled</li>
 * <li>413 when the body exceeds the configured size</li>
 * <li>500 when the handler fails; the delivery may be retried</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/webhooks")
@Slf4j
public class WebhookEventController {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final WebhookEventRouter router;
    private final ObjectMapper objectMapper;
    private final PipelineProperties.WebhookProperties properties;

    public WebhookEventController(WebhookEventRouter router, ObjectMapper objectMapper,
            PipelineProperties properties) {
        this.router = router;
        this.objectMapper = objectMapper;
        this.properties = properties.getWebhook();
    }

    @PostMapping("/events")
    public Mono<ResponseEntity<WebhookEventResponse>> receive(@RequestBody byte[] body) {
        return Mono.fromCallable(() -> handle(body))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ResponseEntity<WebhookEventResponse> handle(byte[] body) {
        if (!properties.isEnabled()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(WebhookEventResponse.error("Webhooks are not enabled"));
        }
        if (body.length > properties.getMaxPayloadBytes()) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                    .body(WebhookEventResponse.error("Payload exceeds maximum size"));
        }

        Map<String, Object> payload;
        try {
            payload = objectMapper.readValue(body, MAP_TYPE);
        } catch (IOException e) {
            log.debug("[Webhook] Malformed payload: {}", e.getMessage());
            return badRequest(null, "Malformed JSON payload");
        }
        if (payload == null) {
            return badRequest(null, "Empty payload");
        }

        String eventId = stringField(payload, "id");
        String eventType = stringField(payload, "type");
        if (eventId == null) {
            return badRequest(null, "'id' is required");
        }
        if (eventType == null) {
            return badRequest(eventId, "'type' is required");
        }

        try {
            WebhookProcessingResult result = router.route(eventId, eventType, payload);
            return ResponseEntity.ok(WebhookEventResponse.from(result));
        } catch (IllegalArgumentException e) {
            return badRequest(eventId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Webhook] Event {} ({}) failed: {}", eventId, eventType, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(WebhookEventResponse.error(eventId, "Event processing failed"));
        }
    }

    private static String stringField(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return value.toString();
    }

    private static ResponseEntity<WebhookEventResponse> badRequest(String eventId, String message) {
        return ResponseEntity.badRequest()
                .body(WebhookEventResponse.error(eventId, message));
    }
}
