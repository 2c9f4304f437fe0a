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

import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.WebhookProcessingResult;
import me.golemcore.pipeline.domain.service.WebhookIdempotencyGuard;
import me.golemcore.pipeline.port.inbound.WebhookEventHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches events to the handler registered for their type, through the
 * idempotency guard. Events without a handler are still recorded, with an
 * {@code ignored} result.
 */
@Component
@Slf4j
public class WebhookEventRouter {

    private final WebhookIdempotencyGuard idempotencyGuard;
    private final Map<String, WebhookEventHandler> handlers = new HashMap<>();

    public WebhookEventRouter(WebhookIdempotencyGuard idempotencyGuard, List<WebhookEventHandler> handlers) {
        this.idempotencyGuard = idempotencyGuard;
        for (WebhookEventHandler handler : handlers) {
            WebhookEventHandler previous = this.handlers.put(handler.eventType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate webhook handler for " + handler.eventType());
            }
        }
        log.info("[Webhook] Handlers registered for: {}", this.handlers.keySet());
    }

    public WebhookProcessingResult route(String eventId, String eventType, Map<String, Object> payload) {
        WebhookEventHandler handler = handlers.getOrDefault(eventType, new IgnoringHandler(eventType));
        return idempotencyGuard.process(eventId, eventType, payload, handler);
    }

    private record IgnoringHandler(String eventType) implements WebhookEventHandler {

        @Override
        public Map<String, Object> handle(Map<String, Object> payload) {
            log.debug("[Webhook] No handler for event type {}", eventType);
            return Map.of(MetadataKeys.STATUS, MetadataKeys.STATUS_IGNORED);
        }
    }
}
