package me.golemcore.pipeline.adapter.inbound.webhook.handler;

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

import me.golemcore.pipeline.domain.model.IngestionResult;
import me.golemcore.pipeline.domain.model.ScrapedItem;
import me.golemcore.pipeline.domain.service.SignalIngestionService;
import me.golemcore.pipeline.port.inbound.WebhookEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ingests signals pushed by an external scraper.
 *
 * <p>
 * Expected body: {@code {"data": {"source": "...", "items": [{"url", "title",
 * "content", "metadata"}]}}}.
 */
@Component
@RequiredArgsConstructor
public class SignalBatchWebhookHandler implements WebhookEventHandler {

    public static final String EVENT_TYPE = "signals.batch";

    private final SignalIngestionService ingestionService;

    @Override
    public String eventType() {
        return EVENT_TYPE;
    }

    @Override
    public Map<String, Object> handle(Map<String, Object> payload) {
        Map<?, ?> data = WebhookPayloads.requireData(payload);
        String source = WebhookPayloads.requireString(data, "source");
        if (!(data.get("items") instanceof List<?> rawItems)) {
            throw new IllegalArgumentException("'data.items' must be a list");
        }

        List<ScrapedItem> items = new ArrayList<>(rawItems.size());
        for (Object rawItem : rawItems) {
            if (!(rawItem instanceof Map<?, ?> item)) {
                throw new IllegalArgumentException("Every item must be an object");
            }
            items.add(ScrapedItem.builder()
                    .url(WebhookPayloads.optionalString(item, "url"))
                    .title(WebhookPayloads.optionalString(item, "title"))
                    .content(WebhookPayloads.optionalString(item, "content"))
                    .metadata(WebhookPayloads.optionalMap(item, "metadata"))
                    .build());
        }

        IngestionResult ingestion = ingestionService.ingest(source, items);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("source", source);
        result.put("saved", ingestion.savedCount());
        result.put("duplicates", ingestion.getDuplicates());
        result.put("failed", ingestion.getFailed());
        return result;
    }
}
