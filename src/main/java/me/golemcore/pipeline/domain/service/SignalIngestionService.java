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

import me.golemcore.pipeline.domain.exception.DuplicateContentException;
import me.golemcore.pipeline.domain.model.IngestionResult;
import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.RawSignal;
import me.golemcore.pipeline.domain.model.ScrapedItem;
import me.golemcore.pipeline.port.outbound.RawSignalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Admits scraped items as raw signals. The content-hash unique key of the
 * store is the dedup authority; a duplicate is a soft skip, never a batch
 * failure. A second item with the same (source, url) is skipped as well.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalIngestionService {

    private final RawSignalRepository rawSignalRepository;
    private final Clock clock;

    public IngestionResult ingest(String source, List<ScrapedItem> items) {
        IngestionResult result = IngestionResult.builder().build();
        for (ScrapedItem item : items) {
            try {
                Optional<RawSignal> saved = ingestOne(source, item);
                if (saved.isPresent()) {
                    result.getSaved().add(saved.get());
                } else {
                    result.setDuplicates(result.getDuplicates() + 1);
                }
            } catch (IllegalArgumentException e) {
                result.setFailed(result.getFailed() + 1);
                log.warn("[Ingest] Rejected item from {}: {}", source, e.getMessage());
            } catch (RuntimeException e) {
                result.setFailed(result.getFailed() + 1);
                log.error("[Ingest] Failed to store item from {} ({})", source, item.getUrl(), e);
            }
        }
        log.info("[Ingest] {}: {} saved, {} duplicates, {} failed", source, result.savedCount(),
                result.getDuplicates(), result.getFailed());
        return result;
    }

    /**
     * Store one item.
     *
     * @return the stored signal, or empty when it duplicates an existing one
     */
    public Optional<RawSignal> ingestOne(String source, ScrapedItem item) {
        String content = ContentHasher.normalize(item.getContent());
        if (content.isEmpty()) {
            throw new IllegalArgumentException("empty content (" + item.getUrl() + ")");
        }
        if (rawSignalRepository.existsBySourceAndUrl(source, item.getUrl())) {
            log.debug("[Ingest] Skipping known url {} from {}", item.getUrl(), source);
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (item.getMetadata() != null) {
            metadata.putAll(item.getMetadata());
        }
        if (item.getTitle() != null && !item.getTitle().isBlank()) {
            metadata.put(MetadataKeys.TITLE, ContentHasher.normalize(item.getTitle()));
        }

        RawSignal signal = RawSignal.builder()
                .source(source)
                .url(item.getUrl())
                .content(content)
                .contentHash(ContentHasher.sha256(content))
                .metadata(metadata)
                .processed(false)
                .createdAt(clock.instant())
                .build();
        try {
            RawSignal saved = rawSignalRepository.insert(signal);
            log.debug("[Ingest] Stored signal {} from {}", saved.getId(), source);
            return Optional.of(saved);
        } catch (DuplicateContentException e) {
            log.debug("[Ingest] Duplicate content {} from {} (existing {})", e.getContentHash(), source,
                    e.getExistingId());
            return Optional.empty();
        }
    }
}
