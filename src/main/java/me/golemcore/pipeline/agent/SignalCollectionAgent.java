package me.golemcore.pipeline.agent;

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

import me.golemcore.pipeline.domain.model.AgentRunResult;
import me.golemcore.pipeline.domain.model.IngestionResult;
import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.ScrapedItem;
import me.golemcore.pipeline.domain.service.SignalIngestionService;
import me.golemcore.pipeline.port.outbound.SignalSourcePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects from every enabled source and ingests the items. A failing source
 * is recorded and the others still run; the run fails only when every
 * enabled source failed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SignalCollectionAgent implements PipelineAgent {

    public static final String NAME = "signal_collector";

    private final List<SignalSourcePort> sources;
    private final SignalIngestionService ingestionService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AgentRunResult run(AgentRunContext context) {
        List<String> collected = new ArrayList<>();
        List<String> failedSources = new ArrayList<>();
        int saved = 0;
        int duplicates = 0;
        int failed = 0;

        for (SignalSourcePort source : sources) {
            if (!source.isEnabled()) {
                continue;
            }
            try {
                List<ScrapedItem> items = source.collect();
                IngestionResult result = ingestionService.ingest(source.sourceId(), items);
                saved += result.savedCount();
                duplicates += result.getDuplicates();
                failed += result.getFailed();
                collected.add(source.sourceId());
            } catch (RuntimeException e) {
                log.error("[Collector] Source {} failed: {}", source.sourceId(), e.getMessage());
                failedSources.add(source.sourceId());
            }
        }

        if (collected.isEmpty() && !failedSources.isEmpty()) {
            throw new IllegalStateException("All signal sources failed: " + failedSources);
        }

        AgentRunResult result = AgentRunResult.builder()
                .itemsProcessed(saved)
                .itemsFailed(failed)
                .build();
        result.getMetadata().put(MetadataKeys.SOURCES, collected);
        result.getMetadata().put(MetadataKeys.DUPLICATES, duplicates);
        if (!failedSources.isEmpty()) {
            result.getMetadata().put(MetadataKeys.FAILED_SOURCES, failedSources);
        }
        return result;
    }
}
