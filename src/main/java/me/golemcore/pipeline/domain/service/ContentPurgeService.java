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

import me.golemcore.pipeline.domain.model.ContentType;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.port.outbound.InsightRepository;
import me.golemcore.pipeline.port.outbound.RawSignalRepository;
import me.golemcore.pipeline.port.outbound.ReviewQueueRepository;
import me.golemcore.pipeline.port.outbound.SimilarityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Explicit deletions with their cascades. Nothing else in the pipeline removes
 * stored content.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentPurgeService {

    private final RawSignalRepository rawSignalRepository;
    private final InsightRepository insightRepository;
    private final ReviewQueueRepository reviewQueueRepository;
    private final SimilarityRepository similarityRepository;
    private final Clock clock;

    /**
     * Delete an insight together with its review entry and open similarity
     * pairs.
     *
     * @return whether the insight existed
     */
    public boolean deleteInsight(String insightId) {
        int reviewEntries = reviewQueueRepository.deleteByContent(ContentType.INSIGHT, insightId);
        int pairs = similarityRepository.deleteUnresolvedByInsightId(insightId);
        boolean deleted = insightRepository.deleteById(insightId);
        log.info("[Purge] Insight {} deleted={} (review entries: {}, open pairs: {})",
                insightId, deleted, reviewEntries, pairs);
        return deleted;
    }

    /**
     * Remove signals older than the retention period along with their
     * insights.
     *
     * @return number of removed signals
     */
    public int purgeSignalsOlderThan(Duration retention) {
        return purgeSignalsCreatedBefore(clock.instant().minus(retention));
    }

    public int purgeSignalsCreatedBefore(Instant cutoff) {
        List<String> signalIds = rawSignalRepository.purgeOlderThan(cutoff);
        if (signalIds.isEmpty()) {
            return 0;
        }
        List<Insight> insights = insightRepository.findByRawSignalIds(signalIds);
        for (Insight insight : insights) {
            deleteInsight(insight.getId());
        }
        log.info("[Purge] Removed {} signals created before {} and {} derived insights",
                signalIds.size(), cutoff, insights.size());
        return signalIds.size();
    }
}
