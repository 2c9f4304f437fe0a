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

import me.golemcore.pipeline.domain.exception.SimilarityResolutionException;
import me.golemcore.pipeline.domain.model.ContentSimilarity;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.SimilarityResolution;
import me.golemcore.pipeline.domain.model.SimilarityRunResult;
import me.golemcore.pipeline.domain.model.SimilarityStats;
import me.golemcore.pipeline.domain.model.SimilarityType;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.InsightRepository;
import me.golemcore.pipeline.port.outbound.SimilarityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Batch duplicate detection over insight problem statements.
 *
 * <p>
 * Pairs scoring at or above the thematic threshold are recorded once per
 * unordered pair for human triage. Detection never deletes anything; only
 * {@link #resolve} with {@code MERGE} or {@code DELETE_NEWER} removes an
 * insight.
 */
@Service
@Slf4j
public class SimilarityDetectionService {

    private final SimilarityRepository similarityRepository;
    private final InsightRepository insightRepository;
    private final TextSimilarityScorer similarityScorer;
    private final InsightMergeStrategy mergeStrategy;
    private final ContentPurgeService contentPurgeService;
    private final Clock clock;
    private final BigDecimal exactThreshold;
    private final BigDecimal nearThreshold;
    private final BigDecimal thematicThreshold;
    private final Duration candidateWindow;
    private final int corpusLimit;

    public SimilarityDetectionService(SimilarityRepository similarityRepository,
            InsightRepository insightRepository, TextSimilarityScorer similarityScorer,
            InsightMergeStrategy mergeStrategy, ContentPurgeService contentPurgeService,
            PipelineProperties properties, Clock clock) {
        this.similarityRepository = similarityRepository;
        this.insightRepository = insightRepository;
        this.similarityScorer = similarityScorer;
        this.mergeStrategy = mergeStrategy;
        this.contentPurgeService = contentPurgeService;
        this.clock = clock;
        PipelineProperties.SimilarityProperties similarity = properties.getSimilarity();
        this.exactThreshold = BigDecimal.valueOf(similarity.getExactThreshold());
        this.nearThreshold = BigDecimal.valueOf(similarity.getNearThreshold());
        this.thematicThreshold = BigDecimal.valueOf(similarity.getThematicThreshold());
        this.candidateWindow = Duration.ofHours(similarity.getCandidateWindowHours());
        this.corpusLimit = similarity.getCorpusLimit();
    }

    /**
     * Most specific class first; empty below the thematic threshold.
     */
    public Optional<SimilarityType> classify(BigDecimal score) {
        if (score.compareTo(exactThreshold) >= 0) {
            return Optional.of(SimilarityType.EXACT);
        }
        if (score.compareTo(nearThreshold) >= 0) {
            return Optional.of(SimilarityType.NEAR);
        }
        if (score.compareTo(thematicThreshold) >= 0) {
            return Optional.of(SimilarityType.THEMATIC);
        }
        return Optional.empty();
    }

    /**
     * Compare insights created within the candidate window against the most
     * recent part of the corpus.
     */
    public SimilarityRunResult detectRecent() {
        Instant since = clock.instant().minus(candidateWindow);
        List<Insight> candidates = insightRepository.findCreatedSince(since);
        List<Insight> corpus = insightRepository.findAll().stream()
                .sorted(Comparator.comparing(Insight::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(corpusLimit)
                .toList();
        return detect(candidates, corpus);
    }

    /**
     * Compare every candidate with every other candidate and corpus insight.
     * Each unordered pair is scored at most once.
     */
    public SimilarityRunResult detect(List<Insight> candidates, List<Insight> corpus) {
        Map<String, String> documents = new LinkedHashMap<>();
        for (Insight insight : corpus) {
            documents.put(insight.getId(), problemText(insight));
        }
        for (Insight insight : candidates) {
            documents.put(insight.getId(), problemText(insight));
        }

        SimilarityRunResult result = SimilarityRunResult.builder()
                .candidates(candidates.size())
                .build();
        if (candidates.isEmpty()) {
            return result;
        }

        TextSimilarityScorer.Index index = similarityScorer.index(documents);
        Set<String> compared = new HashSet<>();
        Instant now = clock.instant();
        for (Insight candidate : candidates) {
            for (String otherId : documents.keySet()) {
                if (otherId.equals(candidate.getId())) {
                    continue;
                }
                if (!compared.add(ContentSimilarity.pairKey(candidate.getId(), otherId))) {
                    continue;
                }
                result.setComparisons(result.getComparisons() + 1);

                BigDecimal score = index.similarity(candidate.getId(), otherId);
                Optional<SimilarityType> type = classify(score);
                if (type.isEmpty()) {
                    continue;
                }
                ContentSimilarity pair = ContentSimilarity.builder()
                        .sourceInsightId(candidate.getId())
                        .similarInsightId(otherId)
                        .similarityScore(score)
                        .similarityType(type.get())
                        .createdAt(now)
                        .build();
                Optional<ContentSimilarity> stored = similarityRepository.insertIfAbsent(pair);
                if (stored.isPresent()) {
                    result.getRecorded().add(stored.get());
                    log.debug("[Similarity] {} ~ {} = {} ({})", candidate.getId(), otherId, score, type.get());
                } else {
                    result.setAlreadyKnown(result.getAlreadyKnown() + 1);
                }
            }
        }
        log.info("[Similarity] {} candidates, {} comparisons, {} new pairs, {} already known",
                result.getCandidates(), result.getComparisons(), result.getRecorded().size(),
                result.getAlreadyKnown());
        return result;
    }

    /**
     * Resolve an open pair.
     *
     * @throws SimilarityResolutionException
     *             when the pair is already resolved or an insight of the pair
     *             no longer exists
     * @throws IllegalArgumentException
     *             when no pair has the id
     */
    public ContentSimilarity resolve(String similarityId, SimilarityResolution resolution, String resolvedBy) {
        ContentSimilarity pair = similarityRepository.findById(similarityId)
                .orElseThrow(() -> new IllegalArgumentException("Similarity record not found: " + similarityId));

        Insight older = null;
        Insight newer = null;
        if (resolution != SimilarityResolution.KEEP_BOTH) {
            Insight source = requireInsight(pair.getSourceInsightId(), similarityId);
            Insight similar = requireInsight(pair.getSimilarInsightId(), similarityId);
            boolean sourceIsNewer = isNewer(source, similar);
            newer = sourceIsNewer ? source : similar;
            older = sourceIsNewer ? similar : source;
        }

        Instant now = clock.instant();
        ContentSimilarity resolved = similarityRepository.update(similarityId, current -> {
            if (current.isResolved()) {
                throw new SimilarityResolutionException(
                        "Similarity " + similarityId + " already resolved as " + current.getResolution());
            }
            current.setResolved(true);
            current.setResolution(resolution);
            current.setResolvedBy(resolvedBy);
            current.setResolvedAt(now);
            return current;
        });

        switch (resolution) {
        case KEEP_BOTH -> log.info("[Similarity] {} kept both by {}", similarityId, resolvedBy);
        case MERGE -> {
            Insight merged = mergeStrategy.merge(older, newer);
            merged.setUpdatedAt(now);
            insightRepository.save(merged);
            contentPurgeService.deleteInsight(newer.getId());
            log.info("[Similarity] {} merged {} into {} by {}", similarityId, newer.getId(), older.getId(),
                    resolvedBy);
        }
        case DELETE_NEWER -> {
            contentPurgeService.deleteInsight(newer.getId());
            log.info("[Similarity] {} deleted newer insight {} by {}", similarityId, newer.getId(), resolvedBy);
        }
        }
        return resolved;
    }

    /**
     * Pairs ordered by score, highest first. Null filters match everything.
     */
    public List<ContentSimilarity> list(Boolean resolved, SimilarityType type) {
        return similarityRepository.findAll().stream()
                .filter(pair -> resolved == null || pair.isResolved() == resolved)
                .filter(pair -> type == null || pair.getSimilarityType() == type)
                .sorted(Comparator.comparing(ContentSimilarity::getSimilarityScore).reversed())
                .toList();
    }

    public SimilarityStats getStats() {
        List<ContentSimilarity> pairs = similarityRepository.findAll();
        Map<SimilarityType, Long> countsByType = new EnumMap<>(SimilarityType.class);
        for (SimilarityType type : SimilarityType.values()) {
            countsByType.put(type, 0L);
        }
        long unresolved = 0;
        BigDecimal sum = BigDecimal.ZERO;
        for (ContentSimilarity pair : pairs) {
            countsByType.merge(pair.getSimilarityType(), 1L, Long::sum);
            if (!pair.isResolved()) {
                unresolved++;
            }
            sum = sum.add(pair.getSimilarityScore());
        }
        return SimilarityStats.builder()
                .total(pairs.size())
                .unresolved(unresolved)
                .averageScore(pairs.isEmpty() ? null
                        : sum.divide(BigDecimal.valueOf(pairs.size()), 3, RoundingMode.HALF_UP))
                .countsByType(countsByType)
                .build();
    }

    private Insight requireInsight(String insightId, String similarityId) {
        return insightRepository.findById(insightId)
                .orElseThrow(() -> new SimilarityResolutionException(
                        "Insight " + insightId + " of similarity " + similarityId + " no longer exists"));
    }

    private static boolean isNewer(Insight first, Insight second) {
        Instant a = first.getCreatedAt();
        Instant b = second.getCreatedAt();
        if (a == null || b == null) {
            return a != null;
        }
        if (a.equals(b)) {
            return first.getId().compareTo(second.getId()) > 0;
        }
        return a.isAfter(b);
    }

    private static String problemText(Insight insight) {
        return insight.getProblemStatement() == null ? "" : insight.getProblemStatement();
    }
}
