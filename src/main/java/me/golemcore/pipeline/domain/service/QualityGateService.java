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

import me.golemcore.pipeline.domain.exception.ReviewTransitionException;
import me.golemcore.pipeline.domain.model.BulkReviewResult;
import me.golemcore.pipeline.domain.model.ContentReviewEntry;
import me.golemcore.pipeline.domain.model.ContentType;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.ReviewDecision;
import me.golemcore.pipeline.domain.model.ReviewQueueFilter;
import me.golemcore.pipeline.domain.model.ReviewQueueStats;
import me.golemcore.pipeline.domain.model.ReviewStatus;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.ReviewQueueRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Review queue state machine for AI-generated content.
 *
 * <p>
 * On submission a score at or above the auto-approve threshold approves the
 * entry automatically; a score at or below the auto-flag threshold, or no
 * score at all, flags it for mandatory human review; anything in between
 * stays pending. The queue holds one entry per (content type, content id):
 * re-submission updates that entry.
 *
 * <p>
 * Human decisions apply to pending and flagged entries, and may override an
 * auto-approval. Manually approved or rejected entries are final.
 */
@Service
@Slf4j
public class QualityGateService {

    private static final int SCORE_SCALE = 2;

    private final ReviewQueueRepository reviewQueueRepository;
    private final QualityScorer qualityScorer;
    private final Clock clock;
    private final BigDecimal autoApproveThreshold;
    private final BigDecimal autoFlagThreshold;

    public QualityGateService(ReviewQueueRepository reviewQueueRepository, QualityScorer qualityScorer,
            PipelineProperties properties, Clock clock) {
        this.reviewQueueRepository = reviewQueueRepository;
        this.qualityScorer = qualityScorer;
        this.clock = clock;
        this.autoApproveThreshold = properties.getQuality().getAutoApproveThreshold();
        this.autoFlagThreshold = properties.getQuality().getAutoFlagThreshold();
    }

    /**
     * Initial status for a freshly scored entry.
     */
    public ReviewStatus evaluate(BigDecimal score) {
        if (score == null || score.compareTo(autoFlagThreshold) <= 0) {
            return ReviewStatus.FLAGGED;
        }
        if (score.compareTo(autoApproveThreshold) >= 0) {
            return ReviewStatus.APPROVED;
        }
        return ReviewStatus.PENDING;
    }

    public ContentReviewEntry submitInsight(Insight insight) {
        return submit(ContentType.INSIGHT, insight.getId(), qualityScorer.score(insight));
    }

    /**
     * Queue or re-queue an artifact. Terminal entries keep their status and
     * only take the new score.
     */
    public ContentReviewEntry submit(ContentType contentType, String contentId, BigDecimal qualityScore) {
        BigDecimal score = normalizeScore(qualityScore);
        Instant now = clock.instant();

        ContentReviewEntry entry = reviewQueueRepository.compute(contentType, contentId, current -> {
            if (current == null) {
                ReviewStatus status = evaluate(score);
                return ContentReviewEntry.builder()
                        .contentType(contentType)
                        .contentId(contentId)
                        .qualityScore(score)
                        .status(status)
                        .autoApproved(status == ReviewStatus.APPROVED)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
            }
            current.setQualityScore(score);
            current.setUpdatedAt(now);
            if (!current.getStatus().isTerminal()) {
                ReviewStatus status = evaluate(score);
                current.setStatus(status);
                current.setAutoApproved(status == ReviewStatus.APPROVED);
            }
            return current;
        });

        log.info("[QualityGate] {} {} scored {} -> {}{}", contentType, contentId, score, entry.getStatus(),
                entry.isAutoApproved() ? " (auto)" : "");
        return entry;
    }

    /**
     * Apply a human decision.
     *
     * @throws ReviewTransitionException
     *             when the entry was already manually approved or rejected
     * @throws IllegalArgumentException
     *             when the entry does not exist
     */
    public ContentReviewEntry review(String entryId, ReviewDecision decision, String reviewerId, String notes,
            String rejectionReason) {
        Instant now = clock.instant();
        ContentReviewEntry reviewed = reviewQueueRepository.update(entryId, entry -> {
            boolean overridingAutoApproval = entry.getStatus() == ReviewStatus.APPROVED && entry.isAutoApproved();
            if (entry.getStatus().isTerminal() && !overridingAutoApproval) {
                throw new ReviewTransitionException("Review entry " + entryId + " is already "
                        + entry.getStatus() + "; cannot " + decision);
            }
            entry.setStatus(decision.targetStatus());
            entry.setAutoApproved(false);
            entry.setReviewerId(reviewerId);
            entry.setReviewNotes(notes);
            entry.setRejectionReason(decision == ReviewDecision.REJECT ? rejectionReason : null);
            entry.setReviewedAt(now);
            entry.setUpdatedAt(now);
            return entry;
        });
        log.info("[QualityGate] Entry {} {} by {}", entryId, reviewed.getStatus(), reviewerId);
        return reviewed;
    }

    public BulkReviewResult bulkReview(List<String> entryIds, ReviewDecision decision, String reviewerId,
            String notes) {
        if (decision == ReviewDecision.FLAG) {
            throw new IllegalArgumentException("Bulk review supports approve and reject only");
        }
        BulkReviewResult result = BulkReviewResult.builder().build();
        for (String entryId : entryIds) {
            try {
                review(entryId, decision, reviewerId, notes, decision == ReviewDecision.REJECT ? notes : null);
                result.getProcessedIds().add(entryId);
            } catch (ReviewTransitionException | IllegalArgumentException e) {
                result.getFailures().put(entryId, e.getMessage());
            }
        }
        log.info("[QualityGate] Bulk {}: {} processed, {} failed", decision, result.getProcessedIds().size(),
                result.getFailures().size());
        return result;
    }

    public Optional<ContentReviewEntry> findEntry(ContentType contentType, String contentId) {
        return reviewQueueRepository.findByContent(contentType, contentId);
    }

    /**
     * Entries matching the filter, newest first.
     */
    public List<ContentReviewEntry> list(ReviewQueueFilter filter) {
        Stream<ContentReviewEntry> matching = reviewQueueRepository.findAll().stream()
                .filter(filter::accepts)
                .sorted(Comparator.comparing(ContentReviewEntry::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())));
        if (filter.getLimit() != null) {
            matching = matching.limit(filter.getLimit());
        }
        return matching.toList();
    }

    public ReviewQueueStats getStats() {
        List<ContentReviewEntry> entries = reviewQueueRepository.findAll();
        Map<ReviewStatus, Long> counts = new EnumMap<>(ReviewStatus.class);
        for (ReviewStatus status : ReviewStatus.values()) {
            counts.put(status, 0L);
        }
        long autoApproved = 0;
        BigDecimal scoreSum = BigDecimal.ZERO;
        int scored = 0;
        for (ContentReviewEntry entry : entries) {
            counts.merge(entry.getStatus(), 1L, Long::sum);
            if (entry.isAutoApproved()) {
                autoApproved++;
            }
            if (entry.getQualityScore() != null) {
                scoreSum = scoreSum.add(entry.getQualityScore());
                scored++;
            }
        }
        long approved = counts.get(ReviewStatus.APPROVED);
        return ReviewQueueStats.builder()
                .total(entries.size())
                .countsByStatus(counts)
                .autoApproved(autoApproved)
                .autoApprovedRate(approved == 0 ? 0.0 : (double) autoApproved / approved)
                .averageScore(scored == 0 ? null
                        : scoreSum.divide(BigDecimal.valueOf(scored), SCORE_SCALE, RoundingMode.HALF_UP))
                .build();
    }

    private static BigDecimal normalizeScore(BigDecimal score) {
        if (score == null) {
            return null;
        }
        if (score.compareTo(BigDecimal.ZERO) < 0 || score.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Quality score must be within [0, 1], got " + score);
        }
        return score.setScale(SCORE_SCALE, RoundingMode.HALF_UP);
    }
}
