package me.golemcore.pipeline.domain.service;

import me.golemcore.pipeline.adapter.outbound.storage.JsonReviewQueueRepository;
import me.golemcore.pipeline.domain.exception.ReviewTransitionException;
import me.golemcore.pipeline.domain.model.BulkReviewResult;
import me.golemcore.pipeline.domain.model.ContentReviewEntry;
import me.golemcore.pipeline.domain.model.ContentType;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.ReviewDecision;
import me.golemcore.pipeline.domain.model.ReviewQueueFilter;
import me.golemcore.pipeline.domain.model.ReviewQueueStats;
import me.golemcore.pipeline.domain.model.ReviewStatus;
import me.golemcore.pipeline.infrastructure.config.PipelineConfiguration;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.ReviewQueueRepository;
import me.golemcore.pipeline.testsupport.InMemoryStoragePort;
import me.golemcore.pipeline.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QualityGateServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String REVIEWER = "alice";

    private ReviewQueueRepository repository;
    private MutableClock clock;
    private QualityGateService service;

    @BeforeEach
    void setUp() {
        repository = new JsonReviewQueueRepository(new InMemoryStoragePort(), PipelineConfiguration.objectMapper());
        clock = new MutableClock(FIXED_NOW);
        service = new QualityGateService(repository, new QualityScorer(), new PipelineProperties(), clock);
    }

    @Test
    void evaluateShouldApplyThresholds() {
        assertEquals(ReviewStatus.APPROVED, service.evaluate(new BigDecimal("0.85")));
        assertEquals(ReviewStatus.APPROVED, service.evaluate(BigDecimal.ONE));
        assertEquals(ReviewStatus.PENDING, service.evaluate(new BigDecimal("0.84")));
        assertEquals(ReviewStatus.PENDING, service.evaluate(new BigDecimal("0.41")));
        assertEquals(ReviewStatus.FLAGGED, service.evaluate(new BigDecimal("0.40")));
        assertEquals(ReviewStatus.FLAGGED, service.evaluate(BigDecimal.ZERO));
        assertEquals(ReviewStatus.FLAGGED, service.evaluate(null));
    }

    @Test
    void shouldAutoApproveHighScore() {
        ContentReviewEntry entry = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.9"));

        assertEquals(ReviewStatus.APPROVED, entry.getStatus());
        assertTrue(entry.isAutoApproved());
        assertEquals(new BigDecimal("0.90"), entry.getQualityScore());
        assertNull(entry.getReviewerId());
        assertEquals(FIXED_NOW, entry.getCreatedAt());
    }

    @Test
    void shouldFlagMissingScore() {
        ContentReviewEntry entry = service.submit(ContentType.RESEARCH, "res-1", null);

        assertEquals(ReviewStatus.FLAGGED, entry.getStatus());
        assertFalse(entry.isAutoApproved());
    }

    @Test
    void shouldRejectScoreOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("1.01")));
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("-0.01")));
    }

    @Test
    void resubmitShouldUpdateSingleEntry() {
        ContentReviewEntry first = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.60"));
        clock.advance(Duration.ofMinutes(5));

        ContentReviewEntry second = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.90"));

        assertEquals(first.getId(), second.getId());
        assertEquals(ReviewStatus.APPROVED, second.getStatus());
        assertTrue(second.isAutoApproved());
        assertEquals(FIXED_NOW, second.getCreatedAt());
        assertEquals(FIXED_NOW.plus(Duration.ofMinutes(5)), second.getUpdatedAt());
        assertEquals(1, repository.findAll().size());
    }

    @Test
    void resubmitShouldKeepManualDecision() {
        ContentReviewEntry entry = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.60"));
        service.review(entry.getId(), ReviewDecision.APPROVE, REVIEWER, "good", null);

        ContentReviewEntry resubmitted = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.10"));

        assertEquals(ReviewStatus.APPROVED, resubmitted.getStatus());
        assertEquals(new BigDecimal("0.10"), resubmitted.getQualityScore());
        assertEquals(REVIEWER, resubmitted.getReviewerId());
    }

    @Test
    void shouldRejectWithReason() {
        ContentReviewEntry entry = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.60"));
        clock.advance(Duration.ofHours(1));

        ContentReviewEntry reviewed = service.review(entry.getId(), ReviewDecision.REJECT, REVIEWER,
                "too vague", "no clear buyer");

        assertEquals(ReviewStatus.REJECTED, reviewed.getStatus());
        assertEquals(REVIEWER, reviewed.getReviewerId());
        assertEquals("too vague", reviewed.getReviewNotes());
        assertEquals("no clear buyer", reviewed.getRejectionReason());
        assertEquals(FIXED_NOW.plus(Duration.ofHours(1)), reviewed.getReviewedAt());
    }

    @Test
    void shouldIgnoreRejectionReasonOnApproval() {
        ContentReviewEntry entry = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.60"));

        ContentReviewEntry reviewed = service.review(entry.getId(), ReviewDecision.APPROVE, REVIEWER, null,
                "ignored");

        assertNull(reviewed.getRejectionReason());
    }

    @Test
    void shouldNotReviewManuallyDecidedEntryAgain() {
        ContentReviewEntry entry = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.60"));
        service.review(entry.getId(), ReviewDecision.REJECT, REVIEWER, null, "duplicate");

        assertThrows(ReviewTransitionException.class,
                () -> service.review(entry.getId(), ReviewDecision.APPROVE, "bob", null, null));
        assertEquals(ReviewStatus.REJECTED, repository.findById(entry.getId()).orElseThrow().getStatus());
    }

    @Test
    void shouldAllowOverridingAutoApproval() {
        ContentReviewEntry entry = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.95"));

        ContentReviewEntry reviewed = service.review(entry.getId(), ReviewDecision.REJECT, REVIEWER, null,
                "off topic");

        assertEquals(ReviewStatus.REJECTED, reviewed.getStatus());
        assertFalse(reviewed.isAutoApproved());
    }

    @Test
    void flaggedEntryShouldBeReviewable() {
        ContentReviewEntry entry = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.20"));

        ContentReviewEntry reviewed = service.review(entry.getId(), ReviewDecision.APPROVE, REVIEWER, null, null);

        assertEquals(ReviewStatus.APPROVED, reviewed.getStatus());
    }

    @Test
    void shouldFailReviewOfUnknownEntry() {
        assertThrows(IllegalArgumentException.class,
                () -> service.review("missing", ReviewDecision.APPROVE, REVIEWER, null, null));
    }

    @Test
    void bulkReviewShouldReportPerEntryFailures() {
        ContentReviewEntry pending = service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.60"));
        ContentReviewEntry flagged = service.submit(ContentType.INSIGHT, "ins-2", new BigDecimal("0.10"));
        ContentReviewEntry decided = service.submit(ContentType.INSIGHT, "ins-3", new BigDecimal("0.60"));
        service.review(decided.getId(), ReviewDecision.APPROVE, REVIEWER, null, null);

        BulkReviewResult result = service.bulkReview(
                List.of(pending.getId(), flagged.getId(), decided.getId(), "missing"),
                ReviewDecision.REJECT, REVIEWER, "batch cleanup");

        assertEquals(List.of(pending.getId(), flagged.getId()), result.getProcessedIds());
        assertEquals(2, result.getFailures().size());
        assertTrue(result.getFailures().containsKey(decided.getId()));
        assertTrue(result.getFailures().containsKey("missing"));
        assertEquals("batch cleanup", repository.findById(pending.getId()).orElseThrow().getRejectionReason());
    }

    @Test
    void bulkReviewShouldNotFlag() {
        assertThrows(IllegalArgumentException.class,
                () -> service.bulkReview(List.of("a"), ReviewDecision.FLAG, REVIEWER, null));
    }

    @Test
    void listShouldFilterAndOrderNewestFirst() {
        service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.60"));
        clock.advance(Duration.ofMinutes(1));
        service.submit(ContentType.INSIGHT, "ins-2", new BigDecimal("0.70"));
        clock.advance(Duration.ofMinutes(1));
        service.submit(ContentType.INSIGHT, "ins-3", new BigDecimal("0.95"));
        clock.advance(Duration.ofMinutes(1));
        service.submit(ContentType.RESEARCH, "res-1", new BigDecimal("0.50"));

        List<ContentReviewEntry> pendingInsights = service.list(ReviewQueueFilter.builder()
                .status(ReviewStatus.PENDING)
                .contentType(ContentType.INSIGHT)
                .build());
        List<ContentReviewEntry> lowScores = service.list(ReviewQueueFilter.builder()
                .scoreBelow(new BigDecimal("0.65"))
                .limit(1)
                .build());

        assertEquals(List.of("ins-2", "ins-1"),
                pendingInsights.stream().map(ContentReviewEntry::getContentId).toList());
        assertEquals(List.of("res-1"), lowScores.stream().map(ContentReviewEntry::getContentId).toList());
        assertEquals(4, service.list(ReviewQueueFilter.all()).size());
    }

    @Test
    void statsShouldCountStatusesAndAutoApprovalRate() {
        service.submit(ContentType.INSIGHT, "ins-1", new BigDecimal("0.90"));
        ContentReviewEntry manual = service.submit(ContentType.INSIGHT, "ins-2", new BigDecimal("0.60"));
        service.review(manual.getId(), ReviewDecision.APPROVE, REVIEWER, null, null);
        service.submit(ContentType.INSIGHT, "ins-3", new BigDecimal("0.30"));

        ReviewQueueStats stats = service.getStats();

        assertEquals(3, stats.getTotal());
        assertEquals(2L, stats.getCountsByStatus().get(ReviewStatus.APPROVED));
        assertEquals(1L, stats.getCountsByStatus().get(ReviewStatus.FLAGGED));
        assertEquals(0L, stats.getCountsByStatus().get(ReviewStatus.REJECTED));
        assertEquals(1, stats.getAutoApproved());
        assertEquals(0.5, stats.getAutoApprovedRate(), 0.0001);
        assertEquals(new BigDecimal("0.60"), stats.getAverageScore());
    }

    @Test
    void statsOfEmptyQueue() {
        ReviewQueueStats stats = service.getStats();

        assertEquals(0, stats.getTotal());
        assertEquals(0.0, stats.getAutoApprovedRate());
        assertNull(stats.getAverageScore());
    }

    @Test
    void submitInsightShouldUseQualityScore() {
        Insight insight = QualityScorerTest.insight(QualityScorerTest.words(150), QualityScorerTest.words(30), 1.0,
                3, QualityScorerTest.dimensions(10, 10, 10, 5));
        insight.setId("ins-9");

        ContentReviewEntry entry = service.submitInsight(insight);

        assertEquals(new BigDecimal("0.96"), entry.getQualityScore());
        assertEquals(ReviewStatus.APPROVED, entry.getStatus());
        assertEquals(ContentType.INSIGHT, entry.getContentType());
        assertTrue(service.findEntry(ContentType.INSIGHT, "ins-9").isPresent());
    }
}
