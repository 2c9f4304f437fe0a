package me.golemcore.pipeline.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pipeline.adapter.outbound.storage.JsonInsightRepository;
import me.golemcore.pipeline.adapter.outbound.storage.JsonRawSignalRepository;
import me.golemcore.pipeline.adapter.outbound.storage.JsonReviewQueueRepository;
import me.golemcore.pipeline.adapter.outbound.storage.JsonSimilarityRepository;
import me.golemcore.pipeline.domain.exception.SimilarityResolutionException;
import me.golemcore.pipeline.domain.model.Competitor;
import me.golemcore.pipeline.domain.model.ContentReviewEntry;
import me.golemcore.pipeline.domain.model.ContentSimilarity;
import me.golemcore.pipeline.domain.model.ContentType;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.SimilarityResolution;
import me.golemcore.pipeline.domain.model.SimilarityRunResult;
import me.golemcore.pipeline.domain.model.SimilarityStats;
import me.golemcore.pipeline.domain.model.SimilarityType;
import me.golemcore.pipeline.infrastructure.config.PipelineConfiguration;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.testsupport.InMemoryStoragePort;
import me.golemcore.pipeline.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityDetectionServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final Map<String, BigDecimal> scores = new HashMap<>();

    private MutableClock clock;
    private JsonInsightRepository insightRepository;
    private JsonReviewQueueRepository reviewQueueRepository;
    private JsonSimilarityRepository similarityRepository;
    private SimilarityDetectionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FIXED_NOW);
        InMemoryStoragePort storage = new InMemoryStoragePort();
        ObjectMapper objectMapper = PipelineConfiguration.objectMapper();
        insightRepository = new JsonInsightRepository(storage, objectMapper);
        reviewQueueRepository = new JsonReviewQueueRepository(storage, objectMapper);
        similarityRepository = new JsonSimilarityRepository(storage, objectMapper);
        ContentPurgeService purgeService = new ContentPurgeService(
                new JsonRawSignalRepository(storage, objectMapper), insightRepository, reviewQueueRepository,
                similarityRepository, clock);
        TextSimilarityScorer tableScorer = documents -> (first, second) -> scores.getOrDefault(
                ContentSimilarity.pairKey(first, second), BigDecimal.ZERO);
        service = new SimilarityDetectionService(similarityRepository, insightRepository, tableScorer,
                new DefaultInsightMergeStrategy(), purgeService, new PipelineProperties(), clock);
    }

    @Test
    void shouldClassifyByMostSpecificThreshold() {
        assertEquals(Optional.of(SimilarityType.EXACT), service.classify(new BigDecimal("0.950")));
        assertEquals(Optional.of(SimilarityType.NEAR), service.classify(new BigDecimal("0.949")));
        assertEquals(Optional.of(SimilarityType.NEAR), service.classify(new BigDecimal("0.850")));
        assertEquals(Optional.of(SimilarityType.THEMATIC), service.classify(new BigDecimal("0.700")));
        assertEquals(Optional.empty(), service.classify(new BigDecimal("0.699")));
    }

    @Test
    void shouldScoreEachUnorderedPairOnce() {
        Insight first = save("i1", FIXED_NOW);
        Insight second = save("i2", FIXED_NOW);
        Insight third = save("i3", FIXED_NOW);
        score("i1", "i2", "0.970");
        score("i1", "i3", "0.600");
        score("i2", "i3", "0.720");

        SimilarityRunResult result = service.detect(List.of(first, second), List.of(first, second, third));

        assertEquals(2, result.getCandidates());
        assertEquals(3, result.getComparisons());
        assertEquals(2, result.getRecorded().size());
        assertEquals(0, result.getAlreadyKnown());
        assertEquals(SimilarityType.EXACT, service.list(null, SimilarityType.EXACT).get(0).getSimilarityType());
        assertEquals(1, service.list(null, SimilarityType.THEMATIC).size());
    }

    @Test
    void shouldNotRecordKnownPairTwice() {
        Insight first = save("i1", FIXED_NOW);
        Insight second = save("i2", FIXED_NOW);
        score("i1", "i2", "0.900");
        service.detect(List.of(first), List.of(second));

        SimilarityRunResult again = service.detect(List.of(second), List.of(first));

        assertTrue(again.getRecorded().isEmpty());
        assertEquals(1, again.getAlreadyKnown());
        assertEquals(1, similarityRepository.findAll().size());
    }

    @Test
    void shouldReturnEmptyResultWithoutCandidates() {
        save("i1", FIXED_NOW);

        SimilarityRunResult result = service.detect(List.of(), insightRepository.findAll());

        assertEquals(0, result.getComparisons());
        assertTrue(similarityRepository.findAll().isEmpty());
    }

    @Test
    void detectRecentShouldOnlyUseInsightsFromCandidateWindow() {
        save("old", FIXED_NOW.minus(Duration.ofHours(48)));
        save("new", FIXED_NOW.minus(Duration.ofHours(1)));
        score("new", "old", "0.880");

        SimilarityRunResult result = service.detectRecent();

        assertEquals(1, result.getCandidates());
        assertEquals(1, result.getComparisons());
        ContentSimilarity pair = result.getRecorded().get(0);
        assertEquals("new", pair.getSourceInsightId());
        assertEquals("old", pair.getSimilarInsightId());
        assertEquals(SimilarityType.NEAR, pair.getSimilarityType());
    }

    @Test
    void keepBothShouldOnlyResolvePair() {
        ContentSimilarity pair = recordPair();

        ContentSimilarity resolved = service.resolve(pair.getId(), SimilarityResolution.KEEP_BOTH, "alice");

        assertTrue(resolved.isResolved());
        assertEquals(SimilarityResolution.KEEP_BOTH, resolved.getResolution());
        assertEquals("alice", resolved.getResolvedBy());
        assertEquals(FIXED_NOW, resolved.getResolvedAt());
        assertEquals(2, insightRepository.findAll().size());
    }

    @Test
    void mergeShouldFoldNewerInsightIntoOlder() {
        ContentSimilarity pair = recordPair();

        service.resolve(pair.getId(), SimilarityResolution.MERGE, "alice");

        assertTrue(insightRepository.findById("newer").isEmpty());
        Insight survivor = insightRepository.findById("older").orElseThrow();
        assertEquals(List.of("Chaser", "Dunning"),
                survivor.getCompetitors().stream().map(Competitor::getName).toList());
        assertEquals(FIXED_NOW, survivor.getUpdatedAt());
        assertTrue(reviewQueueRepository.findByContent(ContentType.INSIGHT, "newer").isEmpty());
        assertTrue(similarityRepository.findById(pair.getId()).orElseThrow().isResolved());
    }

    @Test
    void deleteNewerShouldKeepOlderUntouched() {
        ContentSimilarity pair = recordPair();

        service.resolve(pair.getId(), SimilarityResolution.DELETE_NEWER, "alice");

        assertTrue(insightRepository.findById("newer").isEmpty());
        Insight older = insightRepository.findById("older").orElseThrow();
        assertEquals(1, older.getCompetitors().size());
        assertNull(older.getUpdatedAt());
    }

    @Test
    void shouldRejectSecondResolution() {
        ContentSimilarity pair = recordPair();
        service.resolve(pair.getId(), SimilarityResolution.KEEP_BOTH, "alice");

        assertThrows(SimilarityResolutionException.class,
                () -> service.resolve(pair.getId(), SimilarityResolution.KEEP_BOTH, "bob"));
    }

    @Test
    void shouldRejectResolutionWhenInsightIsGone() {
        ContentSimilarity pair = recordPair();
        insightRepository.deleteById("older");

        assertThrows(SimilarityResolutionException.class,
                () -> service.resolve(pair.getId(), SimilarityResolution.MERGE, "alice"));
        assertFalse(similarityRepository.findById(pair.getId()).orElseThrow().isResolved());
    }

    @Test
    void shouldRejectUnknownPair() {
        assertThrows(IllegalArgumentException.class,
                () -> service.resolve("missing", SimilarityResolution.KEEP_BOTH, "alice"));
    }

    @Test
    void listShouldOrderByScoreAndFilterByResolution() {
        Insight first = save("i1", FIXED_NOW);
        Insight second = save("i2", FIXED_NOW);
        Insight third = save("i3", FIXED_NOW);
        score("i1", "i2", "0.750");
        score("i1", "i3", "0.990");
        service.detect(List.of(first), List.of(second, third));
        ContentSimilarity top = service.list(null, null).get(0);
        service.resolve(top.getId(), SimilarityResolution.KEEP_BOTH, "alice");

        List<ContentSimilarity> all = service.list(null, null);
        List<ContentSimilarity> open = service.list(false, null);

        assertEquals(0, new BigDecimal("0.990").compareTo(all.get(0).getSimilarityScore()));
        assertEquals(0, new BigDecimal("0.750").compareTo(all.get(1).getSimilarityScore()));
        assertEquals(1, open.size());
        assertEquals("i2", open.get(0).getSimilarInsightId());
        assertEquals(1, service.list(true, null).size());
    }

    @Test
    void statsShouldCountTypesAndAverageScore() {
        Insight first = save("i1", FIXED_NOW);
        Insight second = save("i2", FIXED_NOW);
        Insight third = save("i3", FIXED_NOW);
        score("i1", "i2", "0.960");
        score("i1", "i3", "0.800");
        service.detect(List.of(first), List.of(second, third));

        SimilarityStats stats = service.getStats();

        assertEquals(2, stats.getTotal());
        assertEquals(2, stats.getUnresolved());
        assertEquals(new BigDecimal("0.880"), stats.getAverageScore());
        assertEquals(1L, stats.getCountsByType().get(SimilarityType.EXACT));
        assertEquals(0L, stats.getCountsByType().get(SimilarityType.NEAR));
        assertEquals(1L, stats.getCountsByType().get(SimilarityType.THEMATIC));
    }

    @Test
    void statsShouldHaveNoAverageWithoutPairs() {
        SimilarityStats stats = service.getStats();

        assertEquals(0, stats.getTotal());
        assertNull(stats.getAverageScore());
    }

    private ContentSimilarity recordPair() {
        Insight older = Insight.builder()
                .id("older")
                .problemStatement("Invoices are chased by hand")
                .competitors(List.of(competitor("Chaser")))
                .createdAt(FIXED_NOW.minus(Duration.ofHours(5)))
                .build();
        Insight newer = Insight.builder()
                .id("newer")
                .problemStatement("Invoices are chased manually")
                .competitors(List.of(competitor("chaser "), competitor("Dunning")))
                .createdAt(FIXED_NOW.minus(Duration.ofHours(1)))
                .build();
        insightRepository.save(older);
        insightRepository.save(newer);
        reviewQueueRepository.compute(ContentType.INSIGHT, "newer",
                current -> ContentReviewEntry.builder().createdAt(FIXED_NOW).build());
        score("older", "newer", "0.910");
        return service.detect(List.of(newer), List.of(older)).getRecorded().get(0);
    }

    private Insight save(String id, Instant createdAt) {
        return insightRepository.save(Insight.builder()
                .id(id)
                .problemStatement("Problem " + id)
                .createdAt(createdAt)
                .build());
    }

    private void score(String first, String second, String value) {
        scores.put(ContentSimilarity.pairKey(first, second), new BigDecimal(value));
    }

    private static Competitor competitor(String name) {
        return Competitor.builder().name(name).build();
    }
}
