package me.golemcore.pipeline;

import me.golemcore.pipeline.adapter.outbound.storage.JsonInsightRepository;
import me.golemcore.pipeline.adapter.outbound.storage.JsonRawSignalRepository;
import me.golemcore.pipeline.adapter.outbound.storage.JsonReviewQueueRepository;
import me.golemcore.pipeline.domain.exception.DuplicateContentException;
import me.golemcore.pipeline.domain.exception.TransientIOException;
import me.golemcore.pipeline.domain.model.ContentReviewEntry;
import me.golemcore.pipeline.domain.model.ContentType;
import me.golemcore.pipeline.domain.model.GenerationResponse;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.InsightDraft;
import me.golemcore.pipeline.domain.model.LlmCallRecord;
import me.golemcore.pipeline.domain.model.MarketSize;
import me.golemcore.pipeline.domain.model.RawSignal;
import me.golemcore.pipeline.domain.model.ReviewStatus;
import me.golemcore.pipeline.domain.model.ScrapedItem;
import me.golemcore.pipeline.domain.service.ContentHasher;
import me.golemcore.pipeline.domain.service.InsightPublicationService;
import me.golemcore.pipeline.domain.service.InsightValidator;
import me.golemcore.pipeline.domain.service.QualityGateService;
import me.golemcore.pipeline.domain.service.QualityScorer;
import me.golemcore.pipeline.domain.service.SignalAnalysisService;
import me.golemcore.pipeline.domain.service.SignalIngestionService;
import me.golemcore.pipeline.infrastructure.config.PipelineConfiguration;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.GenerationPort;
import me.golemcore.pipeline.port.outbound.InsightRepository;
import me.golemcore.pipeline.port.outbound.RawSignalRepository;
import me.golemcore.pipeline.port.outbound.ReviewQueueRepository;
import me.golemcore.pipeline.port.outbound.UsageTrackingPort;
import me.golemcore.pipeline.testsupport.InMemoryStoragePort;
import me.golemcore.pipeline.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InsightPipelineScenarioTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String CONTENT = "Freelancers lose hours every week chasing unpaid invoices by email";

    private GenerationPort generationPort;
    private UsageTrackingPort usageTrackingPort;
    private RawSignalRepository rawSignalRepository;
    private InsightRepository insightRepository;
    private SignalIngestionService ingestionService;
    private SignalAnalysisService analysisService;
    private QualityGateService qualityGateService;
    private InsightPublicationService publicationService;

    @BeforeEach
    void setUp() {
        InMemoryStoragePort storage = new InMemoryStoragePort();
        MutableClock clock = new MutableClock(FIXED_NOW);
        PipelineProperties properties = new PipelineProperties();
        generationPort = mock(GenerationPort.class);
        usageTrackingPort = mock(UsageTrackingPort.class);
        when(generationPort.getProviderId()).thenReturn("openai");

        rawSignalRepository = new JsonRawSignalRepository(storage, PipelineConfiguration.objectMapper());
        insightRepository = new JsonInsightRepository(storage, PipelineConfiguration.objectMapper());
        ReviewQueueRepository reviewQueueRepository = new JsonReviewQueueRepository(storage,
                PipelineConfiguration.objectMapper());

        ingestionService = new SignalIngestionService(rawSignalRepository, clock);
        analysisService = new SignalAnalysisService(generationPort, usageTrackingPort, new InsightValidator(),
                properties, clock, clock);
        qualityGateService = new QualityGateService(reviewQueueRepository, new QualityScorer(), properties, clock);
        publicationService = new InsightPublicationService(insightRepository, reviewQueueRepository);
    }

    @AfterEach
    void tearDown() {
        analysisService.shutdown();
    }

    @Test
    void signalShouldFlowFromIngestionToPublication() {
        RawSignal signal = ingestionService.ingestOne("reddit", item("https://www.reddit.com/r/freelance/1"))
                .orElseThrow();
        String hash = ContentHasher.hashNormalized(CONTENT);
        assertEquals(hash, signal.getContentHash());

        when(generationPort.generate(any()))
                .thenThrow(new TransientIOException("connection reset"))
                .thenReturn(response(0.78));
        Insight insight = insightRepository.save(analysisService.analyze(signal));
        rawSignalRepository.markProcessed(List.of(signal.getId()));

        assertEquals(0.78, insight.getRelevanceScore(), 0.0001);
        ArgumentCaptor<LlmCallRecord> calls = ArgumentCaptor.forClass(LlmCallRecord.class);
        verify(usageTrackingPort, times(2)).recordCall(calls.capture());
        assertFalse(calls.getAllValues().get(0).isSuccess());
        assertTrue(calls.getAllValues().get(1).isSuccess());

        ContentReviewEntry entry = qualityGateService.submit(ContentType.INSIGHT, insight.getId(),
                new BigDecimal("0.91"));

        assertEquals(ReviewStatus.APPROVED, entry.getStatus());
        assertTrue(entry.isAutoApproved());
        assertTrue(publicationService.isPublished(insight.getId()));
        assertEquals(List.of(insight.getId()),
                publicationService.listPublished().stream().map(Insight::getId).toList());

        Optional<RawSignal> again = ingestionService.ingestOne("hackernews", item("https://hn.example/item/7"));

        assertTrue(again.isEmpty());
        DuplicateContentException thrown = assertThrows(DuplicateContentException.class,
                () -> rawSignalRepository.insert(RawSignal.builder()
                        .source("hackernews")
                        .url("https://hn.example/item/8")
                        .content(CONTENT)
                        .contentHash(hash)
                        .build()));
        assertEquals(signal.getId(), thrown.getExistingId());
        assertEquals(1, rawSignalRepository.count());
        assertTrue(rawSignalRepository.findUnprocessed(10).isEmpty());
        assertEquals(1, insightRepository.findAll().size());
        verify(generationPort, times(2)).generate(any());
    }

    private static ScrapedItem item(String url) {
        return ScrapedItem.builder()
                .url(url)
                .title("Chasing invoices")
                .content(CONTENT)
                .build();
    }

    private static GenerationResponse response(double relevance) {
        Map<String, Integer> dimensions = new LinkedHashMap<>();
        dimensions.put("opportunity", 8);
        dimensions.put("problem", 9);
        InsightDraft draft = InsightDraft.builder()
                .title("Invoice follow-up for freelancers")
                .problemStatement("Freelancers chase unpaid invoices manually")
                .proposedSolution("Automated, polite payment reminders")
                .marketSize(MarketSize.MEDIUM)
                .relevanceScore(relevance)
                .dimensionScores(dimensions)
                .build();
        return GenerationResponse.builder()
                .draft(draft)
                .model("gpt-4o-mini")
                .inputTokens(300)
                .outputTokens(150)
                .build();
    }
}
