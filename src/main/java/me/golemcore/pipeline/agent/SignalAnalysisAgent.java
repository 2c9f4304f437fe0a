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

import me.golemcore.pipeline.domain.exception.AnalysisException;
import me.golemcore.pipeline.domain.model.AgentRunResult;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.RawSignal;
import me.golemcore.pipeline.domain.service.QualityGateService;
import me.golemcore.pipeline.domain.service.SignalAnalysisService;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.InsightRepository;
import me.golemcore.pipeline.port.outbound.RawSignalRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Turns unprocessed signals into insights, oldest first.
 *
 * <p>
 * A signal is marked processed only after its insight is stored, so a crash
 * in between leaves it for the next run. Each stored insight is scored and
 * submitted to the quality gate. The batch stops early once the agent runs
 * over its call or cost ceiling.
 */
@Component
@Slf4j
public class SignalAnalysisAgent implements PipelineAgent {

    public static final String NAME = "signal_analyzer";

    private final RawSignalRepository rawSignalRepository;
    private final InsightRepository insightRepository;
    private final SignalAnalysisService analysisService;
    private final QualityGateService qualityGateService;
    private final int batchSize;

    public SignalAnalysisAgent(RawSignalRepository rawSignalRepository, InsightRepository insightRepository,
            SignalAnalysisService analysisService, QualityGateService qualityGateService,
            PipelineProperties properties) {
        this.rawSignalRepository = rawSignalRepository;
        this.insightRepository = insightRepository;
        this.analysisService = analysisService;
        this.qualityGateService = qualityGateService;
        this.batchSize = properties.getAnalysis().getBatchSize();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AgentRunResult run(AgentRunContext context) {
        List<RawSignal> batch = rawSignalRepository.findUnprocessed(batchSize);
        AgentRunResult result = AgentRunResult.empty();
        if (batch.isEmpty()) {
            log.debug("[Analyzer] No unprocessed signals");
            return result;
        }

        for (RawSignal signal : batch) {
            Optional<String> exceeded = context.budgetExceeded();
            if (exceeded.isPresent()) {
                log.warn("[Analyzer] Stopping batch: {}", exceeded.get());
                result.getMetadata().put(MetadataKeys.BUDGET_EXHAUSTED, exceeded.get());
                break;
            }
            try {
                Insight insight = analysisService.analyze(signal, context.getConfiguration());
                Insight saved = insightRepository.save(insight);
                rawSignalRepository.markProcessed(List.of(signal.getId()));
                qualityGateService.submitInsight(saved);
                result.setItemsProcessed(result.getItemsProcessed() + 1);
            } catch (AnalysisException e) {
                log.warn("[Analyzer] Signal {} not analyzed: {}", signal.getId(), e.getMessage());
                result.setItemsFailed(result.getItemsFailed() + 1);
            }
        }
        log.info("[Analyzer] Batch of {}: {} analyzed, {} failed", batch.size(), result.getItemsProcessed(),
                result.getItemsFailed());
        return result;
    }
}
