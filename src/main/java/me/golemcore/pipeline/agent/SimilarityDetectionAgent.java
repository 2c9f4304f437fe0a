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
import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.SimilarityRunResult;
import me.golemcore.pipeline.domain.service.SimilarityDetectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SimilarityDetectionAgent implements PipelineAgent {

    public static final String NAME = "similarity_detector";

    private final SimilarityDetectionService similarityDetectionService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AgentRunResult run(AgentRunContext context) {
        SimilarityRunResult detection = similarityDetectionService.detectRecent();
        AgentRunResult result = AgentRunResult.builder()
                .itemsProcessed(detection.getCandidates())
                .build();
        result.getMetadata().put(MetadataKeys.CANDIDATES, detection.getCandidates());
        result.getMetadata().put(MetadataKeys.COMPARISONS, detection.getComparisons());
        result.getMetadata().put(MetadataKeys.PAIRS_RECORDED, detection.getRecorded().size());
        return result;
    }
}
