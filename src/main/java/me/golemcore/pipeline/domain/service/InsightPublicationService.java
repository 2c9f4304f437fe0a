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

import me.golemcore.pipeline.domain.model.ContentReviewEntry;
import me.golemcore.pipeline.domain.model.ContentType;
import me.golemcore.pipeline.domain.model.Insight;
import me.golemcore.pipeline.domain.model.ReviewStatus;
import me.golemcore.pipeline.port.outbound.InsightRepository;
import me.golemcore.pipeline.port.outbound.ReviewQueueRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An insight is published once its review entry is approved.
 */
@Service
@RequiredArgsConstructor
public class InsightPublicationService {

    private final InsightRepository insightRepository;
    private final ReviewQueueRepository reviewQueueRepository;

    public boolean isPublished(String insightId) {
        return reviewQueueRepository.findByContent(ContentType.INSIGHT, insightId)
                .map(entry -> entry.getStatus() == ReviewStatus.APPROVED)
                .orElse(false);
    }

    public List<Insight> listPublished() {
        Set<String> approved = reviewQueueRepository.findAll().stream()
                .filter(entry -> entry.getContentType() == ContentType.INSIGHT)
                .filter(entry -> entry.getStatus() == ReviewStatus.APPROVED)
                .map(ContentReviewEntry::getContentId)
                .collect(Collectors.toSet());
        return insightRepository.findAll().stream()
                .filter(insight -> approved.contains(insight.getId()))
                .toList();
    }
}
