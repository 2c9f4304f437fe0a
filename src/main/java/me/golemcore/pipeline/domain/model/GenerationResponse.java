package me.golemcore.pipeline.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GenerationResponse {

    InsightDraft draft;
    String model;
    int inputTokens;
    int outputTokens;
}
