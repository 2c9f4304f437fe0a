package me.golemcore.pipeline.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Input of a single structured generation call.
 */
@Value
@Builder
public class GenerationRequest {

    String signalId;
    String source;
    String title;
    String content;
    String model;
    Double temperature;
    Integer maxTokens;
    String systemPrompt;
}
