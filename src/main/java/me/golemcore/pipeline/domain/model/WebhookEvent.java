package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row per external event id. The payload is stored redacted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent {

    private String eventId;
    private String eventType;

    @Builder.Default
    private WebhookEventStatus status = WebhookEventStatus.PROCESSING;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    private Map<String, Object> result;
    private String errorMessage;
    private int attempts;
    private Instant receivedAt;
    private Instant claimedAt;
    private Instant processedAt;
}
