package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookProcessingResult {

    private String eventId;
    private WebhookEventStatus status;
    private boolean duplicate;
    private Map<String, Object> result;
    private String errorMessage;
}
