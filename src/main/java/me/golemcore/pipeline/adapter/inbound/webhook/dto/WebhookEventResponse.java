package me.golemcore.pipeline.adapter.inbound.webhook.dto;

import me.golemcore.pipeline.domain.model.WebhookProcessingResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Map;

/**
 * Response body of {@code POST /api/webhooks/events}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookEventResponse {

    private String eventId;

    /** {@code processed}, {@code failed}, {@code processing} or {@code error}. */
    private String status;

    private boolean duplicate;
    private Map<String, Object> result;
    private String error;

    public static WebhookEventResponse from(WebhookProcessingResult processing) {
        return WebhookEventResponse.builder()
                .eventId(processing.getEventId())
                .status(processing.getStatus().name().toLowerCase(Locale.ROOT))
                .duplicate(processing.isDuplicate())
                .result(processing.getResult())
                .error(processing.getErrorMessage())
                .build();
    }

    public static WebhookEventResponse error(String message) {
        return WebhookEventResponse.builder()
                .status("error")
                .error(message)
                .build();
    }

    public static WebhookEventResponse error(String eventId, String message) {
        return WebhookEventResponse.builder()
                .eventId(eventId)
                .status("error")
                .error(message)
                .build();
    }
}
