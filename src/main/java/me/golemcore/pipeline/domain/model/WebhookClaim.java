package me.golemcore.pipeline.domain.model;

/**
 * Outcome of claiming an event id: either this caller owns processing, or the
 * stored row of an earlier delivery is returned.
 */
public record WebhookClaim(boolean claimed, WebhookEvent event) {

    public static WebhookClaim claimed(WebhookEvent event) {
        return new WebhookClaim(true, event);
    }

    public static WebhookClaim existing(WebhookEvent event) {
        return new WebhookClaim(false, event);
    }
}
