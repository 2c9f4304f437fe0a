package me.golemcore.pipeline.domain.model;

public enum WebhookEventStatus {
    PROCESSING, PROCESSED, FAILED
}
