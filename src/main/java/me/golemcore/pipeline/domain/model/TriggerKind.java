package me.golemcore.pipeline.domain.model;

/**
 * What started an agent run.
 */
public enum TriggerKind {
    SCHEDULED, MANUAL, WEBHOOK
}
