package me.golemcore.pipeline.domain.model;

/**
 * Kind of AI-generated artifact held by the review queue.
 */
public enum ContentType {
    INSIGHT, RESEARCH, BRAND_PACKAGE
}
