package me.golemcore.pipeline.domain.model;

/**
 * Classification of a similar pair, most specific first.
 */
public enum SimilarityType {
    EXACT, NEAR, THEMATIC
}
