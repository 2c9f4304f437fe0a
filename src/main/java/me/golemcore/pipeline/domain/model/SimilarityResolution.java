package me.golemcore.pipeline.domain.model;

public enum SimilarityResolution {
    KEEP_BOTH, MERGE, DELETE_NEWER
}
