package me.golemcore.pipeline.domain.service;

import me.golemcore.pipeline.domain.model.Insight;

/**
 * Folds a duplicate insight into the one that survives a {@code merge}
 * resolution. The caller persists the result and deletes the absorbed
 * insight.
 */
public interface InsightMergeStrategy {

    Insight merge(Insight survivor, Insight absorbed);
}
