package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured analysis derived from exactly one {@link RawSignal}. Deleted
 * together with its source signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Insight {

    public static final int MAX_COMPETITORS = 3;

    private String id;
    private String rawSignalId;
    private String title;
    private String problemStatement;
    private String proposedSolution;
    private MarketSize marketSize;
    private double relevanceScore;

    @Builder.Default
    private List<Competitor> competitors = new ArrayList<>();

    @Builder.Default
    private Map<String, Integer> dimensionScores = new LinkedHashMap<>();

    private String model;
    private Instant createdAt;
    private Instant updatedAt;
}
