package me.golemcore.pipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unvalidated structured output of the generation service. Accepts both
 * camelCase and snake_case field names.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsightDraft {

    private String title;

    @JsonAlias("problem_statement")
    private String problemStatement;

    @JsonAlias("proposed_solution")
    private String proposedSolution;

    @JsonAlias("market_size")
    private MarketSize marketSize;

    @JsonAlias({ "relevance", "relevance_score" })
    private Double relevanceScore;

    @Builder.Default
    private List<Competitor> competitors = new ArrayList<>();

    @Builder.Default
    @JsonAlias({ "dimensions", "dimension_scores", "scores" })
    private Map<String, Integer> dimensionScores = new LinkedHashMap<>();
}
