package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityRunResult {

    private int candidates;
    private int comparisons;

    @Builder.Default
    private List<ContentSimilarity> recorded = new ArrayList<>();

    private int alreadyKnown;
}
