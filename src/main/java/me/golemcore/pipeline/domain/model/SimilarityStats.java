package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityStats {

    private long total;
    private long unresolved;
    private BigDecimal averageScore;

    @Builder.Default
    private Map<SimilarityType, Long> countsByType = new EnumMap<>(SimilarityType.class);
}
