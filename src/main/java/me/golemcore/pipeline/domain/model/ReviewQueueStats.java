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
public class ReviewQueueStats {

    private long total;

    @Builder.Default
    private Map<ReviewStatus, Long> countsByStatus = new EnumMap<>(ReviewStatus.class);

    private long autoApproved;
    private double autoApprovedRate;
    private BigDecimal averageScore;
}
