package me.golemcore.pipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One unordered pair of similar insights. The pair is stored in canonical
 * order: {@code sourceInsightId} sorts before {@code similarInsightId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentSimilarity {

    private String id;
    private String sourceInsightId;
    private String similarInsightId;
    private BigDecimal similarityScore;
    private SimilarityType similarityType;
    private boolean resolved;
    private SimilarityResolution resolution;
    private String resolvedBy;
    private Instant createdAt;
    private Instant resolvedAt;

    @JsonIgnore
    public String pairKey() {
        return pairKey(sourceInsightId, similarInsightId);
    }

    public boolean involves(String insightId) {
        return insightId.equals(sourceInsightId) || insightId.equals(similarInsightId);
    }

    public static String pairKey(String first, String second) {
        return first.compareTo(second) <= 0 ? first + "|" + second : second + "|" + first;
    }
}
