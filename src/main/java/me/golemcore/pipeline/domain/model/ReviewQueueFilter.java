package me.golemcore.pipeline.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Optional criteria for listing review-queue entries; null fields match
 * everything.
 */
@Value
@Builder
public class ReviewQueueFilter {

    ReviewStatus status;
    ContentType contentType;
    BigDecimal scoreBelow;
    Integer limit;

    public static ReviewQueueFilter all() {
        return ReviewQueueFilter.builder().build();
    }

    public boolean accepts(ContentReviewEntry entry) {
        if (status != null && entry.getStatus() != status) {
            return false;
        }
        if (contentType != null && entry.getContentType() != contentType) {
            return false;
        }
        if (scoreBelow != null) {
            return entry.getQualityScore() != null && entry.getQualityScore().compareTo(scoreBelow) < 0;
        }
        return true;
    }
}
