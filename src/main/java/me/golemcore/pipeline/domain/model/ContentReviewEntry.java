package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Single review-queue row per (content type, content id). The quality score
 * has two decimals and stays null until scored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentReviewEntry {

    private String id;
    private ContentType contentType;
    private String contentId;
    private BigDecimal qualityScore;

    @Builder.Default
    private ReviewStatus status = ReviewStatus.PENDING;

    private boolean autoApproved;
    private String reviewerId;
    private String reviewNotes;
    private String rejectionReason;
    private Instant createdAt;
    private Instant reviewedAt;
    private Instant updatedAt;

    public boolean matches(ContentType type, String id) {
        return contentType == type && contentId != null && contentId.equals(id);
    }
}
