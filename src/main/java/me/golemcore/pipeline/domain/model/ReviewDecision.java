package me.golemcore.pipeline.domain.model;

/**
 * Decision a human reviewer applies to a review-queue entry.
 */
public enum ReviewDecision {

    APPROVE, REJECT, FLAG;

    public ReviewStatus targetStatus() {
        return switch (this) {
        case APPROVE -> ReviewStatus.APPROVED;
        case REJECT -> ReviewStatus.REJECTED;
        case FLAG -> ReviewStatus.FLAGGED;
        };
    }
}
