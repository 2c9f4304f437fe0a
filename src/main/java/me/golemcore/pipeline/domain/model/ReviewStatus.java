package me.golemcore.pipeline.domain.model;

/**
 * Review-queue state. {@code APPROVED} and {@code REJECTED} are terminal;
 * {@code FLAGGED} waits for a human like {@code PENDING} does.
 */
public enum ReviewStatus {

    PENDING, APPROVED, REJECTED, FLAGGED;

    public boolean isTerminal() {
        return switch (this) {
        case APPROVED, REJECTED -> true;
        case PENDING, FLAGGED -> false;
        };
    }
}
