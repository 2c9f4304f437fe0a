package me.golemcore.pipeline.domain.model;

/**
 * Known enhanced-scoring dimensions. Each score is an integer in [1, 10];
 * insights may carry additional dimensions under other keys.
 */
public enum ScoreDimension {

    OPPORTUNITY("opportunity"),
    PROBLEM("problem"),
    FEASIBILITY("feasibility"),
    WHY_NOW("why_now"),
    EXECUTION_DIFFICULTY("execution_difficulty"),
    GO_TO_MARKET("go_to_market"),
    FOUNDER_FIT("founder_fit");

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 10;

    private final String key;

    ScoreDimension(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
