package me.golemcore.pipeline.domain.model;

/**
 * Known keys of the open metadata maps carried by signals, execution logs and
 * webhook results. Other keys are allowed.
 */
public final class MetadataKeys {

    // RawSignal.metadata
    public static final String TITLE = "title";
    public static final String AUTHOR = "author";
    public static final String SCORE = "score";
    public static final String COMMENTS = "comments";
    public static final String EXTERNAL_ID = "external_id";
    public static final String COMMUNITY = "community";

    // AgentExecutionLog.metadata
    public static final String REASON = "reason";
    public static final String TRIGGER = "trigger";
    public static final String BUDGET_EXHAUSTED = "budget_exhausted";
    public static final String DUPLICATES = "duplicates";
    public static final String SOURCES = "sources";
    public static final String FAILED_SOURCES = "failed_sources";
    public static final String PAIRS_RECORDED = "pairs_recorded";
    public static final String CANDIDATES = "candidates";
    public static final String COMPARISONS = "comparisons";
    public static final String CALLS_LAST_HOUR = "calls_last_hour";
    public static final String COST_LAST_DAY_USD = "cost_last_day_usd";

    // skip reasons
    public static final String REASON_AGENT_DISABLED = "agent_disabled";
    public static final String REASON_RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    public static final String REASON_COST_LIMIT_EXCEEDED = "cost_limit_exceeded";
    public static final String REASON_UNKNOWN_AGENT = "unknown_agent";
    public static final String REASON_ALREADY_RUNNING = "already_running";

    // webhook results
    public static final String STATUS = "status";
    public static final String STATUS_IGNORED = "ignored";

    private MetadataKeys() {
    }
}
