package com.queryinsight.ask.entity.history;

/**
 * Public API surfaces that are audited in api_history.
 */
public enum ApiType {
    /** Synchronous question to SQL */
    GENERATE_SQL,

    /** Streaming question to SQL, execution and summary */
    STREAM_ASK,

    /** Streaming explanation of a general (non-SQL) question */
    STREAM_EXPLANATION
}
