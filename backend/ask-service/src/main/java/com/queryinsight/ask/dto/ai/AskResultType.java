package com.queryinsight.ask.dto.ai;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Intent classification of the question.
 */
public enum AskResultType {
    /** Answerable with SQL (reported as TEXT_TO_SQL on the wire) */
    NORMAL,

    /** General question; the AI service streams a free-form explanation instead */
    GENERAL,

    /** Unrelated to the data model */
    MISLEADING_QUERY;

    @JsonCreator
    public static AskResultType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("TEXT_TO_SQL".equals(normalized)) {
            return NORMAL;
        }
        return AskResultType.valueOf(normalized);
    }
}
