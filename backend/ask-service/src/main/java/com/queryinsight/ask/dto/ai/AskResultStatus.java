package com.queryinsight.ask.dto.ai;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of a SQL generation job as reported by the AI service.
 */
public enum AskResultStatus {
    UNDERSTANDING,
    SEARCHING,
    PLANNING,
    GENERATING,
    CORRECTING,
    FINISHED,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED || this == STOPPED;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Wire values are lower case; unknown values are rejected
     */
    @JsonCreator
    public static AskResultStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return AskResultStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
