package com.queryinsight.ask.dto.ai;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of a summarization job. Only SUCCEEDED and FAILED are terminal.
 */
public enum TextBasedAnswerStatus {
    PREPROCESSING,
    FETCHING,
    STREAMING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TextBasedAnswerStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return TextBasedAnswerStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
