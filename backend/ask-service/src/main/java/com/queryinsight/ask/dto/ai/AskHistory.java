package com.queryinsight.ask.dto.ai;

/**
 * One prior turn of a conversation thread, passed to SQL generation as context.
 */
public record AskHistory(String question, String sql) {
}
