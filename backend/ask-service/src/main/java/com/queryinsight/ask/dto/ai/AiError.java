package com.queryinsight.ask.dto.ai;

/**
 * Error reported inside a job result.
 */
public record AiError(String code, String message) {
}
