package com.queryinsight.ask.dto;

/**
 * Success body of POST /api/v1/generate_sql.
 */
public record GenerateSqlResponse(String sql, String threadId) {
}
