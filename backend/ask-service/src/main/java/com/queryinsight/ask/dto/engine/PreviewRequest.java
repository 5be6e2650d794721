package com.queryinsight.ask.dto.engine;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Request body of the engine's preview and dry-plan endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PreviewRequest(String sql, Map<String, Object> manifest, Integer limit) {
}
