package com.queryinsight.ask.dto.ai;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acceptance response of a submitted job.
 */
public record AsyncQueryResponse(@JsonProperty("query_id") String queryId) {
}
