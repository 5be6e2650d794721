package com.queryinsight.ask.dto.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Snapshot of a SQL generation job, as returned by GET /v1/asks/{queryId}/result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AskResult {

    private AskResultStatus status;

    private AskResultType type;

    private List<AskResponse> response;

    private AiError error;

    @JsonProperty("rephrased_question")
    private String rephrasedQuestion;

    @JsonProperty("intent_reasoning")
    private String intentReasoning;

    @JsonProperty("sql_generation_reasoning")
    private String sqlGenerationReasoning;

    @JsonProperty("retrieved_tables")
    private List<String> retrievedTables;

    @JsonProperty("invalid_sql")
    private String invalidSql;

    @JsonProperty("trace_id")
    private String traceId;

    public boolean hasError() {
        return error != null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AskResponse {
        private String sql;
        private String type;
    }
}
