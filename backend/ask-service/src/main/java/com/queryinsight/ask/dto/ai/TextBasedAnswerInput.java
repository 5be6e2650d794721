package com.queryinsight.ask.dto.ai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.queryinsight.ask.dto.engine.PreviewData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body of POST /v1/sql-answers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TextBasedAnswerInput {

    private String query;

    private String sql;

    @JsonProperty("sql_data")
    private PreviewData sqlData;

    @JsonProperty("thread_id")
    private String threadId;

    private AiConfigurations configurations;
}
