package com.queryinsight.ask.dto.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of a summarization job. The answer text itself only arrives via the stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TextBasedAnswerResult {

    private TextBasedAnswerStatus status;

    @JsonProperty("num_rows_used_in_llm")
    private Integer numRowsUsedInLlm;

    private AiError error;
}
