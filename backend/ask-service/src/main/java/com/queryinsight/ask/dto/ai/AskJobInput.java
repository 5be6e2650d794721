package com.queryinsight.ask.dto.ai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body of POST /v1/asks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AskJobInput {

    private String query;

    /**
     * Deployment hash selecting the indexed manifest
     */
    @JsonProperty("mdl_hash")
    private String deployId;

    private List<AskHistory> histories;

    @JsonProperty("thread_id")
    private String threadId;

    private AiConfigurations configurations;
}
