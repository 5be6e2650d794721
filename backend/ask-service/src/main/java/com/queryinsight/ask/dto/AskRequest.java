package com.queryinsight.ask.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /api/v1/generate_sql and POST /api/v1/stream/ask.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

    @NotBlank(message = "Question is required")
    private String question;

    /**
     * Conversation thread; a new one is started when absent
     */
    private String threadId;

    private String language;

    /**
     * Translate the generated SQL to the data source dialect (generate_sql only)
     */
    private Boolean returnSqlDialect;

    /**
     * Rows sampled for the summary (stream/ask only)
     */
    @Positive(message = "sampleSize must be positive")
    private Integer sampleSize;
}
