package com.queryinsight.ask.dto.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Sampled result rows of a previewed SQL statement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PreviewData {

    private List<Column> columns;

    private List<List<Object>> data;

    public int rowCount() {
        return data != null ? data.size() : 0;
    }

    public record Column(String name, String type) {
    }
}
