package com.queryinsight.ask.client;

import com.queryinsight.ask.config.AskProperties;
import com.queryinsight.ask.dto.engine.PreviewData;
import com.queryinsight.ask.dto.engine.PreviewRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Client of the query engine that executes SQL against a deployed manifest.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryEngineClient {

    private final WebClient webClient;
    private final AskProperties properties;

    /**
     * Execute the SQL and return at most {@code limit} rows
     */
    public Mono<PreviewData> preview(String sql, Map<String, Object> manifest, int limit) {
        return webClient.post()
                .uri(baseUrl() + "/v1/mdl/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new PreviewRequest(sql, manifest, limit))
                .retrieve()
                .bodyToMono(PreviewData.class)
                .onErrorMap(WebClientResponseException.class, e -> new QueryEngineException(
                        e.getResponseBodyAsString().isBlank() ? e.getMessage() : e.getResponseBodyAsString(), e))
                .doOnNext(data -> log.debug("Preview returned {} rows", data.rowCount()));
    }

    /**
     * Translate the SQL to the data source's native dialect
     */
    public Mono<String> getNativeSql(String sql, Map<String, Object> manifest) {
        return webClient.post()
                .uri(baseUrl() + "/v1/mdl/dry-plan")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new PreviewRequest(sql, manifest, null))
                .retrieve()
                .bodyToMono(String.class);
    }

    private String baseUrl() {
        String baseUrl = properties.getEngine().getBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Engine rejected the statement; the message is the engine's own error text
     */
    public static class QueryEngineException extends RuntimeException {
        public QueryEngineException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
