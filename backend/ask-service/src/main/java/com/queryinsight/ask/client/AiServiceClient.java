package com.queryinsight.ask.client;

import com.queryinsight.ask.config.AskProperties;
import com.queryinsight.ask.dto.ai.AskJobInput;
import com.queryinsight.ask.dto.ai.AskResult;
import com.queryinsight.ask.dto.ai.AsyncQueryResponse;
import com.queryinsight.ask.dto.ai.TextBasedAnswerInput;
import com.queryinsight.ask.dto.ai.TextBasedAnswerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Client of the AI inference service.
 *
 * Work is submitted as jobs identified by a query id; results are fetched by polling, and
 * text output is read from a separate byte stream whose frames look like
 * {@code data: {"message":"..."}}. Streams are returned as raw byte chunks so that
 * {@link com.queryinsight.ask.service.stream.ChunkProtocolParser} sees the provider format untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AiServiceClient {

    private final WebClient webClient;
    private final AskProperties properties;

    /**
     * Submit a SQL generation job
     */
    public Mono<AsyncQueryResponse> ask(AskJobInput input) {
        return webClient.post()
                .uri(baseUrl() + "/v1/asks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(input)
                .retrieve()
                .bodyToMono(AsyncQueryResponse.class)
                .doOnNext(response -> log.debug("SQL generation job submitted: queryId={}", response.queryId()))
                .doOnError(e -> log.warn("Failed to submit SQL generation job: {}", e.getMessage()));
    }

    public Mono<AskResult> getAskResult(String queryId) {
        return webClient.get()
                .uri(baseUrl() + "/v1/asks/{queryId}/result", queryId)
                .retrieve()
                .bodyToMono(AskResult.class);
    }

    /**
     * Free-form explanation of a job classified as a general question
     */
    public Flux<byte[]> getAskStreamingResult(String queryId) {
        return webClient.get()
                .uri(baseUrl() + "/v1/asks/{queryId}/streaming-result", queryId)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .bodyToFlux(byte[].class);
    }

    /**
     * Ask the service to stop a running SQL generation job
     */
    public Mono<Void> stopAsk(String queryId) {
        return webClient.patch()
                .uri(baseUrl() + "/v1/asks/{queryId}", queryId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "stopped"))
                .retrieve()
                .toBodilessEntity()
                .doOnSuccess(r -> log.info("Requested stop of SQL generation job: queryId={}", queryId))
                .then();
    }

    /**
     * Submit a summarization job over the sampled rows
     */
    public Mono<AsyncQueryResponse> createTextBasedAnswer(TextBasedAnswerInput input) {
        return webClient.post()
                .uri(baseUrl() + "/v1/sql-answers")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(input)
                .retrieve()
                .bodyToMono(AsyncQueryResponse.class)
                .doOnNext(response -> log.debug("Summary job submitted: queryId={}", response.queryId()))
                .doOnError(e -> log.warn("Failed to submit summary job: {}", e.getMessage()));
    }

    public Mono<TextBasedAnswerResult> getTextBasedAnswerResult(String queryId) {
        return webClient.get()
                .uri(baseUrl() + "/v1/sql-answers/{queryId}", queryId)
                .retrieve()
                .bodyToMono(TextBasedAnswerResult.class);
    }

    public Flux<byte[]> streamTextBasedAnswer(String queryId) {
        return webClient.get()
                .uri(baseUrl() + "/v1/sql-answers/{queryId}/streaming", queryId)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .bodyToFlux(byte[].class);
    }

    private String baseUrl() {
        String baseUrl = properties.getAiService().getBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
