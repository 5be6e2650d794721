package com.queryinsight.ask.controller;

import com.queryinsight.ask.dto.AskRequest;
import com.queryinsight.ask.dto.GenerateSqlResponse;
import com.queryinsight.ask.exception.ApiException;
import com.queryinsight.ask.service.ask.AskOrchestrationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

/**
 * AskController 단위 테스트
 */
@WebFluxTest(AskController.class)
@ActiveProfiles("test")
class AskControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private AskOrchestrationService askOrchestrationService;

    @Test
    @DisplayName("POST /api/v1/generate_sql - SQL 반환")
    void generateSql() {
        given(askOrchestrationService.generateSql(eq(HttpMethod.POST), any(AskRequest.class), anyMap()))
                .willReturn(Mono.just(new GenerateSqlResponse("SELECT 1", "thread-1")));

        webTestClient.post()
                .uri("/api/v1/generate_sql")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("question", "How many orders?", "threadId", "thread-1"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sql").isEqualTo("SELECT 1")
                .jsonPath("$.threadId").isEqualTo("thread-1");

        ArgumentCaptor<AskRequest> captor = ArgumentCaptor.forClass(AskRequest.class);
        verify(askOrchestrationService).generateSql(eq(HttpMethod.POST), captor.capture(), anyMap());
        assertThat(captor.getValue().getQuestion()).isEqualTo("How many orders?");
    }

    @Test
    @DisplayName("POST /api/v1/generate_sql - 일반 질의 에러 본문")
    void generateSqlNonSqlQuery() {
        given(askOrchestrationService.generateSql(eq(HttpMethod.POST), any(AskRequest.class), anyMap()))
                .willReturn(Mono.error(ApiException.generalQuery("This is a general question", "q-9")));

        webTestClient.post()
                .uri("/api/v1/generate_sql")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("question", "Hello"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("This is a general question")
                .jsonPath("$.code").isEqualTo("NON_SQL_QUERY")
                .jsonPath("$.explanationQueryId").isEqualTo("q-9");
    }

    @Test
    @DisplayName("POST /api/v1/generate_sql - 예상치 못한 오류는 내부 메시지 비노출")
    void generateSqlInternalError() {
        given(askOrchestrationService.generateSql(eq(HttpMethod.POST), any(AskRequest.class), anyMap()))
                .willReturn(Mono.error(ApiException.internal(new IllegalStateException("password authentication failed"))));

        webTestClient.post()
                .uri("/api/v1/generate_sql")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("question", "How many orders?"))
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Internal server error")
                .jsonPath("$.code").isEqualTo("INTERNAL_SERVER_ERROR");
    }

    @Test
    @DisplayName("GET /api/v1/generate_sql - 메서드 검증은 서비스에 위임")
    void generateSqlDelegatesMethodCheck() {
        given(askOrchestrationService.generateSql(eq(HttpMethod.GET), isNull(), anyMap()))
                .willReturn(Mono.error(ApiException.methodNotAllowed("GET")));

        webTestClient.get()
                .uri("/api/v1/generate_sql")
                .exchange()
                .expectStatus().isEqualTo(405)
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION");
    }

    @Test
    @DisplayName("POST /api/v1/stream/ask - SSE 헤더와 이벤트")
    void streamAsk() {
        given(askOrchestrationService.streamAsk(eq(HttpMethod.POST), any(AskRequest.class), anyMap()))
                .willReturn(Flux.just(
                        ServerSentEvent.builder("{\"type\":\"message_start\",\"timestamp\":1}").build(),
                        ServerSentEvent.builder("{\"type\":\"message_stop\",\"data\":{\"threadId\":\"t\",\"duration\":3},\"timestamp\":2}").build()));

        webTestClient.post()
                .uri("/api/v1/stream/ask")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("question", "How many orders?", "sampleSize", 50))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectHeader().valueEquals("Cache-Control", "no-cache, no-transform")
                .expectHeader().valueEquals("X-Accel-Buffering", "no")
                .expectBody(String.class)
                .value(body -> {
                    assertThat(body).contains("message_start");
                    assertThat(body.indexOf("message_start")).isLessThan(body.indexOf("message_stop"));
                });
    }

    @Test
    @DisplayName("GET /api/v1/stream_explanation - queryId 전달")
    void streamExplanation() {
        given(askOrchestrationService.streamExplanation(eq("q-9"), isNull(), anyMap()))
                .willReturn(Flux.just(ServerSentEvent.builder("{\"type\":\"message_start\",\"timestamp\":1}").build()));

        webTestClient.get()
                .uri("/api/v1/stream_explanation?queryId=q-9")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectBody(String.class)
                .value(body -> assertThat(body).contains("message_start"));
    }
}
