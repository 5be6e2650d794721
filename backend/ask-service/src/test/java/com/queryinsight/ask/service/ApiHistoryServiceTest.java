package com.queryinsight.ask.service;

import com.queryinsight.ask.dto.ai.AskHistory;
import com.queryinsight.ask.entity.history.ApiHistory;
import com.queryinsight.ask.entity.history.ApiType;
import com.queryinsight.ask.repository.ApiHistoryRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ApiHistoryService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class ApiHistoryServiceTest {

    @Mock
    private ApiHistoryRepository apiHistoryRepository;

    private SimpleMeterRegistry meterRegistry;
    private ApiHistoryService apiHistoryService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        apiHistoryService = new ApiHistoryService(apiHistoryRepository, meterRegistry);
    }

    @Test
    @DisplayName("저장 시 ID 부여 및 메트릭 기록")
    void createOneAssignsIdAndRecordsMetrics() {
        when(apiHistoryRepository.save(any(ApiHistory.class))).thenAnswer(invocation -> invocation.getArgument(0));
        ApiHistory history = ApiHistory.builder()
                .apiType(ApiType.STREAM_ASK)
                .threadId("thread-1")
                .statusCode(200)
                .durationMs(1500L)
                .build();

        StepVerifier.create(apiHistoryService.createOne(history))
                .assertNext(saved -> assertThat(saved.getId()).hasSize(36))
                .verifyComplete();

        assertThat(meterRegistry.get(ApiHistoryService.METRIC_REQUESTS)
                .tag("api_type", "STREAM_ASK")
                .tag("status", "200")
                .counter()
                .count()).isEqualTo(1.0);
        assertThat(meterRegistry.get(ApiHistoryService.METRIC_DURATION)
                .tag("api_type", "STREAM_ASK")
                .timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1500.0);
    }

    @Test
    @DisplayName("저장 실패는 오류로 전파")
    void createOnePropagatesFailure() {
        when(apiHistoryRepository.save(any(ApiHistory.class))).thenThrow(new IllegalStateException("connection refused"));

        StepVerifier.create(apiHistoryService.createOne(ApiHistory.builder()
                        .apiType(ApiType.GENERATE_SQL)
                        .statusCode(500)
                        .build()))
                .expectErrorMessage("connection refused")
                .verify();

        assertThat(meterRegistry.find(ApiHistoryService.METRIC_REQUESTS).counter()).isNull();
    }

    @Test
    @DisplayName("스레드 이력: 성공한 턴 중 질문과 SQL이 모두 있는 것만")
    void findAskHistoriesFiltersTurns() {
        when(apiHistoryRepository.findAllByThreadIdOrderByCreatedAtAsc("thread-1")).thenReturn(List.of(
                turn(200, "How many orders?", Map.of("sql", "SELECT count(*) FROM orders")),
                turn(400, "Delete everything", Map.of("error", "Not allowed")),
                turn(200, "Hello", Map.of("explanation", "Hi there")),
                turn(200, "Top customers?", Map.of("sql", "SELECT name FROM customers LIMIT 10"))));

        StepVerifier.create(apiHistoryService.findAskHistories("thread-1"))
                .assertNext(histories -> assertThat(histories).containsExactly(
                        new AskHistory("How many orders?", "SELECT count(*) FROM orders"),
                        new AskHistory("Top customers?", "SELECT name FROM customers LIMIT 10")))
                .verifyComplete();
    }

    @Test
    @DisplayName("threadId가 없으면 저장소를 조회하지 않음")
    void findAskHistoriesWithoutThread() {
        StepVerifier.create(apiHistoryService.findAskHistories(null))
                .assertNext(histories -> assertThat(histories).isEmpty())
                .verifyComplete();

        verify(apiHistoryRepository, never()).findAllByThreadIdOrderByCreatedAtAsc(any());
    }

    private static ApiHistory turn(int statusCode, String question, Map<String, Object> response) {
        return ApiHistory.builder()
                .apiType(ApiType.STREAM_ASK)
                .threadId("thread-1")
                .requestPayload(Map.of("question", question))
                .responsePayload(response)
                .statusCode(statusCode)
                .build();
    }
}
