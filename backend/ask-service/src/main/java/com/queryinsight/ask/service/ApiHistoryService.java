package com.queryinsight.ask.service;

import com.queryinsight.ask.dto.ai.AskHistory;
import com.queryinsight.ask.entity.history.ApiHistory;
import com.queryinsight.ask.repository.ApiHistoryRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * API 요청 감사 기록 서비스.
 *
 * 요청마다 정확히 한 건의 ApiHistory를 남기고, 같은 스레드의 이전 대화(질문, SQL)를
 * SQL 생성 작업의 컨텍스트로 제공합니다. 기록 시점에 요청 수와 처리 시간 메트릭도 함께 남깁니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApiHistoryService {

    public static final String METRIC_REQUESTS = "ask.api.requests";
    public static final String METRIC_DURATION = "ask.api.duration";

    private final ApiHistoryRepository apiHistoryRepository;
    private final MeterRegistry meterRegistry;

    /**
     * 감사 기록 저장 (append-only)
     */
    public Mono<ApiHistory> createOne(ApiHistory history) {
        if (history.getId() == null) {
            history.setId(UUID.randomUUID().toString());
        }
        return Mono.fromCallable(() -> apiHistoryRepository.save(history))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(saved -> {
                    recordMetrics(saved);
                    log.info("API history recorded: id={}, type={}, threadId={}, status={}, duration={}ms",
                            saved.getId(), saved.getApiType(), saved.getThreadId(),
                            saved.getStatusCode(), saved.getDurationMs());
                })
                .doOnError(e -> log.error("Failed to record API history: type={}, threadId={}, error={}",
                        history.getApiType(), history.getThreadId(), e.getMessage(), e));
    }

    /**
     * 스레드의 이전 성공 턴을 오래된 순으로 반환합니다.
     * 질문과 SQL이 모두 있는 턴만 포함합니다.
     */
    public Mono<List<AskHistory>> findAskHistories(String threadId) {
        if (threadId == null || threadId.isBlank()) {
            return Mono.just(List.of());
        }
        return Mono.fromCallable(() -> apiHistoryRepository.findAllByThreadIdOrderByCreatedAtAsc(threadId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(records -> records.stream()
                        .filter(ApiHistory::isSuccessful)
                        .map(ApiHistoryService::toAskHistory)
                        .filter(Objects::nonNull)
                        .toList())
                .doOnNext(histories -> log.debug("Loaded {} prior turns for thread {}", histories.size(), threadId));
    }

    private static AskHistory toAskHistory(ApiHistory record) {
        String question = stringValue(record.getRequestPayload(), "question");
        String sql = stringValue(record.getResponsePayload(), "sql");
        if (question == null || question.isBlank() || sql == null || sql.isBlank()) {
            return null;
        }
        return new AskHistory(question, sql);
    }

    private static String stringValue(Map<String, Object> payload, String key) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(key);
        return value instanceof String s ? s : null;
    }

    private void recordMetrics(ApiHistory history) {
        String apiType = history.getApiType() != null ? history.getApiType().name() : "UNKNOWN";
        Counter.builder(METRIC_REQUESTS)
                .description("Number of ask API requests by outcome")
                .tag("api_type", apiType)
                .tag("status", String.valueOf(history.getStatusCode()))
                .register(meterRegistry)
                .increment();
        if (history.getDurationMs() != null) {
            Timer.builder(METRIC_DURATION)
                    .description("Ask API request duration")
                    .tag("api_type", apiType)
                    .register(meterRegistry)
                    .record(Duration.ofMillis(history.getDurationMs()));
        }
    }
}
