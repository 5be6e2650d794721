package com.queryinsight.ask.controller;

import com.queryinsight.ask.dto.AskRequest;
import com.queryinsight.ask.dto.GenerateSqlResponse;
import com.queryinsight.ask.service.ask.AskOrchestrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 자연어 질의 API 컨트롤러
 *
 * - generate_sql: 질문을 SQL로 변환 (JSON 응답)
 * - stream/ask: SQL 생성, 실행, 요약까지 SSE로 스트리밍
 * - stream_explanation: 일반 질의로 분류된 작업의 설명 스트리밍
 *
 * HTTP 메서드 검증은 감사 기록을 남기기 위해 서비스에서 수행합니다.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class AskController {

    private final AskOrchestrationService askOrchestrationService;

    /**
     * 질문을 SQL로 변환
     *
     * @return 200 {sql, threadId} 또는 {error, code, ...}
     */
    @RequestMapping("/generate_sql")
    public Mono<GenerateSqlResponse> generateSql(
            ServerHttpRequest httpRequest,
            @RequestBody(required = false) AskRequest request
    ) {
        return askOrchestrationService.generateSql(httpRequest.getMethod(), request,
                httpRequest.getHeaders().toSingleValueMap());
    }

    /**
     * 질문 처리 과정을 SSE로 스트리밍
     */
    @RequestMapping("/stream/ask")
    public Flux<ServerSentEvent<String>> streamAsk(
            ServerHttpRequest httpRequest,
            ServerHttpResponse httpResponse,
            @RequestBody(required = false) AskRequest request
    ) {
        applySseHeaders(httpResponse);
        return askOrchestrationService.streamAsk(httpRequest.getMethod(), request,
                httpRequest.getHeaders().toSingleValueMap());
    }

    /**
     * 일반 질의 설명 스트리밍
     *
     * @param queryId generate_sql 에러 응답의 explanationQueryId
     */
    @GetMapping("/stream_explanation")
    public Flux<ServerSentEvent<String>> streamExplanation(
            ServerHttpRequest httpRequest,
            ServerHttpResponse httpResponse,
            @RequestParam(required = false) String queryId,
            @RequestParam(required = false) String threadId
    ) {
        applySseHeaders(httpResponse);
        return askOrchestrationService.streamExplanation(queryId, threadId,
                httpRequest.getHeaders().toSingleValueMap());
    }

    private static void applySseHeaders(ServerHttpResponse response) {
        HttpHeaders headers = response.getHeaders();
        headers.setContentType(MediaType.TEXT_EVENT_STREAM);
        headers.set(HttpHeaders.CACHE_CONTROL, "no-cache, no-transform");
        headers.set(HttpHeaders.CONNECTION, "keep-alive");
        // nginx 프록시 버퍼링 비활성화
        headers.set("X-Accel-Buffering", "no");
    }
}
