package com.queryinsight.ask.service.ask;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryinsight.ask.client.AiServiceClient;
import com.queryinsight.ask.client.QueryEngineClient;
import com.queryinsight.ask.config.AskProperties;
import com.queryinsight.ask.dto.AskRequest;
import com.queryinsight.ask.dto.GenerateSqlResponse;
import com.queryinsight.ask.dto.ai.AiConfigurations;
import com.queryinsight.ask.dto.ai.AiError;
import com.queryinsight.ask.dto.ai.AskHistory;
import com.queryinsight.ask.dto.ai.AskJobInput;
import com.queryinsight.ask.dto.ai.AskResult;
import com.queryinsight.ask.dto.ai.AsyncQueryResponse;
import com.queryinsight.ask.dto.ai.TextBasedAnswerInput;
import com.queryinsight.ask.dto.ai.TextBasedAnswerResult;
import com.queryinsight.ask.dto.ai.TextBasedAnswerStatus;
import com.queryinsight.ask.dto.engine.PreviewData;
import com.queryinsight.ask.dto.stream.StateType;
import com.queryinsight.ask.entity.deploy.Deployment;
import com.queryinsight.ask.entity.history.ApiHistory;
import com.queryinsight.ask.entity.history.ApiType;
import com.queryinsight.ask.entity.project.Project;
import com.queryinsight.ask.exception.ApiException;
import com.queryinsight.ask.exception.ApiExceptionHandler;
import com.queryinsight.ask.exception.ErrorCode;
import com.queryinsight.ask.service.ApiHistoryService;
import com.queryinsight.ask.service.DeployService;
import com.queryinsight.ask.service.ProjectService;
import com.queryinsight.ask.service.stream.ChunkProtocolParser;
import com.queryinsight.ask.service.stream.StreamWriter;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 자연어 질의 파이프라인 오케스트레이터.
 *
 * <pre>
 * 질문 → SQL 생성 작업 제출/폴링 → 결과 검증 → (GENERAL: 설명 스트리밍)
 *                                      → SQL 실행(샘플) → 요약 작업 제출/폴링 → 요약 스트리밍
 * </pre>
 *
 * 모든 종료 경로(성공, 실패, 클라이언트 연결 종료)에서 감사 기록은 정확히 한 번 남습니다.
 * 스트리밍 응답은 message_start로 시작해 message_stop으로 끝납니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AskOrchestrationService {

    static final String BLOCK_EXPLANATION = "explanation";
    static final String BLOCK_SUMMARY = "summary_generation";
    static final int CLIENT_CLOSED_REQUEST = 499;

    private final AiServiceClient aiServiceClient;
    private final QueryEngineClient queryEngineClient;
    private final ProjectService projectService;
    private final DeployService deployService;
    private final ApiHistoryService apiHistoryService;
    private final PollingCoordinator pollingCoordinator;
    private final AskResultValidator askResultValidator;
    private final ChunkProtocolParser chunkProtocolParser;
    private final AskProperties properties;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    // ============================================
    // HTTP surfaces
    // ============================================

    /**
     * 스트리밍 질의: SQL 생성부터 요약까지 SSE로 진행 상황을 전달합니다.
     */
    public Flux<ServerSentEvent<String>> streamAsk(HttpMethod method, AskRequest request, Map<String, String> headers) {
        AskContext context = AskContext.start(ApiType.STREAM_ASK,
                request != null ? request.getThreadId() : null, toRequestPayload(request), headers);
        StreamWriter writer = new StreamWriter(objectMapper);
        log.info("Stream ask started: threadId={}, question='{}'",
                context.getThreadId(), request != null ? request.getQuestion() : null);

        Mono<Void> pipeline = Mono.defer(() -> {
            writer.start();
            validateMethod(method);
            validateRequest(request);
            return runStreamAsk(context, request, writer);
        });

        return openStream(context, writer, pipeline);
    }

    /**
     * 동기 SQL 생성. SQL 생성 단계만 실행하고 결과 SQL을 반환합니다.
     */
    public Mono<GenerateSqlResponse> generateSql(HttpMethod method, AskRequest request, Map<String, String> headers) {
        AskContext context = AskContext.start(ApiType.GENERATE_SQL,
                request != null ? request.getThreadId() : null, toRequestPayload(request), headers);
        log.info("Generate SQL started: threadId={}, question='{}'",
                context.getThreadId(), request != null ? request.getQuestion() : null);

        return Mono.defer(() -> {
                    validateMethod(method);
                    validateRequest(request);
                    return resolveTarget(context)
                            .flatMap(target -> runSqlGeneration(context, request, target,
                                    result -> log.debug("[{}] SQL generation status: {}",
                                            context.getThreadId(), result.getStatus()))
                                    .map(result -> validateSqlResult(context, result))
                                    .flatMap(sql -> translateDialect(request, target, sql)
                                            .map(dialectSql -> Map.entry(sql, dialectSql))));
                })
                .flatMap(generated -> {
                    context.transition(AskTaskState.COMPLETED);
                    Map<String, Object> responsePayload = new LinkedHashMap<>();
                    responsePayload.put("sql", generated.getKey());
                    if (!generated.getKey().equals(generated.getValue())) {
                        responsePayload.put("dialectSql", generated.getValue());
                    }
                    responsePayload.put("threadId", context.getThreadId());
                    return record(context, 200, responsePayload, context.elapsedMs())
                            .thenReturn(new GenerateSqlResponse(generated.getValue(), context.getThreadId()));
                })
                .onErrorResume(e -> {
                    ApiException exception = ApiException.from(e);
                    context.transition(AskTaskState.FAILED);
                    logFailure(context, exception);
                    return record(context, exception.getStatusCode(),
                            ApiExceptionHandler.createErrorResponse(exception), context.elapsedMs())
                            .then(Mono.<GenerateSqlResponse>error(exception));
                })
                .doOnCancel(() -> abandon(context));
    }

    /**
     * generate_sql이 일반 질의로 분류한 작업의 설명을 스트리밍합니다.
     */
    public Flux<ServerSentEvent<String>> streamExplanation(String queryId, String threadId, Map<String, String> headers) {
        Map<String, Object> requestPayload = new LinkedHashMap<>();
        requestPayload.put("queryId", queryId);
        if (threadId != null) {
            requestPayload.put("threadId", threadId);
        }
        AskContext context = AskContext.start(ApiType.STREAM_EXPLANATION, threadId, requestPayload, headers);
        StreamWriter writer = new StreamWriter(objectMapper);
        log.info("Explanation stream started: threadId={}, queryId={}", context.getThreadId(), queryId);

        Mono<Void> pipeline = Mono.defer(() -> {
            writer.start();
            if (queryId == null || queryId.isBlank()) {
                throw ApiException.validation("queryId is required");
            }
            context.transition(AskTaskState.SQL_DONE_GENERAL);
            return streamContentBlock(writer, BLOCK_EXPLANATION, aiServiceClient.getAskStreamingResult(queryId))
                    .flatMap(explanation -> completeStream(context, writer, Map.of("explanation", explanation)));
        });

        return openStream(context, writer, pipeline);
    }

    // ============================================
    // Pipeline stages
    // ============================================

    private Mono<Void> runStreamAsk(AskContext context, AskRequest request, StreamWriter writer) {
        return resolveTarget(context).flatMap(target -> {
            writer.state(StateType.SQL_GENERATION_START, null);
            return runSqlGeneration(context, request, target,
                    result -> writer.state(StateType.fromAskStatus(result.getStatus()), diagnostics(result)))
                    .flatMap(result -> {
                        String sql;
                        try {
                            sql = validateSqlResult(context, result);
                        } catch (ApiException e) {
                            if (e.getExplanationQueryId() == null) {
                                throw e;
                            }
                            context.transition(AskTaskState.SQL_DONE_GENERAL);
                            return streamContentBlock(writer, BLOCK_EXPLANATION,
                                    aiServiceClient.getAskStreamingResult(e.getExplanationQueryId()))
                                    .flatMap(explanation -> completeStream(context, writer,
                                            Map.of("explanation", explanation)));
                        }
                        writer.state(StateType.SQL_GENERATION_SUCCESS, Map.of("sql", sql));
                        return executeAndSummarize(context, request, target, sql, writer);
                    });
        });
    }

    /**
     * SQL 생성 작업 제출 후 종료 상태까지 폴링합니다. 동기/스트리밍 경로가 공유합니다.
     */
    private Mono<AskResult> runSqlGeneration(AskContext context, AskRequest request, AskTarget target,
                                             Consumer<AskResult> onStatusChange) {
        Mono<List<AskHistory>> histories = context.isNewThread()
                ? Mono.just(List.of())
                : apiHistoryService.findAskHistories(context.getThreadId());

        return histories
                .flatMap(turns -> aiServiceClient.ask(AskJobInput.builder()
                        .query(request.getQuestion())
                        .deployId(target.deployment().getHash())
                        .histories(turns)
                        .threadId(context.getThreadId())
                        .configurations(new AiConfigurations(resolveLanguage(request, target.project())))
                        .build()))
                .map(submitted -> requireQueryId(submitted, "SQL generation"))
                .flatMap(queryId -> {
                    context.setSqlQueryId(queryId);
                    context.transition(AskTaskState.SQL_SUBMITTED);
                    context.transition(AskTaskState.SQL_POLLING);
                    return pollingCoordinator.poll("SQL generation",
                            () -> aiServiceClient.getAskResult(queryId),
                            AskResult::getStatus,
                            result -> result.hasError() || (result.getStatus() != null && result.getStatus().isTerminal()),
                            result -> {
                                if (result.getStatus() != null) {
                                    onStatusChange.accept(result);
                                }
                            },
                            properties.getPolling().getSqlGenerationTimeout());
                })
                .doOnError(AskOrchestrationService::isPollingTimeout, e -> stopSqlJob(context));
    }

    private String validateSqlResult(AskContext context, AskResult result) {
        String sql = askResultValidator.validate(result, context.getSqlQueryId());
        context.transition(AskTaskState.SQL_DONE_SQL);
        return sql;
    }

    private Mono<Void> executeAndSummarize(AskContext context, AskRequest request, AskTarget target,
                                           String sql, StreamWriter writer) {
        int sampleSize = request.getSampleSize() != null ? request.getSampleSize() : properties.getDefaultSampleSize();

        context.transition(AskTaskState.EXECUTING_SQL);
        writer.state(StateType.SQL_EXECUTION_START, null);

        return queryEngineClient.preview(sql, target.deployment().getManifest(), sampleSize)
                .onErrorMap(e -> !(e instanceof ApiException), e -> ApiException.sqlExecutionError(e.getMessage(), e))
                .switchIfEmpty(Mono.error(() -> ApiException.sqlExecutionError("Query engine returned no data", null)))
                .flatMap(preview -> {
                    writer.state(StateType.SQL_EXECUTION_END, Map.of("rowCount", preview.rowCount()));
                    return summarize(context, request, target, sql, preview);
                })
                .flatMap(summaryQueryId -> {
                    context.transition(AskTaskState.STREAMING_SUMMARY);
                    return streamContentBlock(writer, BLOCK_SUMMARY, aiServiceClient.streamTextBasedAnswer(summaryQueryId));
                })
                .flatMap(summary -> {
                    Map<String, Object> responsePayload = new LinkedHashMap<>();
                    responsePayload.put("sql", sql);
                    responsePayload.put("summary", summary);
                    return completeStream(context, writer, responsePayload);
                });
    }

    /**
     * 요약 작업을 제출하고 SUCCEEDED가 될 때까지 기다린 뒤 스트리밍할 작업 ID를 반환합니다.
     */
    private Mono<String> summarize(AskContext context, AskRequest request, AskTarget target,
                                   String sql, PreviewData preview) {
        TextBasedAnswerInput input = TextBasedAnswerInput.builder()
                .query(request.getQuestion())
                .sql(sql)
                .sqlData(preview)
                .threadId(context.getThreadId())
                .configurations(new AiConfigurations(resolveLanguage(request, target.project())))
                .build();

        return aiServiceClient.createTextBasedAnswer(input)
                .map(submitted -> requireQueryId(submitted, "Summary generation"))
                .flatMap(queryId -> {
                    context.transition(AskTaskState.SUMMARY_SUBMITTED);
                    context.transition(AskTaskState.SUMMARY_POLLING);
                    return pollingCoordinator.poll("Summary generation",
                                    () -> aiServiceClient.getTextBasedAnswerResult(queryId),
                                    TextBasedAnswerResult::getStatus,
                                    result -> result.getStatus() != null && result.getStatus().isTerminal(),
                                    result -> log.debug("[{}] Summary status: {}", context.getThreadId(), result.getStatus()),
                                    properties.getPolling().getSummaryTimeout())
                            .map(result -> {
                                if (result.getStatus() == TextBasedAnswerStatus.FAILED) {
                                    AiError error = result.getError();
                                    String message = error != null && error.message() != null
                                            ? error.message() : "Summary generation failed";
                                    throw ApiException.upstream(message, error != null ? error.code() : null, null);
                                }
                                return queryId;
                            });
                });
    }

    /**
     * content_block_start → delta* → content_block_stop 을 한 단위로 보장합니다.
     * 정상 종료든 오류든 stop이 먼저 나가고, 누적된 전체 텍스트를 반환합니다.
     */
    private Mono<String> streamContentBlock(StreamWriter writer, String name, Flux<byte[]> source) {
        return Mono.defer(() -> {
            StringBuilder text = new StringBuilder();
            writer.contentBlockStart(name);
            return chunkProtocolParser.parse(source)
                    .doOnNext(fragment -> {
                        text.append(fragment);
                        writer.contentBlockDelta(fragment);
                    })
                    .then(Mono.fromCallable(text::toString))
                    .doOnTerminate(writer::contentBlockStop);
        });
    }

    private Mono<AskTarget> resolveTarget(AskContext context) {
        return projectService.getCurrentProject()
                .switchIfEmpty(Mono.error(ApiException::noDeploymentFound))
                .flatMap(project -> {
                    context.setProjectId(project.getId());
                    return deployService.getLastDeployment(project.getId())
                            .map(deployment -> new AskTarget(project, deployment));
                });
    }

    /**
     * returnSqlDialect 요청 시 데이터 소스 방언으로 변환. 실패하면 원본 SQL을 그대로 사용합니다.
     */
    private Mono<String> translateDialect(AskRequest request, AskTarget target, String sql) {
        if (!Boolean.TRUE.equals(request.getReturnSqlDialect())) {
            return Mono.just(sql);
        }
        return queryEngineClient.getNativeSql(sql, target.deployment().getManifest())
                .filter(nativeSql -> !nativeSql.isBlank())
                .defaultIfEmpty(sql)
                .onErrorResume(e -> {
                    log.warn("Failed to translate SQL to {} dialect, returning original SQL: {}",
                            target.project().getType(), e.getMessage());
                    return Mono.just(sql);
                });
    }

    // ============================================
    // Stream lifecycle and audit
    // ============================================

    /**
     * 파이프라인과 SSE 채널을 묶습니다. 클라이언트가 구독을 끊으면 파이프라인도 함께 취소됩니다.
     */
    private Flux<ServerSentEvent<String>> openStream(AskContext context, StreamWriter writer, Mono<Void> pipeline) {
        Mono<Void> guarded = pipeline
                .onErrorResume(e -> failStream(context, writer, e))
                .doOnCancel(() -> abandon(context));
        return Flux.merge(writer.asFlux(), guarded.then(Mono.<ServerSentEvent<String>>empty()));
    }

    private Mono<Void> completeStream(AskContext context, StreamWriter writer, Map<String, Object> responsePayload) {
        context.transition(AskTaskState.COMPLETED);
        long duration = context.elapsedMs();
        return record(context, 200, responsePayload, duration)
                .then(Mono.fromRunnable(() -> writer.stop(context.getThreadId(), duration)));
    }

    private Mono<Void> failStream(AskContext context, StreamWriter writer, Throwable error) {
        ApiException exception = ApiException.from(error);
        context.transition(AskTaskState.FAILED);
        logFailure(context, exception);

        long duration = context.elapsedMs();
        writer.error(exception.getMessage(), exception.getCode(), exception.getAdditionalData());
        return record(context, exception.getStatusCode(), ApiExceptionHandler.createErrorResponse(exception), duration)
                .then(Mono.fromRunnable(() -> writer.stop(context.getThreadId(), duration)));
    }

    /**
     * 클라이언트 연결 종료. 진행 중인 폴링/스트림은 이미 취소되었고, 감사 기록만 시도합니다.
     */
    private void abandon(AskContext context) {
        log.info("Client disconnected: threadId={}, type={}, state={}",
                context.getThreadId(), context.getApiType(), context.getState());
        boolean sqlJobInFlight = context.isSqlJobInFlight();
        context.transition(AskTaskState.CANCELLED);

        if (sqlJobInFlight && properties.isStopJobOnDisconnect()) {
            stopAsk(context.getSqlQueryId());
        }
        record(context, CLIENT_CLOSED_REQUEST, Map.of("error", "Client closed request"), context.elapsedMs());
    }

    private void stopSqlJob(AskContext context) {
        if (context.getSqlQueryId() != null) {
            stopAsk(context.getSqlQueryId());
        }
    }

    private void stopAsk(String queryId) {
        aiServiceClient.stopAsk(queryId)
                .doOnError(e -> log.warn("Failed to stop SQL generation job {}: {}", queryId, e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    /**
     * 요청당 한 번만 기록합니다. 기록 실패는 응답에 영향을 주지 않습니다 (ApiHistoryService에서 ERROR 로그).
     *
     * 저장은 별도 구독으로 실행되어 클라이언트 연결 종료로 파이프라인이 취소되어도 끝까지 진행됩니다.
     * 반환된 Mono는 같은 저장 결과를 공유합니다.
     */
    private Mono<Void> record(AskContext context, int statusCode, Map<String, Object> responsePayload, long durationMs) {
        if (!context.markRecorded()) {
            log.debug("[{}] API history already recorded, skipping status {}", context.getThreadId(), statusCode);
            return Mono.empty();
        }
        ApiHistory history = ApiHistory.builder()
                .projectId(context.getProjectId())
                .apiType(context.getApiType())
                .threadId(context.getThreadId())
                .headers(context.getHeaders())
                .requestPayload(context.getRequestPayload())
                .responsePayload(responsePayload)
                .statusCode(statusCode)
                .durationMs(durationMs)
                .build();
        Mono<Void> save = apiHistoryService.createOne(history)
                .onErrorResume(e -> Mono.empty())
                .then()
                .cache();
        save.subscribe();
        return save;
    }

    // ============================================
    // Helpers
    // ============================================

    private void validateMethod(HttpMethod method) {
        if (!HttpMethod.POST.equals(method)) {
            throw ApiException.methodNotAllowed(method != null ? method.name() : "UNKNOWN");
        }
    }

    private void validateRequest(AskRequest request) {
        if (request == null) {
            throw ApiException.validation("Question is required");
        }
        Set<ConstraintViolation<AskRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw ApiException.validation(violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining(", ")));
        }
    }

    private String resolveLanguage(AskRequest request, Project project) {
        if (request.getLanguage() != null && !request.getLanguage().isBlank()) {
            return request.getLanguage();
        }
        if (project.getLanguage() != null && !project.getLanguage().isBlank()) {
            return project.getLanguage();
        }
        return properties.getDefaultLanguage();
    }

    private static String requireQueryId(AsyncQueryResponse submitted, String stage) {
        if (submitted.queryId() == null || submitted.queryId().isBlank()) {
            throw ApiException.contractViolation(stage + " job was not accepted: missing query_id");
        }
        return submitted.queryId();
    }

    private static Map<String, Object> diagnostics(AskResult result) {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, "rephrasedQuestion", result.getRephrasedQuestion());
        putIfPresent(fields, "intentReasoning", result.getIntentReasoning());
        putIfPresent(fields, "sqlGenerationReasoning", result.getSqlGenerationReasoning());
        putIfPresent(fields, "retrievedTables", result.getRetrievedTables());
        putIfPresent(fields, "invalidSql", result.getInvalidSql());
        putIfPresent(fields, "traceId", result.getTraceId());
        return fields;
    }

    private static void putIfPresent(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }

    private static Map<String, Object> toRequestPayload(AskRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (request == null) {
            return payload;
        }
        putIfPresent(payload, "question", request.getQuestion());
        putIfPresent(payload, "threadId", request.getThreadId());
        putIfPresent(payload, "language", request.getLanguage());
        putIfPresent(payload, "returnSqlDialect", request.getReturnSqlDialect());
        putIfPresent(payload, "sampleSize", request.getSampleSize());
        return payload;
    }

    private static boolean isPollingTimeout(Throwable e) {
        return e instanceof ApiException apiException
                && ErrorCode.POLLING_TIMEOUT.name().equals(apiException.getCode());
    }

    private void logFailure(AskContext context, ApiException exception) {
        if (exception.getStatus().is5xxServerError()) {
            log.error("Ask request failed: threadId={}, type={}, code={}, message={}",
                    context.getThreadId(), context.getApiType(), exception.getCode(), exception.getMessage(),
                    exception.getCause() != null ? exception.getCause() : exception);
        } else {
            log.warn("Ask request failed: threadId={}, type={}, code={}, message={}",
                    context.getThreadId(), context.getApiType(), exception.getCode(), exception.getMessage());
        }
    }

    private record AskTarget(Project project, Deployment deployment) {
    }
}
