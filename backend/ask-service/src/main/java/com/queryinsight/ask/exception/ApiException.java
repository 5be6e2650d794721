package com.queryinsight.ask.exception;

import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 질의 파이프라인의 모든 예상 가능한 실패를 표현하는 예외.
 * 동기 엔드포인트에서는 JSON 에러 본문으로, 스트리밍 엔드포인트에서는 error 이벤트로 변환됩니다.
 */
public class ApiException extends RuntimeException {

    public static final String EXPLANATION_QUERY_ID = "explanationQueryId";
    public static final String INVALID_SQL = "invalidSql";

    private final HttpStatus status;
    private final String code;
    private final Map<String, Object> additionalData;

    public ApiException(String message, HttpStatus status, String code) {
        this(message, status, code, Map.of(), null);
    }

    public ApiException(String message, HttpStatus status, String code, Map<String, Object> additionalData) {
        this(message, status, code, additionalData, null);
    }

    public ApiException(String message, HttpStatus status, String code,
                        Map<String, Object> additionalData, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
        this.additionalData = additionalData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalData));
    }

    public HttpStatus getStatus() {
        return status;
    }

    public int getStatusCode() {
        return status.value();
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getAdditionalData() {
        return additionalData;
    }

    /**
     * 일반 질의로 분류되어 설명 스트림을 대신 제공할 수 있는 경우의 작업 ID
     */
    public String getExplanationQueryId() {
        Object value = additionalData.get(EXPLANATION_QUERY_ID);
        return value != null ? value.toString() : null;
    }

    /**
     * 질문 누락, 잘못된 본문
     */
    public static ApiException validation(String message) {
        return new ApiException(message, HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION.name());
    }

    /**
     * 허용되지 않은 HTTP 메서드
     */
    public static ApiException methodNotAllowed(String method) {
        return new ApiException("Method " + method + " not allowed", HttpStatus.METHOD_NOT_ALLOWED,
                ErrorCode.VALIDATION.name());
    }

    public static ApiException noDeploymentFound() {
        return new ApiException("No deployment found, please deploy your project first",
                HttpStatus.BAD_REQUEST, ErrorCode.NO_DEPLOYMENT_FOUND.name());
    }

    /**
     * 단계 마감 시간 초과. 재시도하지 않습니다.
     */
    public static ApiException pollingTimeout(String stage, Duration timeout) {
        return new ApiException("Polling timeout: " + stage + " did not finish within " + timeout.toSeconds() + "s",
                HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.POLLING_TIMEOUT.name());
    }

    public static ApiException nonSqlQuery(String message) {
        return new ApiException(message, HttpStatus.BAD_REQUEST, ErrorCode.NON_SQL_QUERY.name());
    }

    /**
     * 일반 질의: SQL은 없지만 해당 작업의 설명을 스트리밍할 수 있음
     */
    public static ApiException generalQuery(String message, String explanationQueryId) {
        return new ApiException(message, HttpStatus.BAD_REQUEST, ErrorCode.NON_SQL_QUERY.name(),
                Map.of(EXPLANATION_QUERY_ID, explanationQueryId));
    }

    public static ApiException sqlExecutionError(String message, Throwable cause) {
        return new ApiException(message, HttpStatus.BAD_REQUEST, ErrorCode.SQL_EXECUTION_ERROR.name(),
                Map.of(), cause);
    }

    /**
     * AI 서비스가 작업 결과에 보고한 에러
     */
    public static ApiException upstream(String message, String code, String invalidSql) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (invalidSql != null && !invalidSql.isBlank()) {
            data.put(INVALID_SQL, invalidSql);
        }
        String resolvedCode = code != null && !code.isBlank() ? code : ErrorCode.INTERNAL_SERVER_ERROR.name();
        return new ApiException(message, HttpStatus.BAD_REQUEST, resolvedCode, data);
    }

    /**
     * 업스트림 계약 위반 (완료 상태인데 SQL 없음 등)
     */
    public static ApiException contractViolation(String message) {
        return new ApiException(message, HttpStatus.BAD_REQUEST, ErrorCode.INTERNAL_SERVER_ERROR.name());
    }

    /**
     * 예상하지 못한 실패. 내부 메시지는 클라이언트에 노출하지 않습니다.
     */
    public static ApiException internal(Throwable cause) {
        return new ApiException("Internal server error", HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorCode.INTERNAL_SERVER_ERROR.name(), Map.of(), cause);
    }

    /**
     * 임의의 예외를 ApiException으로 정규화
     */
    public static ApiException from(Throwable throwable) {
        if (throwable instanceof ApiException apiException) {
            return apiException;
        }
        return internal(throwable);
    }
}
