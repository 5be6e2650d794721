package com.queryinsight.ask.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 동기 API 전역 예외 핸들러.
 * 응답 본문 형식: {error, code, ...additionalData}
 */
@RestControllerAdvice(basePackages = "com.queryinsight.ask.controller")
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApiException(ApiException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("API error: code={}, message={}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("API error: code={}, message={}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(createErrorResponse(ex));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInputException(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(createErrorResponse(ApiException.validation("Invalid request body")));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(createErrorResponse(ApiException.internal(ex)));
    }

    /**
     * 감사 기록과 클라이언트 응답이 같은 본문을 쓰도록 공개합니다.
     */
    public static Map<String, Object> createErrorResponse(ApiException ex) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", ex.getMessage());
        if (ex.getCode() != null) {
            response.put("code", ex.getCode());
        }
        response.putAll(ex.getAdditionalData());
        return response;
    }
}
