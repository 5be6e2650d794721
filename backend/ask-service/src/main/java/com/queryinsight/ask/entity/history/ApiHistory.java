package com.queryinsight.ask.entity.history;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Audit record of one inbound API request.
 * Written exactly once per request on every exit path and never updated afterwards.
 */
@Entity
@Immutable
@Table(name = "api_history", indexes = {
        @Index(name = "idx_api_history_thread_id", columnList = "thread_id"),
        @Index(name = "idx_api_history_project_id", columnList = "project_id"),
        @Index(name = "idx_api_history_api_type", columnList = "api_type"),
        @Index(name = "idx_api_history_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiHistory {

    @Id
    @Column(length = 36)
    private String id;

    /**
     * Null when the request failed before the project was resolved
     */
    @Column(name = "project_id")
    private Long projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "api_type", nullable = false, length = 32)
    private ApiType apiType;

    @Column(name = "thread_id", length = 64)
    private String threadId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "headers")
    private Map<String, String> headers;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "request_payload")
    private Map<String, Object> requestPayload;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "response_payload")
    private Map<String, Object> responsePayload;

    @Column(name = "status_code", nullable = false)
    private Integer statusCode;

    @Column(name = "duration_ms")
    private Long durationMs;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isSuccessful() {
        return statusCode != null && statusCode == 200;
    }
}
