package com.queryinsight.ask.entity.deploy;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Versioned, hashed snapshot of a project's modeling manifest.
 * SQL generation and execution always run against the latest successful deployment.
 */
@Entity
@Table(name = "deploy_log", indexes = {
        @Index(name = "idx_deploy_log_project_id", columnList = "project_id"),
        @Index(name = "idx_deploy_log_hash", columnList = "hash")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Deployment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    /**
     * Manifest hash, used by the AI service to select the indexed schema
     */
    @Column(nullable = false, length = 128)
    private String hash;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "manifest")
    private Map<String, Object> manifest;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DeployStatus status;

    @Column(length = 2048)
    private String error;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum DeployStatus {
        IN_PROGRESS,
        SUCCESS,
        FAILED
    }
}
