package com.example.cronscheduler.domain.entity;

import com.example.cronscheduler.domain.enums.JobHttpMethod;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.domain.enums.TargetType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A user-owned recurring job definition.
 * <p>
 * Holds:
 * - The cron expression and the IANA timezone it is evaluated in
 * - The dispatch target (HTTP callback or script command)
 * - Timeout and retry budget applied to every firing
 * - Lifecycle status controlling whether the job is scheduled
 */
@Entity
@Table(name = "cron_jobs", indexes = {
        @Index(name = "idx_cron_job_owner_created", columnList = "owner_id, created_at"),
        @Index(name = "idx_cron_job_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CronJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Identifier of the user who owns this job
     */
    @Column(name = "owner_id", nullable = false, updatable = false, length = 100)
    private String ownerId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "cron_expression", nullable = false, length = 120)
    private String cronExpression;

    /**
     * IANA timezone the cron expression is evaluated in
     */
    @Column(name = "timezone", nullable = false, length = 64)
    @Builder.Default
    private String timezone = "UTC";

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", nullable = false, length = 20)
    private TargetType targetType;

    /**
     * Callback URL, populated for HTTP jobs only
     */
    @Column(name = "target_url", length = 2048)
    private String targetUrl;

    /**
     * Command string, populated for SCRIPT jobs only
     */
    @Column(name = "command", length = 1000)
    private String command;

    @Enumerated(EnumType.STRING)
    @Column(name = "http_method", nullable = false, length = 10)
    @Builder.Default
    private JobHttpMethod httpMethod = JobHttpMethod.GET;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "headers", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, String> headers = new HashMap<>();

    /**
     * JSON body sent with POST, PUT and PATCH callbacks
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", columnDefinition = "jsonb")
    private Map<String, Object> payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.ACTIVE;

    /**
     * Hard deadline for a single dispatch, in milliseconds
     */
    @Column(name = "timeout_ms", nullable = false)
    @Builder.Default
    private Integer timeoutMs = 30000;

    /**
     * Redeliveries allowed after a transport failure before the firing is terminal
     */
    @Column(name = "max_retries", nullable = false)
    @Builder.Default
    private Integer maxRetries = 3;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // === Lifecycle Callbacks ===

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.status == null) {
            this.status = JobStatus.ACTIVE;
        }
        if (this.timezone == null || this.timezone.isBlank()) {
            this.timezone = "UTC";
        }
        if (this.httpMethod == null) {
            this.httpMethod = JobHttpMethod.GET;
        }
        if (this.headers == null) {
            this.headers = new HashMap<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    public boolean isActive() {
        return status == JobStatus.ACTIVE;
    }

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }
}
