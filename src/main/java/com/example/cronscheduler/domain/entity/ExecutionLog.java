package com.example.cronscheduler.domain.entity;

import com.example.cronscheduler.domain.enums.ExecutionStatus;
import com.example.cronscheduler.domain.enums.TriggerSource;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Execution log entry for one firing of a cron job.
 * Written once when the attempt finishes; there are no setters and no update paths.
 */
@Entity
@Table(name = "execution_logs", indexes = {
        @Index(name = "idx_exec_log_job_started", columnList = "job_id, started_at"),
        @Index(name = "idx_exec_log_started_at", columnList = "started_at"),
        @Index(name = "idx_exec_log_status", columnList = "status")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionLog {

    /**
     * Upper bound for the stored response body, in characters
     */
    public static final int RESPONSE_BODY_LIMIT = 5000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Job that fired. Not a foreign key: logs outlive deleted jobs until retention removes them.
     */
    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ExecutionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_source", nullable = false, length = 20)
    @Builder.Default
    private TriggerSource triggerSource = TriggerSource.SCHEDULED;

    /**
     * Queue delivery attempt that produced this record (1-based)
     */
    @Column(name = "attempt_number", nullable = false)
    @Builder.Default
    private Integer attemptNumber = 1;

    /**
     * HTTP status code returned by the target, if any
     */
    @Column(name = "response_code")
    private Integer responseCode;

    @Column(name = "response_body", length = RESPONSE_BODY_LIMIT)
    private String responseBody;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Error classification for analysis
     */
    @Column(name = "error_type", length = 200)
    private String errorType;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at", nullable = false, updatable = false)
    private Instant finishedAt;

    @Column(name = "duration_ms", nullable = false, updatable = false)
    private Long durationMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        if (this.durationMs == null && startedAt != null && finishedAt != null) {
            this.durationMs = finishedAt.toEpochMilli() - startedAt.toEpochMilli();
        }
    }

    /**
     * Truncate a response body to the stored limit
     */
    public static String truncateBody(String body) {
        if (body == null || body.length() <= RESPONSE_BODY_LIMIT) {
            return body;
        }
        return body.substring(0, RESPONSE_BODY_LIMIT);
    }
}
