package com.example.cronscheduler.domain.entity;

import com.example.cronscheduler.domain.enums.DeliveryKind;
import com.example.cronscheduler.domain.enums.DeliveryStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One due firing waiting in (or being processed from) the trigger queue.
 * <p>
 * Supports:
 * - At-least-once delivery through lease-based claiming
 * - Attempt counting and exponential backoff between redeliveries
 * - Lease expiry so deliveries held by a crashed worker are released
 */
@Entity
@Table(name = "trigger_deliveries", indexes = {
        @Index(name = "idx_delivery_queue_status_available", columnList = "queue_name, status, available_at"),
        @Index(name = "idx_delivery_locked_until", columnList = "status, locked_until"),
        @Index(name = "idx_delivery_trigger_key", columnList = "trigger_key")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TriggerDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "queue_name", nullable = false, updatable = false, length = 50)
    private String queueName;

    @Column(name = "trigger_key", nullable = false, updatable = false, length = 100)
    private String triggerKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 20)
    private DeliveryKind kind;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    /**
     * Number of failed processing attempts so far
     */
    @Column(name = "attempts_made", nullable = false)
    @Builder.Default
    private Integer attemptsMade = 0;

    @Column(name = "max_attempts", nullable = false)
    private Integer maxAttempts;

    @Column(name = "backoff_delay_ms", nullable = false)
    private Long backoffDelayMs;

    /**
     * Earliest time a worker may claim this delivery
     */
    @Column(name = "available_at", nullable = false)
    private Instant availableAt;

    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.status == null) {
            this.status = DeliveryStatus.PENDING;
        }
        if (this.attemptsMade == null) {
            this.attemptsMade = 0;
        }
        if (this.availableAt == null) {
            this.availableAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Check if another attempt is allowed after the current one fails
     */
    public boolean hasAttemptsLeft() {
        return attemptsMade + 1 < maxAttempts;
    }

    /**
     * Backoff before the next attempt: base delay doubled per failed attempt
     */
    public long nextBackoffMs() {
        var exponent = Math.min(attemptsMade, 20);
        return backoffDelayMs * (1L << exponent);
    }
}
