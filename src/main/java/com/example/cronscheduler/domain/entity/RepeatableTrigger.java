package com.example.cronscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A repeat rule registered in the trigger queue.
 * <p>
 * Each row produces one {@link TriggerDelivery} whenever {@code nextFireAt} passes,
 * after which {@code nextFireAt} is advanced along the cron rule.
 */
@Entity
@Table(name = "repeatable_triggers",
        uniqueConstraints = @UniqueConstraint(name = "uk_repeatable_trigger_key", columnNames = {"queue_name", "trigger_key"}),
        indexes = @Index(name = "idx_repeatable_trigger_next_fire", columnList = "next_fire_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RepeatableTrigger {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "queue_name", nullable = false, updatable = false, length = 50)
    private String queueName;

    /**
     * Stable key, e.g. the job identifier
     */
    @Column(name = "trigger_key", nullable = false, updatable = false, length = 100)
    private String triggerKey;

    @Column(name = "cron_expression", nullable = false, length = 120)
    private String cronExpression;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    /**
     * Snapshot copied into every delivery this trigger produces
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    @Column(name = "max_attempts", nullable = false)
    private Integer maxAttempts;

    @Column(name = "backoff_delay_ms", nullable = false)
    private Long backoffDelayMs;

    @Column(name = "next_fire_at", nullable = false)
    private Instant nextFireAt;

    @Column(name = "last_fired_at")
    private Instant lastFiredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        if (this.payload == null) {
            this.payload = new HashMap<>();
        }
    }
}
