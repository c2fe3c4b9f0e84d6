package com.example.cronscheduler.config;

import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.domain.enums.TargetType;
import com.example.cronscheduler.domain.repository.CronJobRepository;
import com.example.cronscheduler.service.queue.TriggerQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring scheduler health and dispatch performance.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts by status
 * - Pending deliveries per queue
 * - Dispatch times and outcomes
 * - Retries, terminal failures and skipped firings
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final CronJobRepository jobRepository;
    private final List<TriggerQueue> queues;

    private final ConcurrentHashMap<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : JobStatus.values()) {
            var value = gaugeValues.computeIfAbsent("jobs_" + status.getCode(), k -> new AtomicLong(0));
            Gauge.builder("cron_scheduler_jobs", value, AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of cron jobs by status")
                    .register(meterRegistry);
        }

        for (var queue : queues) {
            var value = gaugeValues.computeIfAbsent("pending_" + queue.getName(), k -> new AtomicLong(0));
            Gauge.builder("cron_scheduler_pending_deliveries", value, AtomicLong::get)
                    .tag("queue", queue.getName())
                    .description("Deliveries waiting to be claimed")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${cron-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var status : JobStatus.values()) {
                gaugeValues.get("jobs_" + status.getCode()).set(jobRepository.countByStatus(status));
            }
            for (var queue : queues) {
                gaugeValues.get("pending_" + queue.getName()).set(queue.pendingCount());
            }
        } catch (RuntimeException e) {
            log.warn("Could not refresh scheduler gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startDispatchTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record dispatch time with its outcome
     */
    public void recordDispatch(Timer.Sample sample, TargetType targetType, String outcome) {
        sample.stop(Timer.builder("cron_scheduler_dispatch_time")
                .tag("target_type", targetType.getCode())
                .tag("outcome", outcome)
                .description("Job dispatch time")
                .register(meterRegistry));
    }

    public void recordRetry(TargetType targetType, int attemptNumber) {
        meterRegistry.counter("cron_scheduler_retries",
                "target_type", targetType.getCode(),
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    /**
     * Record a firing that failed after its last retry
     */
    public void recordTerminalFailure(TargetType targetType, String errorType) {
        meterRegistry.counter("cron_scheduler_terminal_failures",
                "target_type", targetType.getCode(),
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordSkipped(String reason) {
        meterRegistry.counter("cron_scheduler_skipped_firings", "reason", reason).increment();
    }

    public void recordRetentionPurge(int deleted) {
        meterRegistry.counter("cron_scheduler_retention_deleted_logs").increment(deleted);
    }
}
