package com.example.cronscheduler.service.retention;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.domain.repository.ExecutionLogRepository;
import com.example.cronscheduler.service.queue.QueuedDelivery;
import com.example.cronscheduler.service.queue.TriggerConsumer;
import com.example.cronscheduler.service.queue.TriggerOptions;
import com.example.cronscheduler.service.queue.TriggerQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Purges old execution logs.
 * <p>
 * A single repeatable trigger on the maintenance queue fires the purge
 * daily; its worker runs with concurrency 1, so purges never overlap.
 */
@Slf4j
@Service
public class ExecutionLogRetentionService implements TriggerConsumer {

    public static final String CLEANUP_TRIGGER_KEY = "daily-cleanup";
    static final String DAYS_TO_KEEP_KEY = "daysToKeep";

    private final ExecutionLogRepository executionLogRepository;
    private final TriggerQueue maintenanceQueue;
    private final CronSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ExecutionLogRetentionService(ExecutionLogRepository executionLogRepository,
                                        @Qualifier("maintenanceTriggerQueue") TriggerQueue maintenanceQueue,
                                        CronSchedulerProperties properties, MetricsConfig metricsConfig, Clock clock) {
        this.executionLogRepository = executionLogRepository;
        this.maintenanceQueue = maintenanceQueue;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Replace whatever maintenance triggers exist with the daily cleanup trigger
     */
    @Transactional
    public void scheduleDailyCleanup() {
        var retention = properties.getRetention();

        for (var existing : maintenanceQueue.listRepeatable()) {
            maintenanceQueue.removeRepeatable(existing.key());
        }

        if (!retention.isEnabled()) {
            log.info("Execution log retention is disabled");
            return;
        }

        maintenanceQueue.addRepeatable(CLEANUP_TRIGGER_KEY, Map.of(DAYS_TO_KEEP_KEY, retention.getDaysToKeep()),
                retention.getCronExpression(), retention.getTimezone(), TriggerOptions.defaults());

        log.info("Cleanup job scheduled: '{}' {}, keeping {} days", retention.getCronExpression(), retention.getTimezone(),
                retention.getDaysToKeep());
    }

    @Override
    @Transactional
    public void consume(QueuedDelivery delivery) {
        var raw = delivery.payload().get(DAYS_TO_KEEP_KEY);
        var daysToKeep = raw instanceof Number n ? n.intValue() : properties.getRetention().getDaysToKeep();
        purge(daysToKeep);
    }

    /**
     * Delete execution logs that started more than {@code daysToKeep} days ago
     *
     * @return number of logs deleted
     */
    @Transactional
    public int purge(int daysToKeep) {
        if (daysToKeep < 1) {
            throw new IllegalArgumentException("daysToKeep must be at least 1");
        }

        var cutoff = clock.instant().minus(Duration.ofDays(daysToKeep));
        log.info("Starting cleanup of execution logs older than {} ({} days)", cutoff, daysToKeep);

        var deleted = executionLogRepository.deleteByStartedAtBefore(cutoff);
        metricsConfig.recordRetentionPurge(deleted);

        log.info("Cleanup completed, deleted {} execution logs", deleted);
        return deleted;
    }
}
