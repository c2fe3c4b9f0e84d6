package com.example.cronscheduler.config;

import com.example.cronscheduler.domain.repository.RepeatableTriggerRepository;
import com.example.cronscheduler.domain.repository.TriggerDeliveryRepository;
import com.example.cronscheduler.service.executor.JobExecutionService;
import com.example.cronscheduler.service.queue.JpaTriggerQueue;
import com.example.cronscheduler.service.queue.TriggerQueue;
import com.example.cronscheduler.service.queue.TriggerWorker;
import com.example.cronscheduler.service.retention.ExecutionLogRetentionService;
import com.example.cronscheduler.service.schedule.CronExpressionEvaluator;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.UUID;

/**
 * Trigger queues and the workers consuming them.
 * <p>
 * Queues:
 * - cron-jobs: one repeatable trigger per active job, plus run-now deliveries
 * - maintenance: the daily execution log cleanup
 */
@Slf4j
@Configuration
public class TriggerQueueConfig {

    public static final String CRON_JOBS_QUEUE = "cron-jobs";
    public static final String MAINTENANCE_QUEUE = "maintenance";

    @Value("${HOSTNAME:unknown}")
    private String hostname;

    @Bean
    public TriggerQueue cronJobTriggerQueue(RepeatableTriggerRepository triggerRepository, TriggerDeliveryRepository deliveryRepository,
                                            CronExpressionEvaluator cronEvaluator, Clock clock, CronSchedulerProperties properties) {
        return new JpaTriggerQueue(CRON_JOBS_QUEUE, triggerRepository, deliveryRepository, cronEvaluator, clock,
                properties.getPromotionBatchSize());
    }

    @Bean
    public TriggerQueue maintenanceTriggerQueue(RepeatableTriggerRepository triggerRepository, TriggerDeliveryRepository deliveryRepository,
                                                CronExpressionEvaluator cronEvaluator, Clock clock, CronSchedulerProperties properties) {
        return new JpaTriggerQueue(MAINTENANCE_QUEUE, triggerRepository, deliveryRepository, cronEvaluator, clock,
                properties.getPromotionBatchSize());
    }

    /**
     * Global ceiling on job dispatches started per refresh period
     */
    @Bean
    public RateLimiter dispatchRateLimiter(CronSchedulerProperties properties) {
        var limit = properties.getWorker().getRateLimit();
        return RateLimiter.of("dispatch", RateLimiterConfig.custom()
                .limitForPeriod(limit.getLimitForPeriod())
                .limitRefreshPeriod(limit.getRefreshPeriod())
                .timeoutDuration(limit.getTimeout())
                .build());
    }

    @Bean
    public TriggerWorker cronJobWorker(@Qualifier("cronJobTriggerQueue") TriggerQueue queue, JobExecutionService jobExecutionService,
                                       RateLimiter dispatchRateLimiter, CronSchedulerProperties properties) {
        var worker = properties.getWorker();
        return new TriggerWorker(CRON_JOBS_QUEUE, queue, jobExecutionService, worker.getConcurrency(),
                worker.getRateLimit().isEnabled() ? dispatchRateLimiter : null, instanceId(), worker.getLease());
    }

    @Bean
    public TriggerWorker maintenanceWorker(@Qualifier("maintenanceTriggerQueue") TriggerQueue queue,
                                           ExecutionLogRetentionService retentionService, CronSchedulerProperties properties) {
        return new TriggerWorker(MAINTENANCE_QUEUE, queue, retentionService, 1, null, instanceId(),
                properties.getWorker().getLease());
    }

    /**
     * Unique worker id for this service instance
     */
    private String instanceId() {
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + ProcessHandle.current().pid();
        } catch (UnknownHostException e) {
            log.debug("Local host name unavailable, using HOSTNAME: {}", e.getMessage());
            return hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
