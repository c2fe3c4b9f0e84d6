package com.example.cronscheduler.service.executor;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.ExecutionLog;
import com.example.cronscheduler.domain.enums.DeliveryKind;
import com.example.cronscheduler.domain.enums.TriggerSource;
import com.example.cronscheduler.domain.repository.CronJobRepository;
import com.example.cronscheduler.domain.repository.ExecutionLogRepository;
import com.example.cronscheduler.exception.DispatchTimeoutException;
import com.example.cronscheduler.service.alert.SlackAlertService;
import com.example.cronscheduler.service.dispatch.DispatchHandlerRegistry;
import com.example.cronscheduler.service.dispatch.DispatchResult;
import com.example.cronscheduler.service.dispatch.DispatchSnapshot;
import com.example.cronscheduler.service.queue.QueuedDelivery;
import com.example.cronscheduler.service.queue.TriggerConsumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Executes job firings delivered by the cron job queue.
 * <p>
 * Handles:
 * - Re-validating that the job still exists and is active
 * - Optional per-job lease so firings of one job never overlap
 * - Handler invocation with the live job definition
 * - Retry decision for transport failures (re-throw to let the queue redeliver)
 * - Execution logging, one record per firing
 * - Metrics recording and terminal failure alerts
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobExecutionService implements TriggerConsumer {

    private static final Duration LEASE_MARGIN = Duration.ofMinutes(1);

    private final CronJobRepository jobRepository;
    private final ExecutionLogRepository executionLogRepository;
    private final DispatchHandlerRegistry handlerRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final CronSchedulerProperties properties;
    private final LockProvider lockProvider;
    private final Clock clock;

    @Override
    public void consume(QueuedDelivery delivery) {
        execute(delivery);
    }

    /**
     * Execute one firing.
     *
     * @param delivery the claimed delivery
     * @return the execution log written, or empty if the firing was skipped
     * @throws RuntimeException the transport failure, when the firing has retries left
     */
    public Optional<ExecutionLog> execute(QueuedDelivery delivery) {
        var startedAt = clock.instant();

        UUID jobId;
        try {
            jobId = DispatchSnapshot.jobIdOf(delivery.payload());
        } catch (IllegalArgumentException e) {
            log.error("Delivery {} carries no usable job id, dropping it: {}", delivery.id(), e.getMessage());
            metricsConfig.recordSkipped("invalid_payload");
            return Optional.empty();
        }

        var job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Cron job {} not found, skipping", jobId);
            metricsConfig.recordSkipped("not_found");
            return Optional.empty();
        }

        if (!job.isActive()) {
            log.warn("Cron job {} is not active ({}), skipping", jobId, job.getStatus());
            metricsConfig.recordSkipped("not_active");
            return Optional.empty();
        }

        Optional<SimpleLock> lease = Optional.empty();
        if (properties.getWorker().isSerializePerJob()) {
            lease = acquireJobLease(job);
            if (lease.isEmpty()) {
                log.info("Cron job {} is still running a previous firing, skipping", jobId);
                metricsConfig.recordSkipped("overlap");
                return Optional.empty();
            }
        }

        try {
            return Optional.of(dispatch(job, delivery, startedAt));
        } finally {
            lease.ifPresent(SimpleLock::unlock);
        }
    }

    private ExecutionLog dispatch(CronJob job, QueuedDelivery delivery, Instant startedAt) {
        log.info("Processing cron job {} ({}), attempt {}", job.getId(), job.getTargetType(), delivery.attemptNumber());

        var timerSample = metricsConfig.startDispatchTimer();
        var terminalTransportFailure = false;
        DispatchResult result;

        try {
            var handler = handlerRegistry.getHandlerOrThrow(job.getTargetType());
            result = handler.dispatch(job);
        } catch (RuntimeException e) {
            var retryBudget = Math.min(job.getMaxRetries(), delivery.maxAttempts() - 1);
            if (delivery.attemptsMade() < retryBudget) {
                log.warn("Cron job {} attempt {} failed, {} retries left: {}",
                        job.getId(), delivery.attemptNumber(), retryBudget - delivery.attemptsMade(), e.getMessage());
                metricsConfig.recordDispatch(timerSample, job.getTargetType(), "retry");
                metricsConfig.recordRetry(job.getTargetType(), delivery.attemptNumber());
                throw e;
            }

            log.error("Cron job {} failed on final attempt {}: {}", job.getId(), delivery.attemptNumber(), e.getMessage());
            result = e instanceof DispatchTimeoutException ? DispatchResult.timeout(e.getMessage()) : DispatchResult.failure(e);
            terminalTransportFailure = true;
        }

        var finishedAt = clock.instant();
        var executionLog = executionLogRepository.save(ExecutionLog.builder()
                .jobId(job.getId())
                .status(result.getStatus())
                .triggerSource(delivery.kind() == DeliveryKind.ONCE ? TriggerSource.MANUAL : TriggerSource.SCHEDULED)
                .attemptNumber(delivery.attemptNumber())
                .responseCode(result.getResponseCode())
                .responseBody(ExecutionLog.truncateBody(result.getResponseBody()))
                .errorMessage(result.getErrorMessage())
                .errorType(result.getErrorType())
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .durationMs(Duration.between(startedAt, finishedAt).toMillis())
                .build());

        metricsConfig.recordDispatch(timerSample, job.getTargetType(), result.getStatus().getCode());
        if (terminalTransportFailure) {
            metricsConfig.recordTerminalFailure(job.getTargetType(), result.getErrorType());
            slackAlertService.sendDispatchFailureAlert(job, executionLog);
        }

        log.info("Cron job {} execution completed: status={}, responseCode={}, duration={}ms",
                job.getId(), executionLog.getStatus(), executionLog.getResponseCode(), executionLog.getDurationMs());
        return executionLog;
    }

    private Optional<SimpleLock> acquireJobLease(CronJob job) {
        var lockAtMostFor = Duration.ofMillis(job.getTimeoutMs()).plus(LEASE_MARGIN);
        return lockProvider.lock(new LockConfiguration(clock.instant(), "cron-job-" + job.getId(), lockAtMostFor, Duration.ZERO));
    }
}
