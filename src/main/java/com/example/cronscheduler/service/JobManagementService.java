package com.example.cronscheduler.service;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.enums.JobHttpMethod;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.domain.repository.CronJobRepository;
import com.example.cronscheduler.dto.CreateJobRequest;
import com.example.cronscheduler.dto.JobResponse;
import com.example.cronscheduler.dto.PagedResponse;
import com.example.cronscheduler.dto.ScheduleDescriptionResponse;
import com.example.cronscheduler.dto.UpdateJobRequest;
import com.example.cronscheduler.exception.JobAccessDeniedException;
import com.example.cronscheduler.exception.JobNotFoundException;
import com.example.cronscheduler.mapper.JobMapper;
import com.example.cronscheduler.service.dispatch.DispatchHandlerRegistry;
import com.example.cronscheduler.service.schedule.CronExpressionEvaluator;
import com.example.cronscheduler.service.schedule.JobScheduleReconciler;
import com.example.cronscheduler.service.schedule.JobScheduleReconciler.JobState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashMap;
import java.util.UUID;

/**
 * Service for managing the lifecycle of cron jobs.
 * <p>
 * Provides:
 * - Job creation with schedule and target validation
 * - Owner-scoped retrieval and paging
 * - Partial updates, pause, resume and delete, each reconciled with the trigger queue
 * - Immediate runs outside the schedule
 * - Schedule previews
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    static final int PREVIEW_COUNT = 5;

    private final CronJobRepository jobRepository;
    private final JobScheduleReconciler reconciler;
    private final CronExpressionEvaluator cronEvaluator;
    private final DispatchHandlerRegistry handlerRegistry;
    private final JobMapper jobMapper;
    private final CronSchedulerProperties properties;
    private final Clock clock;

    // === Job Creation ===

    @Transactional
    public JobResponse createJob(String ownerId, CreateJobRequest request) {
        log.info("Creating cron job '{}' for user {}", request.getName(), ownerId);

        var job = CronJob.builder()
                .ownerId(ownerId)
                .name(request.getName().trim())
                .cronExpression(request.getCronExpression().trim())
                .timezone(normalizeTimezone(request.getTimezone()))
                .targetType(request.getTargetType())
                .targetUrl(request.getTargetUrl())
                .command(request.getCommand())
                .httpMethod(request.getHttpMethod() != null ? request.getHttpMethod() : JobHttpMethod.GET)
                .headers(request.getHeaders() != null ? new HashMap<>(request.getHeaders()) : new HashMap<>())
                .payload(request.getPayload() != null ? new HashMap<>(request.getPayload()) : null)
                .status(JobStatus.ACTIVE)
                .timeoutMs(request.getTimeoutMs() != null ? request.getTimeoutMs() : 30000)
                .maxRetries(request.getMaxRetries() != null ? request.getMaxRetries() : 3)
                .build();

        validateDefinition(job);

        job = jobRepository.save(job);
        reconciler.onCreate(job);

        log.info("Created cron job {} ({} {})", job.getId(), job.getCronExpression(), job.getTimezone());
        return toResponse(job);
    }

    // === Job Retrieval ===

    @Transactional(readOnly = true)
    public JobResponse getJob(String ownerId, UUID jobId) {
        return toResponse(getOwnedJob(ownerId, jobId));
    }

    /**
     * Jobs of the user, newest first
     */
    @Transactional(readOnly = true)
    public PagedResponse<JobResponse> listJobs(String ownerId, JobStatus status, int page, int size) {
        var pageable = PageRequest.of(Math.max(page, 0), clampPageSize(size), Sort.by(Sort.Direction.DESC, "createdAt"));

        var jobs = status != null
                ? jobRepository.findByOwnerIdAndStatus(ownerId, status, pageable)
                : jobRepository.findByOwnerId(ownerId, pageable);

        return PagedResponse.of(jobs.map(this::toResponse));
    }

    /**
     * Load a job and check that the caller owns it
     *
     * @throws JobNotFoundException     if the job does not exist
     * @throws JobAccessDeniedException if another user owns it
     */
    @Transactional(readOnly = true)
    public CronJob getOwnedJob(String ownerId, UUID jobId) {
        var job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (!job.isOwnedBy(ownerId)) {
            log.warn("User {} attempted to access cron job {} owned by another user", ownerId, jobId);
            throw new JobAccessDeniedException(jobId, ownerId);
        }
        return job;
    }

    // === Job Modification ===

    /**
     * Apply the non-null fields of the request
     */
    @Transactional
    public JobResponse updateJob(String ownerId, UUID jobId, UpdateJobRequest request) {
        var job = getOwnedJob(ownerId, jobId);
        var previous = JobState.of(job);

        if (request.getName() != null) {
            job.setName(request.getName().trim());
        }
        if (request.getCronExpression() != null) {
            job.setCronExpression(request.getCronExpression().trim());
        }
        if (request.getTimezone() != null) {
            job.setTimezone(normalizeTimezone(request.getTimezone()));
        }
        if (request.getTargetType() != null) {
            job.setTargetType(request.getTargetType());
        }
        if (request.getTargetUrl() != null) {
            job.setTargetUrl(request.getTargetUrl());
        }
        if (request.getCommand() != null) {
            job.setCommand(request.getCommand());
        }
        if (request.getHttpMethod() != null) {
            job.setHttpMethod(request.getHttpMethod());
        }
        if (request.getHeaders() != null) {
            job.setHeaders(new HashMap<>(request.getHeaders()));
        }
        if (request.getPayload() != null) {
            job.setPayload(new HashMap<>(request.getPayload()));
        }
        if (request.getStatus() != null) {
            job.setStatus(request.getStatus());
        }
        if (request.getTimeoutMs() != null) {
            job.setTimeoutMs(request.getTimeoutMs());
        }
        if (request.getMaxRetries() != null) {
            job.setMaxRetries(request.getMaxRetries());
        }

        validateDefinition(job);

        job = jobRepository.save(job);
        reconciler.onUpdate(previous, job);

        log.info("Updated cron job {}", jobId);
        return toResponse(job);
    }

    @Transactional
    public void deleteJob(String ownerId, UUID jobId) {
        var job = getOwnedJob(ownerId, jobId);
        reconciler.onDelete(job);
        log.info("Deleted cron job {}", jobId);
    }

    /**
     * Stop scheduling the job. Pausing a paused job changes nothing.
     */
    @Transactional
    public JobResponse pauseJob(String ownerId, UUID jobId) {
        return changeStatus(ownerId, jobId, JobStatus.PAUSED);
    }

    /**
     * Schedule the job again. Resuming an active job changes nothing.
     */
    @Transactional
    public JobResponse resumeJob(String ownerId, UUID jobId) {
        return changeStatus(ownerId, jobId, JobStatus.ACTIVE);
    }

    /**
     * Queue one firing now, outside the schedule
     */
    @Transactional
    public void runJobNow(String ownerId, UUID jobId) {
        var job = getOwnedJob(ownerId, jobId);
        reconciler.runNow(job);
    }

    // === Schedules ===

    public ScheduleDescriptionResponse describeSchedule(String cronExpression, String timezone) {
        var zone = normalizeTimezone(timezone);
        cronEvaluator.validate(cronExpression, zone);

        return ScheduleDescriptionResponse.builder()
                .cronExpression(cronExpression.trim())
                .timezone(zone)
                .description(cronEvaluator.describe(cronExpression))
                .nextExecutions(cronEvaluator.nextFireTimes(cronExpression, zone, clock.instant(), PREVIEW_COUNT))
                .build();
    }

    private JobResponse changeStatus(String ownerId, UUID jobId, JobStatus target) {
        var job = getOwnedJob(ownerId, jobId);
        if (job.getStatus() == target) {
            log.debug("Cron job {} already {}", jobId, target);
            return toResponse(job);
        }

        var previous = JobState.of(job);
        job.setStatus(target);
        job = jobRepository.save(job);
        reconciler.onUpdate(previous, job);

        log.info("Cron job {} is now {}", jobId, target);
        return toResponse(job);
    }

    private void validateDefinition(CronJob job) {
        cronEvaluator.validate(job.getCronExpression(), job.getTimezone());
        handlerRegistry.getHandlerOrThrow(job.getTargetType()).validate(job);
    }

    private JobResponse toResponse(CronJob job) {
        var response = jobMapper.toResponse(job);
        response.setCronDescription(cronEvaluator.describe(job.getCronExpression()));
        if (job.isActive()) {
            response.setNextExecution(cronEvaluator.nextFireTime(job.getCronExpression(), job.getTimezone(), clock.instant()).orElse(null));
        }
        return response;
    }

    private int clampPageSize(int size) {
        var api = properties.getApi();
        if (size <= 0) {
            return api.getDefaultPageSize();
        }
        return Math.min(size, api.getMaxPageSize());
    }

    private static String normalizeTimezone(String timezone) {
        return timezone == null || timezone.isBlank() ? CronExpressionEvaluator.DEFAULT_TIMEZONE : timezone.trim();
    }
}
