package com.example.cronscheduler.service.schedule;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.domain.repository.CronJobRepository;
import com.example.cronscheduler.exception.InvalidScheduleException;
import com.example.cronscheduler.exception.TriggerQueueException;
import com.example.cronscheduler.service.dispatch.DispatchSnapshot;
import com.example.cronscheduler.service.queue.TriggerOptions;
import com.example.cronscheduler.service.queue.TriggerQueue;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Objects;

/**
 * Keeps the cron job queue's repeatable triggers in line with the job table.
 * <p>
 * A job has a repeatable trigger, keyed by its id, exactly while it is ACTIVE.
 * Every method joins the caller's transaction: a failed queue write rolls back
 * the job change that caused it. Removal always happens before add.
 */
@Slf4j
@Service
public class JobScheduleReconciler {

    static final String IMMEDIATE_KEY_PREFIX = "immediate-";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final TriggerQueue jobQueue;
    private final CronJobRepository jobRepository;
    private final CronExpressionEvaluator cronEvaluator;
    private final ObjectMapper objectMapper;

    public JobScheduleReconciler(@Qualifier("cronJobTriggerQueue") TriggerQueue jobQueue, CronJobRepository jobRepository,
                                 CronExpressionEvaluator cronEvaluator, ObjectMapper objectMapper) {
        this.jobQueue = jobQueue;
        this.jobRepository = jobRepository;
        this.cronEvaluator = cronEvaluator;
        this.objectMapper = objectMapper;
    }

    /**
     * Register the trigger of a newly created job
     *
     * @throws InvalidScheduleException if the cron expression or timezone is invalid
     */
    @Transactional
    public void onCreate(CronJob job) {
        cronEvaluator.validate(job.getCronExpression(), job.getTimezone());
        if (job.getStatus() == JobStatus.ACTIVE) {
            addTrigger(job);
        }
    }

    /**
     * Bring the trigger in line after a job update
     *
     * @param previous state of the job before the update was applied
     * @param job      the updated job
     */
    @Transactional
    public void onUpdate(JobState previous, CronJob job) {
        var wasActive = previous.status() == JobStatus.ACTIVE;
        var isActive = job.getStatus() == JobStatus.ACTIVE;

        if (isActive) {
            cronEvaluator.validate(job.getCronExpression(), job.getTimezone());
        }

        if (wasActive && !isActive) {
            removeTrigger(job);
        } else if (!wasActive && isActive) {
            // A stale trigger may survive a crash between two writes; clear it first
            removeTrigger(job);
            addTrigger(job);
        } else if (isActive && previous.differsFrom(job)) {
            removeTrigger(job);
            addTrigger(job);
        }
    }

    /**
     * Remove the job's trigger, then delete the job row
     */
    @Transactional
    public void onDelete(CronJob job) {
        removeTrigger(job);
        jobRepository.delete(job);
    }

    /**
     * Rebuild the repeatable trigger set from the ACTIVE jobs.
     * Running it twice leaves the same triggers as running it once.
     *
     * @return number of jobs scheduled
     */
    @Transactional
    public int reconcileAll() {
        var activeJobs = jobRepository.findByStatus(JobStatus.ACTIVE);

        try {
            for (var existing : jobQueue.listRepeatable()) {
                jobQueue.removeRepeatable(existing.key());
            }
        } catch (RuntimeException e) {
            throw new TriggerQueueException(jobQueue.getName(), null, "Failed to clear repeatable triggers: " + e.getMessage(), e);
        }

        var scheduled = 0;
        for (var job : activeJobs) {
            try {
                cronEvaluator.validate(job.getCronExpression(), job.getTimezone());
            } catch (InvalidScheduleException e) {
                log.error("Cron job {} has an invalid schedule '{}' ({}), not scheduling it: {}",
                        job.getId(), job.getCronExpression(), job.getTimezone(), e.getMessage());
                continue;
            }
            addTrigger(job);
            scheduled++;
        }

        log.info("Synced {} active jobs to queue {}", scheduled, jobQueue.getName());
        return scheduled;
    }

    /**
     * Enqueue a one-shot firing of the job, whatever its schedule
     */
    @Transactional
    public void runNow(CronJob job) {
        var key = IMMEDIATE_KEY_PREFIX + job.getId();
        try {
            jobQueue.addOnce(key, snapshotPayload(job), TriggerOptions.withRetries(job.getMaxRetries()));
        } catch (RuntimeException e) {
            throw new TriggerQueueException(jobQueue.getName(), key, "Failed to enqueue immediate run: " + e.getMessage(), e);
        }
        log.info("Cron job {} queued for immediate execution", job.getId());
    }

    private void addTrigger(CronJob job) {
        var key = triggerKey(job);
        try {
            jobQueue.addRepeatable(key, snapshotPayload(job), job.getCronExpression(), job.getTimezone(),
                    TriggerOptions.withRetries(job.getMaxRetries()));
        } catch (InvalidScheduleException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TriggerQueueException(jobQueue.getName(), key, "Failed to schedule job: " + e.getMessage(), e);
        }
        log.debug("Cron job {} scheduled with '{}' in {}", job.getId(), job.getCronExpression(), job.getTimezone());
    }

    private void removeTrigger(CronJob job) {
        var key = triggerKey(job);
        try {
            jobQueue.removeRepeatable(key);
        } catch (RuntimeException e) {
            throw new TriggerQueueException(jobQueue.getName(), key, "Failed to unschedule job: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> snapshotPayload(CronJob job) {
        return objectMapper.convertValue(DispatchSnapshot.of(job), PAYLOAD_TYPE);
    }

    static String triggerKey(CronJob job) {
        return job.getId().toString();
    }

    /**
     * The parts of a job that decide whether and how it is scheduled
     */
    public record JobState(JobStatus status, String cronExpression, String timezone, DispatchSnapshot snapshot) {

        public static JobState of(CronJob job) {
            return new JobState(job.getStatus(), job.getCronExpression(), job.getTimezone(), DispatchSnapshot.of(job));
        }

        boolean differsFrom(CronJob job) {
            return !Objects.equals(cronExpression, job.getCronExpression())
                    || !Objects.equals(timezone, job.getTimezone())
                    || snapshot.differsFrom(DispatchSnapshot.of(job));
        }
    }
}
