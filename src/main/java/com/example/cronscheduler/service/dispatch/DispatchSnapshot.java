package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.enums.JobHttpMethod;
import com.example.cronscheduler.domain.enums.TargetType;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Copy of a job's dispatch settings stored in its triggers.
 * <p>
 * Workers re-read the job before dispatching and use the live row;
 * the snapshot identifies the job and records what was scheduled.
 */
public record DispatchSnapshot(
        UUID jobId,
        TargetType targetType,
        String targetUrl,
        String command,
        JobHttpMethod httpMethod,
        Map<String, String> headers,
        Map<String, Object> payload,
        Integer timeoutMs,
        Integer maxRetries) {

    public static final String JOB_ID_KEY = "jobId";

    public static DispatchSnapshot of(CronJob job) {
        return new DispatchSnapshot(job.getId(), job.getTargetType(), job.getTargetUrl(), job.getCommand(),
                job.getHttpMethod(), copy(job.getHeaders()), copy(job.getPayload()), job.getTimeoutMs(), job.getMaxRetries());
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null ? null : new HashMap<>(source);
    }

    /**
     * Job identifier stored in a trigger payload
     *
     * @throws IllegalArgumentException if the payload carries no valid job id
     */
    public static UUID jobIdOf(Map<String, Object> triggerPayload) {
        var raw = triggerPayload != null ? triggerPayload.get(JOB_ID_KEY) : null;
        if (raw == null) {
            throw new IllegalArgumentException("Trigger payload has no " + JOB_ID_KEY);
        }
        return raw instanceof UUID uuid ? uuid : UUID.fromString(raw.toString());
    }

    /**
     * Whether a job change alters what its trigger would dispatch
     */
    public boolean differsFrom(DispatchSnapshot other) {
        return !Objects.equals(this, other);
    }
}
