package com.example.cronscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a caller touching a job owned by someone else
 */
@Getter
public class JobAccessDeniedException extends RuntimeException {

    private final UUID jobId;
    private final String userId;

    public JobAccessDeniedException(UUID jobId, String userId) {
        super("Access denied to cron job: " + jobId);
        this.jobId = jobId;
        this.userId = userId;
    }
}
