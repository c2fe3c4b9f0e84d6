package com.example.cronscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for job not found
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Cron job not found: " + jobId);
        this.jobId = jobId;
    }
}
