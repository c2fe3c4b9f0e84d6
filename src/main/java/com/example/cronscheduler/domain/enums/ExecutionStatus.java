package com.example.cronscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome recorded for a single execution attempt.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionStatus {

    /**
     * Target answered with a 2xx status.
     */
    SUCCESS("success", "Success"),

    /**
     * Target answered with a non-2xx status, or dispatch failed terminally.
     */
    FAILED("failed", "Failed"),

    /**
     * Reserved for attempts that are still in flight.
     * The executor writes records only once an attempt has finished.
     */
    RUNNING("running", "Running"),

    /**
     * The dispatch exceeded the job timeout and no retries were left.
     */
    TIMEOUT("timeout", "Timeout");

    private final String code;
    private final String displayName;

    /**
     * Check if this status indicates a failure condition
     */
    public boolean isFailure() {
        return this == FAILED || this == TIMEOUT;
    }
}
