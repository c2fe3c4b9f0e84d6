package com.example.cronscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle status of a cron job definition.
 * <p>
 * A job holds a repeatable trigger in the queue exactly while it is {@link #ACTIVE}.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    /**
     * Job fires on its cron schedule.
     * Initial state for all new jobs.
     */
    ACTIVE("active", "Active", true),

    /**
     * Job is kept but does not fire until resumed.
     */
    PAUSED("paused", "Paused", false);

    private final String code;
    private final String displayName;

    /**
     * Indicates whether a job in this status is scheduled in the trigger queue
     */
    private final boolean scheduled;

    /**
     * Find JobStatus by its code value
     */
    public static JobStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status code: " + code);
    }
}
