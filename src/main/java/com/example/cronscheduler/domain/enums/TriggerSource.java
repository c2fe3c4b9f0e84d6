package com.example.cronscheduler.domain.enums;

/**
 * What caused an execution attempt.
 */
public enum TriggerSource {
    /** Fired by the job's cron schedule */
    SCHEDULED,
    /** Fired by an explicit run-now request */
    MANUAL
}
