package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for a trigger queue write that failed while reconciling a job.
 * Propagates so the surrounding job mutation rolls back.
 */
@Getter
public class TriggerQueueException extends RuntimeException {

    private final String queueName;
    private final String triggerKey;

    public TriggerQueueException(String queueName, String triggerKey, String message, Throwable cause) {
        super(message, cause);
        this.queueName = queueName;
        this.triggerKey = triggerKey;
    }
}
