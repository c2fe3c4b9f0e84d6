package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for a cron expression or timezone that cannot be evaluated
 */
@Getter
public class InvalidScheduleException extends RuntimeException {

    private final String cronExpression;
    private final String timezone;

    public InvalidScheduleException(String cronExpression, String timezone, String message) {
        super(message);
        this.cronExpression = cronExpression;
        this.timezone = timezone;
    }

    public InvalidScheduleException(String cronExpression, String timezone, String message, Throwable cause) {
        super(message, cause);
        this.cronExpression = cronExpression;
        this.timezone = timezone;
    }
}
