package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Dispatch did not complete within the job timeout
 */
@Getter
public class DispatchTimeoutException extends RuntimeException {

    private final long timeoutMs;

    public DispatchTimeoutException(long timeoutMs, Throwable cause) {
        super("Request timed out after " + timeoutMs + "ms", cause);
        this.timeoutMs = timeoutMs;
    }
}
