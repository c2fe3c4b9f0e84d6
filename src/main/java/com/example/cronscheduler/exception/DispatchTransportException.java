package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Dispatch failed before any response was received (connection refused, DNS, I/O)
 */
@Getter
public class DispatchTransportException extends RuntimeException {

    private final String target;

    public DispatchTransportException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }
}
