package com.example.cronscheduler.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class ExecutionLogNotFoundException extends RuntimeException {

    private final UUID logId;

    public ExecutionLogNotFoundException(UUID logId) {
        super("Execution log not found: " + logId);
        this.logId = logId;
    }
}
