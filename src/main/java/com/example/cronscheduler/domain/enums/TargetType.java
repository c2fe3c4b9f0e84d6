package com.example.cronscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Defines what a job does when it fires.
 * Each target type maps to a specific dispatch handler implementation.
 */
@Getter
@RequiredArgsConstructor
public enum TargetType {

    /**
     * Call an HTTP endpoint; requires a target URL
     */
    HTTP("http", "HTTP Callback"),

    /**
     * Run a command; requires a command string. Execution is disabled.
     */
    SCRIPT("script", "Script");

    private final String code;
    private final String displayName;

    public static TargetType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown target type code: " + code);
    }
}
