package com.example.cronscheduler.exception;

import com.example.cronscheduler.domain.enums.TargetType;
import lombok.Getter;

/**
 * Exception for a job whose target fields do not match its target type
 */
@Getter
public class TargetConfigurationException extends RuntimeException {

    private final TargetType targetType;

    public TargetConfigurationException(TargetType targetType, String message) {
        super(message);
        this.targetType = targetType;
    }
}
