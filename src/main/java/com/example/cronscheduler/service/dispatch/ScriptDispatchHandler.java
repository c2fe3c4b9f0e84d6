package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.enums.ExecutionStatus;
import com.example.cronscheduler.domain.enums.TargetType;
import com.example.cronscheduler.exception.TargetConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handler for script jobs.
 * <p>
 * Commands are never executed. Every firing is recorded as a failed attempt
 * so the job's history shows why nothing ran.
 */
@Slf4j
@Component
public class ScriptDispatchHandler implements DispatchHandler {

    static final String DISABLED_MESSAGE = "Script execution is disabled for security reasons";
    static final String NOT_IMPLEMENTED_ERROR = "Script execution not implemented";

    public static final int MAX_COMMAND_LENGTH = 1000;

    @Override
    public TargetType getTargetType() {
        return TargetType.SCRIPT;
    }

    @Override
    public DispatchResult dispatch(CronJob job) {
        log.warn("Script execution is disabled, job {} command not run: {}", job.getId(), job.getCommand());

        return DispatchResult.builder()
                .status(ExecutionStatus.FAILED)
                .responseBody(DISABLED_MESSAGE)
                .errorMessage(NOT_IMPLEMENTED_ERROR)
                .errorType("SCRIPT_DISABLED")
                .build();
    }

    @Override
    public void validate(CronJob job) {
        var command = job.getCommand();
        if (command == null || command.isBlank()) {
            throw new TargetConfigurationException(TargetType.SCRIPT, "Command is required for SCRIPT jobs");
        }
        if (command.length() > MAX_COMMAND_LENGTH) {
            throw new TargetConfigurationException(TargetType.SCRIPT, "Command must not exceed " + MAX_COMMAND_LENGTH + " characters");
        }
    }
}
