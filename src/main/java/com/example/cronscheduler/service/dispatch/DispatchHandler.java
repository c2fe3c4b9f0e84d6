package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.enums.TargetType;
import com.example.cronscheduler.exception.TargetConfigurationException;

/**
 * Interface for dispatch handlers.
 * <p>
 * Each target type has one handler that knows how to reach that kind of target.
 * <p>
 * Handlers should:
 * - Be stateless
 * - Return a result for every attempt the target answered, whatever the status
 * - Throw DispatchTimeoutException or DispatchTransportException when it did not
 * - Not manage transactions or retries (handled by the executor and the queue)
 */
public interface DispatchHandler {

    TargetType getTargetType();

    /**
     * Dispatch one firing of the job
     */
    DispatchResult dispatch(CronJob job);

    default boolean supports(TargetType targetType) {
        return getTargetType() == targetType;
    }

    /**
     * Check the target fields of a job definition
     *
     * @throws TargetConfigurationException if the job cannot be dispatched by this handler
     */
    void validate(CronJob job);
}
