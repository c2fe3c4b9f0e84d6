package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.domain.entity.ExecutionLog;
import com.example.cronscheduler.domain.enums.ExecutionStatus;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one completed dispatch.
 * <p>
 * Contains everything the executor writes into the execution log.
 * Transport failures are not results: handlers throw for those.
 */
@Data
@Builder
public class DispatchResult {

    private ExecutionStatus status;

    /**
     * HTTP status code if applicable
     */
    private Integer responseCode;

    /**
     * Response body, already truncated to the stored limit
     */
    private String responseBody;

    private String errorMessage;

    /**
     * Error type/classification for analysis
     */
    private String errorType;

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    /**
     * Result for a target that answered; 2xx is success, any other status a failed attempt
     */
    public static DispatchResult fromResponse(int statusCode, String body) {
        var success = statusCode >= 200 && statusCode < 300;
        return DispatchResult.builder()
                .status(success ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED)
                .responseCode(statusCode)
                .responseBody(ExecutionLog.truncateBody(body))
                .errorMessage(success ? null : "Target responded with HTTP " + statusCode)
                .errorType(success ? null : "HTTP_" + statusCode)
                .build();
    }

    /**
     * Terminal failure with no response from the target
     */
    public static DispatchResult failure(String errorMessage, String errorType) {
        return DispatchResult.builder()
                .status(ExecutionStatus.FAILED)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    /**
     * Terminal failure from an exception
     */
    public static DispatchResult failure(Throwable e) {
        return failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e.getClass().getSimpleName());
    }

    /**
     * Deadline exceeded and no retries left
     */
    public static DispatchResult timeout(String errorMessage) {
        return DispatchResult.builder()
                .status(ExecutionStatus.TIMEOUT)
                .errorMessage(errorMessage)
                .errorType("TIMEOUT")
                .build();
    }
}
