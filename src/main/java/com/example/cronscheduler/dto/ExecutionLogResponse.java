package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.ExecutionStatus;
import com.example.cronscheduler.domain.enums.TriggerSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for execution log entries
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLogResponse {

    private UUID id;
    private UUID jobId;

    /**
     * Name of the job, filled in for cross-job listings
     */
    private String jobName;

    private ExecutionStatus status;
    private TriggerSource triggerSource;
    private Integer attemptNumber;
    private Integer responseCode;
    private String responseBody;
    private String errorMessage;
    private String errorType;
    private Instant startedAt;
    private Instant finishedAt;
    private Long durationMs;
}
