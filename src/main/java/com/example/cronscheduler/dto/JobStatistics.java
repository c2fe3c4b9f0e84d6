package com.example.cronscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Execution statistics for one job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatistics {

    private UUID jobId;
    private long totalExecutions;
    private long successfulExecutions;
    private long failedExecutions;

    /**
     * Percentage of successful executions, two decimals
     */
    private double successRate;

    /**
     * Rounded average duration; null when the job never ran
     */
    private Long averageDurationMs;

    private List<ExecutionLogResponse> recentExecutions;
}
