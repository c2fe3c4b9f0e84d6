package com.example.cronscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Job and execution statistics across all jobs of a user
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserStatistics {

    private JobCounts jobs;
    private ExecutionCounts executions;
    private List<ExecutionLogResponse> recentExecutions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobCounts {
        private long total;
        private long active;
        private long paused;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExecutionCounts {
        private long total;
        private long successful;
        private long failed;
        private double successRate;
    }
}
