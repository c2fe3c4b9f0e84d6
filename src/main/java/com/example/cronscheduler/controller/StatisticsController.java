package com.example.cronscheduler.controller;

import com.example.cronscheduler.dto.ApiResponse;
import com.example.cronscheduler.dto.UserStatistics;
import com.example.cronscheduler.service.ExecutionLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/stats")
@Tag(name = "Statistics", description = "Aggregate job and execution statistics")
public class StatisticsController {

    private final ExecutionLogService executionLogService;

    @GetMapping
    @Operation(summary = "Get user statistics", description = "Job counts, execution totals and the 10 most recent executions")
    public ResponseEntity<ApiResponse<UserStatistics>> getUserStatistics(@RequestHeader("X-User-Id") String userId) {
        return ResponseEntity.ok(ApiResponse.success(executionLogService.getUserStatistics(userId)));
    }
}
