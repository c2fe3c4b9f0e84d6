package com.example.cronscheduler.controller;

import com.example.cronscheduler.dto.ApiResponse;
import com.example.cronscheduler.dto.ExecutionLogResponse;
import com.example.cronscheduler.dto.PagedResponse;
import com.example.cronscheduler.service.ExecutionLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/logs")
@Tag(name = "Execution Logs", description = "Execution history across the caller's jobs")
public class ExecutionLogController {

    private final ExecutionLogService executionLogService;

    @GetMapping
    @Operation(summary = "List executions", description = "Executions of all the caller's jobs, newest first")
    public ResponseEntity<ApiResponse<PagedResponse<ExecutionLogResponse>>> listUserExecutions(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Page number (0-based)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size, at most 100") @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(executionLogService.listUserExecutions(userId, page, size)));
    }

    @GetMapping("/{logId}")
    @Operation(summary = "Get execution by ID")
    public ResponseEntity<ApiResponse<ExecutionLogResponse>> getExecution(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "Execution log UUID") @PathVariable UUID logId) {

        return ResponseEntity.ok(ApiResponse.success(executionLogService.getExecutionById(userId, logId)));
    }
}
