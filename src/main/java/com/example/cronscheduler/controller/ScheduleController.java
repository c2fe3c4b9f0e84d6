package com.example.cronscheduler.controller;

import com.example.cronscheduler.dto.ApiResponse;
import com.example.cronscheduler.dto.ScheduleDescriptionResponse;
import com.example.cronscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/schedules")
@Tag(name = "Schedules", description = "Cron expression previews")
public class ScheduleController {

    private final JobManagementService jobManagementService;

    @GetMapping("/describe")
    @Operation(summary = "Describe a cron expression", description = "Validate an expression and list its next 5 fire times")
    public ResponseEntity<ApiResponse<ScheduleDescriptionResponse>> describe(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "5- or 6-field cron expression") @RequestParam String cronExpression,
            @Parameter(description = "IANA timezone") @RequestParam(defaultValue = "UTC") String timezone) {

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.describeSchedule(cronExpression, timezone)));
    }
}
