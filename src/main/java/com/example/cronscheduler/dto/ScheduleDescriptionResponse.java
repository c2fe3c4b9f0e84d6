package com.example.cronscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDescriptionResponse {

    private String cronExpression;
    private String timezone;
    private String description;
    private List<Instant> nextExecutions;
}
