package com.example.cronscheduler.mapper;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.ExecutionLog;
import com.example.cronscheduler.dto.ExecutionLogResponse;
import com.example.cronscheduler.dto.JobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    /**
     * Convert CronJob entity to JobResponse DTO.
     * Schedule-derived fields are filled in by the service.
     */
    @Mapping(target = "cronDescription", ignore = true)
    @Mapping(target = "nextExecution", ignore = true)
    JobResponse toResponse(CronJob job);

    @Mapping(target = "jobName", ignore = true)
    ExecutionLogResponse toLogResponse(ExecutionLog log);
}
