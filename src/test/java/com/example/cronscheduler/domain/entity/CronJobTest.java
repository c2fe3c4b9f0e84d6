package com.example.cronscheduler.domain.entity;

import com.example.cronscheduler.domain.enums.JobHttpMethod;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.domain.enums.TargetType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CronJob Entity Tests")
class CronJobTest {

    @Test
    @DisplayName("Builder should apply defaults")
    void builderShouldApplyDefaults() {
        var job = CronJob.builder()
                .ownerId("user-1")
                .name("Ping")
                .cronExpression("* * * * *")
                .targetType(TargetType.HTTP)
                .build();

        assertThat(job.getStatus()).isEqualTo(JobStatus.ACTIVE);
        assertThat(job.getTimezone()).isEqualTo("UTC");
        assertThat(job.getHttpMethod()).isEqualTo(JobHttpMethod.GET);
        assertThat(job.getTimeoutMs()).isEqualTo(30000);
        assertThat(job.getMaxRetries()).isEqualTo(3);
        assertThat(job.getHeaders()).isEmpty();
        assertThat(job.isActive()).isTrue();
    }

    @Test
    @DisplayName("Should check ownership")
    void shouldCheckOwnership() {
        var job = CronJob.builder().ownerId("user-1").build();

        assertThat(job.isOwnedBy("user-1")).isTrue();
        assertThat(job.isOwnedBy("user-2")).isFalse();
        assertThat(job.isOwnedBy(null)).isFalse();
    }

    @Test
    @DisplayName("Should truncate long response bodies")
    void shouldTruncateResponseBodies() {
        assertThat(ExecutionLog.truncateBody(null)).isNull();
        assertThat(ExecutionLog.truncateBody("short")).isEqualTo("short");
        assertThat(ExecutionLog.truncateBody("x".repeat(6000))).hasSize(ExecutionLog.RESPONSE_BODY_LIMIT);
    }
}
