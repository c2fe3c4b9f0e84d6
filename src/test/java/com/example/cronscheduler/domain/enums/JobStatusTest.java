package com.example.cronscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Job enum Tests")
class JobStatusTest {

    @Test
    @DisplayName("Only active jobs should be scheduled")
    void onlyActiveJobsShouldBeScheduled() {
        assertThat(JobStatus.ACTIVE.isScheduled()).isTrue();
        assertThat(JobStatus.PAUSED.isScheduled()).isFalse();
    }

    @Test
    @DisplayName("Should find status by code")
    void shouldFindStatusByCode() {
        assertThat(JobStatus.fromCode("active")).isEqualTo(JobStatus.ACTIVE);
        assertThat(JobStatus.fromCode("paused")).isEqualTo(JobStatus.PAUSED);
    }

    @Test
    @DisplayName("Should throw for unknown status code")
    void shouldThrowForUnknownCode() {
        assertThatThrownBy(() -> JobStatus.fromCode("deleted"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown job status code");
    }

    @Test
    @DisplayName("Should find target type by code")
    void shouldFindTargetTypeByCode() {
        assertThat(TargetType.fromCode("http")).isEqualTo(TargetType.HTTP);
        assertThat(TargetType.fromCode("script")).isEqualTo(TargetType.SCRIPT);
        assertThatThrownBy(() -> TargetType.fromCode("ftp")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Failure execution statuses should be identified correctly")
    void failureStatusesShouldBeIdentified() {
        assertThat(ExecutionStatus.FAILED.isFailure()).isTrue();
        assertThat(ExecutionStatus.TIMEOUT.isFailure()).isTrue();

        assertThat(ExecutionStatus.SUCCESS.isFailure()).isFalse();
        assertThat(ExecutionStatus.RUNNING.isFailure()).isFalse();
    }

    @Test
    @DisplayName("Only POST, PUT and PATCH should carry a body")
    void bodyMethodsShouldBeIdentified() {
        assertThat(JobHttpMethod.POST.supportsBody()).isTrue();
        assertThat(JobHttpMethod.PUT.supportsBody()).isTrue();
        assertThat(JobHttpMethod.PATCH.supportsBody()).isTrue();

        assertThat(JobHttpMethod.GET.supportsBody()).isFalse();
        assertThat(JobHttpMethod.DELETE.supportsBody()).isFalse();
        assertThat(JobHttpMethod.DELETE.toHttpMethod()).isEqualTo(HttpMethod.DELETE);
    }
}
