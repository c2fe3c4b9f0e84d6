package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.enums.TargetType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DispatchSnapshot Tests")
class DispatchSnapshotTest {

    @Test
    @DisplayName("Should read the job id from a trigger payload")
    void shouldReadJobId() {
        var jobId = UUID.randomUUID();

        assertThat(DispatchSnapshot.jobIdOf(Map.of("jobId", jobId.toString()))).isEqualTo(jobId);
        assertThat(DispatchSnapshot.jobIdOf(Map.of("jobId", jobId))).isEqualTo(jobId);
    }

    @Test
    @DisplayName("Should reject payloads without a usable job id")
    void shouldRejectPayloadsWithoutJobId() {
        assertThatThrownBy(() -> DispatchSnapshot.jobIdOf(Map.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DispatchSnapshot.jobIdOf(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DispatchSnapshot.jobIdOf(Map.of("jobId", "42"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should not share header maps with the job")
    void shouldCopyHeaders() {
        // Given
        var headers = new HashMap<String, String>();
        headers.put("Authorization", "Bearer a");
        var job = CronJob.builder().id(UUID.randomUUID()).targetType(TargetType.HTTP).headers(headers).build();
        var snapshot = DispatchSnapshot.of(job);

        // When
        headers.put("Authorization", "Bearer b");

        // Then
        assertThat(snapshot.headers()).containsEntry("Authorization", "Bearer a");
        assertThat(snapshot.differsFrom(DispatchSnapshot.of(job))).isTrue();
    }
}
