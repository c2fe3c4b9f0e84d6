package com.example.cronscheduler.service.queue;

import java.time.Instant;
import java.util.Map;

public record RepeatableTriggerView(
        String key,
        String cronExpression,
        String timezone,
        Instant nextFireAt,
        Map<String, Object> payload,
        int maxAttempts) {
}
