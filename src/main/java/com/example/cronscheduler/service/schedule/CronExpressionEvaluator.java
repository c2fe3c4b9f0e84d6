package com.example.cronscheduler.service.schedule;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.example.cronscheduler.exception.InvalidScheduleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses cron expressions and computes fire times in a job's timezone.
 * <p>
 * Accepts:
 * - 5 fields: minute hour day-of-month month day-of-week (Unix crontab)
 * - 6 fields: the same with a leading seconds field
 * <p>
 * Day-of-week takes 0-7 (0 and 7 are Sunday) or names. Fire times are
 * computed on the local wall clock of the timezone, so DST shifts move the
 * UTC instant rather than the local hour.
 */
@Slf4j
@Component
public class CronExpressionEvaluator {

    public static final String DEFAULT_TIMEZONE = "UTC";

    private static final CronDefinition UNIX = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);

    private static final CronDefinition UNIX_WITH_SECONDS = CronDefinitionBuilder.defineCron()
            .withSeconds().withStrictRange().and()
            .withMinutes().withStrictRange().and()
            .withHours().withStrictRange().and()
            .withDayOfMonth().withStrictRange().and()
            .withMonth().withStrictRange().and()
            .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).withIntMapping(7, 0).withStrictRange().and()
            .matchDayOfWeekAndDayOfMonth()
            .instance();

    private final CronParser fiveFieldParser = new CronParser(UNIX);
    private final CronParser sixFieldParser = new CronParser(UNIX_WITH_SECONDS);

    /**
     * Check that the expression parses and the timezone is a known IANA zone
     *
     * @throws InvalidScheduleException if either is invalid
     */
    public void validate(String expression, String timezone) {
        parse(expression, timezone);
        resolveZone(expression, timezone);
    }

    /**
     * Next fire instant strictly after {@code after}
     *
     * @return the instant, or empty if the rule never fires again
     */
    public Optional<Instant> nextFireTime(String expression, String timezone, Instant after) {
        var executionTime = ExecutionTime.forCron(parse(expression, timezone));
        var zone = resolveZone(expression, timezone);
        var reference = ZonedDateTime.ofInstant(after, zone);

        var next = executionTime.nextExecution(reference);
        while (next.isPresent() && !next.get().toInstant().isAfter(after)) {
            next = executionTime.nextExecution(next.get());
        }
        return next.map(ZonedDateTime::toInstant);
    }

    /**
     * Most recent fire instant strictly before {@code before}
     */
    public Optional<Instant> previousFireTime(String expression, String timezone, Instant before) {
        var executionTime = ExecutionTime.forCron(parse(expression, timezone));
        var zone = resolveZone(expression, timezone);

        var previous = executionTime.lastExecution(ZonedDateTime.ofInstant(before, zone));
        while (previous.isPresent() && !previous.get().toInstant().isBefore(before)) {
            previous = executionTime.lastExecution(previous.get());
        }
        return previous.map(ZonedDateTime::toInstant);
    }

    /**
     * Up to {@code count} consecutive fire instants after {@code after}
     */
    public List<Instant> nextFireTimes(String expression, String timezone, Instant after, int count) {
        var result = new ArrayList<Instant>(count);
        var cursor = after;
        for (var i = 0; i < count; i++) {
            var next = nextFireTime(expression, timezone, cursor);
            if (next.isEmpty()) {
                break;
            }
            result.add(next.get());
            cursor = next.get();
        }
        return result;
    }

    /**
     * English description of the expression; the raw expression if it cannot be described
     */
    public String describe(String expression) {
        var cron = parse(expression, null);
        try {
            return CronDescriptor.instance(Locale.UK).describe(cron);
        } catch (RuntimeException e) {
            log.debug("No description available for cron '{}': {}", expression, e.getMessage());
            return expression.trim();
        }
    }

    private Cron parse(String expression, String timezone) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(expression, timezone, "Invalid cron expression: expression is required");
        }

        var normalized = expression.trim();
        var fields = normalized.split("\\s+").length;
        var parser = switch (fields) {
            case 5 -> fiveFieldParser;
            case 6 -> sixFieldParser;
            default -> throw new InvalidScheduleException(expression, timezone,
                    "Invalid cron expression: expected 5 or 6 fields but found " + fields);
        };

        try {
            return parser.parse(normalized).validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, timezone, "Invalid cron expression: " + e.getMessage(), e);
        }
    }

    private ZoneId resolveZone(String expression, String timezone) {
        var zoneName = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone.trim();
        try {
            return ZoneId.of(zoneName);
        } catch (DateTimeException e) {
            throw new InvalidScheduleException(expression, timezone, "Invalid timezone: " + zoneName, e);
        }
    }
}
