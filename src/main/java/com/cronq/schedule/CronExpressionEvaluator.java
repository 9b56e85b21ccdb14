package com.cronq.schedule;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates cron expressions. Accepts the classic five-field form
 * ({@code minute hour day-of-month month day-of-week}), Spring's six-field form
 * with a leading seconds field and macros such as {@code @daily}.
 */
public class CronExpressionEvaluator {

    private final Map<String, CronExpression> parsed = new ConcurrentHashMap<>();

    /**
     * Returns the first instant strictly after {@code after} matching the
     * expression in the given zone.
     *
     * @throws ScheduleUnsatisfiableException if the expression is invalid or never fires
     */
    public Instant next(String expression, Instant after, ZoneId zone) {
        CronExpression cron = parse(expression);
        ZonedDateTime next = cron.next(after.atZone(zone));
        if (next == null) {
            throw new ScheduleUnsatisfiableException("Cron expression '" + expression + "' has no future occurrence");
        }
        return next.toInstant();
    }

    public boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ScheduleUnsatisfiableException e) {
            return false;
        }
    }

    private CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleUnsatisfiableException("Cron expression must not be blank");
        }
        String normalized = normalize(expression);
        CronExpression cached = parsed.get(normalized);
        if (cached != null) {
            return cached;
        }
        try {
            CronExpression cron = CronExpression.parse(normalized);
            parsed.putIfAbsent(normalized, cron);
            return cron;
        } catch (IllegalArgumentException e) {
            throw new ScheduleUnsatisfiableException("Invalid cron expression '" + expression + "'", e);
        }
    }

    static String normalize(String expression) {
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        // Five fields carry no seconds; fire at second zero.
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        return trimmed;
    }
}
