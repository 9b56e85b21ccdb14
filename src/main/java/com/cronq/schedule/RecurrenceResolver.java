package com.cronq.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the next execution instant of a {@link ScheduleSpec}.
 * <p>
 * Constraints are applied in a fixed order and only ever move the candidate
 * forward in time:
 * <ol>
 *   <li>seed with the later of {@code now} and {@code startBoundary}</li>
 *   <li>skip dates, allowed weekdays, allowed days of month and allowed months,
 *       repeated until a full pass leaves the candidate unchanged</li>
 *   <li>the local time of day, moving to the next day when it would fall
 *       before the seed</li>
 *   <li>the end boundary, before any cron evaluation</li>
 *   <li>the cron expression, seeded with the candidate</li>
 * </ol>
 * An empty result means the schedule is exhausted. Instances hold no mutable
 * state and may be shared between threads.
 */
public class RecurrenceResolver {

    public static final int DEFAULT_MAX_SEARCH_YEARS = 4;

    private final CronExpressionEvaluator cronEvaluator;
    private final int maxSearchYears;

    public RecurrenceResolver() {
        this(new CronExpressionEvaluator(), DEFAULT_MAX_SEARCH_YEARS);
    }

    public RecurrenceResolver(CronExpressionEvaluator cronEvaluator, int maxSearchYears) {
        if (maxSearchYears < 1) {
            throw new IllegalArgumentException("maxSearchYears must be >= 1");
        }
        this.cronEvaluator = Objects.requireNonNull(cronEvaluator, "cronEvaluator");
        this.maxSearchYears = maxSearchYears;
    }

    /**
     * Resolves the first instant at or after {@code now} that satisfies the schedule.
     *
     * @return the instant, or empty when no occurrence remains before the end boundary
     * @throws ScheduleUnsatisfiableException if the constraints cannot be met within the search window
     */
    public Optional<Instant> resolveNext(ScheduleSpec schedule, Instant now) {
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(now, "now");

        ZoneId zone = schedule.timezone();
        Instant seedInstant = schedule.startBoundary() != null && schedule.startBoundary().isAfter(now)
                ? schedule.startBoundary()
                : now;
        ZonedDateTime seed = seedInstant.atZone(zone);
        ZonedDateTime limit = seed.plusYears(maxSearchYears);
        LocalDate lastAllowedDate = schedule.endBoundary() == null
                ? null
                : schedule.endBoundary().atZone(zone).toLocalDate();

        ZonedDateTime candidate = seed;
        while (true) {
            candidate = applyCalendarConstraints(schedule, candidate, limit, lastAllowedDate);
            if (candidate == null) {
                return Optional.empty();
            }
            if (schedule.time() == null) {
                break;
            }
            ZonedDateTime timed = candidate.with(schedule.time());
            if (!timed.isBefore(seed)) {
                candidate = timed;
                break;
            }
            candidate = timed.plusDays(1);
        }

        Instant resolved = candidate.toInstant();
        if (exceedsEnd(schedule, resolved)) {
            return Optional.empty();
        }
        if (schedule.cronExpression() == null) {
            return Optional.of(resolved);
        }

        Instant next = cronEvaluator.next(schedule.cronExpression(), resolved, zone);
        if (exceedsEnd(schedule, next)) {
            return Optional.empty();
        }
        return Optional.of(next);
    }

    /**
     * Resolves the occurrence that follows one which fired at {@code firedAt}.
     * One-shot schedules are exhausted once they fired. Otherwise the search
     * starts one {@code interval} after the fired occurrence, right after it for
     * cron schedules, or one day later for calendar and time-of-day rules,
     * but never before {@code now}.
     */
    public Optional<Instant> resolveFollowing(ScheduleSpec schedule, Instant firedAt, Instant now) {
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(firedAt, "firedAt");
        if (!schedule.isRecurring()) {
            return Optional.empty();
        }

        Instant base;
        if (schedule.interval() != null) {
            base = firedAt.plus(schedule.interval());
        } else if (schedule.cronExpression() != null) {
            base = firedAt;
        } else {
            base = firedAt.atZone(schedule.timezone()).plusDays(1).toInstant();
        }
        return resolveNext(schedule, base.isAfter(now) ? base : now);
    }

    private ZonedDateTime applyCalendarConstraints(
            ScheduleSpec schedule,
            ZonedDateTime start,
            ZonedDateTime limit,
            LocalDate lastAllowedDate) {
        ZonedDateTime candidate = start;
        boolean changed = true;
        while (changed) {
            changed = false;

            if (schedule.skipDates() != null && schedule.skipDates().contains(candidate.toLocalDate())) {
                candidate = candidate.plusDays(1);
                changed = true;
            }
            if (schedule.daysOfWeek() != null) {
                while (!schedule.daysOfWeek().contains(candidate.getDayOfWeek())) {
                    candidate = candidate.plusDays(1);
                    changed = true;
                }
            }
            if (schedule.daysOfMonth() != null) {
                while (!schedule.daysOfMonth().contains(candidate.getDayOfMonth())) {
                    candidate = candidate.plusDays(1);
                    changed = true;
                }
            }
            if (schedule.months() != null) {
                while (!schedule.months().contains(candidate.getMonth())) {
                    candidate = candidate.plusMonths(1);
                    changed = true;
                }
            }

            if (lastAllowedDate != null && candidate.toLocalDate().isAfter(lastAllowedDate)) {
                return null;
            }
            if (candidate.isAfter(limit)) {
                throw new ScheduleUnsatisfiableException("No date satisfies the schedule within "
                        + maxSearchYears + " years of " + start.toInstant());
            }
        }
        return candidate;
    }

    private boolean exceedsEnd(ScheduleSpec schedule, Instant instant) {
        return schedule.endBoundary() != null && instant.isAfter(schedule.endBoundary());
    }
}
