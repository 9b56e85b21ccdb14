package com.cronq.schedule;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Recurrence rule of a cron job as stored in the job document.
 * All constraints are optional; a schedule without any of them describes a
 * single execution at {@code startBoundary} (or immediately).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleSpec(
        String cronExpression,
        @JsonAlias("startTime") Instant startBoundary,
        @JsonAlias("endTime") Instant endBoundary,
        Duration interval,
        Set<DayOfWeek> daysOfWeek,
        Set<Integer> daysOfMonth,
        Set<Month> months,
        Set<LocalDate> skipDates,
        ZoneId timezone,
        LocalTime time) {

    public ScheduleSpec {
        cronExpression = cronExpression == null || cronExpression.isBlank() ? null : cronExpression.trim();
        if (interval != null && (interval.isZero() || interval.isNegative())) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }
        daysOfWeek = copyOrNull(daysOfWeek);
        daysOfMonth = copyOrNull(daysOfMonth);
        months = copyOrNull(months);
        skipDates = copyOrNull(skipDates);
        if (daysOfMonth != null) {
            for (Integer day : daysOfMonth) {
                if (day == null || day < 1 || day > 31) {
                    throw new IllegalArgumentException("daysOfMonth entries must be within 1..31, got " + day);
                }
            }
        }
        if (timezone == null) {
            timezone = ZoneOffset.UTC;
        }
    }

    private static <T> Set<T> copyOrNull(Collection<T> values) {
        return values == null || values.isEmpty() ? null : Set.copyOf(values);
    }

    /**
     * Whether the schedule produces more than one occurrence.
     */
    @JsonIgnore
    public boolean isRecurring() {
        return cronExpression != null
                || time != null
                || interval != null
                || daysOfWeek != null
                || daysOfMonth != null
                || months != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String cronExpression;
        private Instant startBoundary;
        private Instant endBoundary;
        private Duration interval;
        private Set<DayOfWeek> daysOfWeek;
        private Set<Integer> daysOfMonth;
        private Set<Month> months;
        private Set<LocalDate> skipDates;
        private ZoneId timezone;
        private LocalTime time;

        private Builder() {
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder startBoundary(Instant startBoundary) {
            this.startBoundary = startBoundary;
            return this;
        }

        public Builder endBoundary(Instant endBoundary) {
            this.endBoundary = endBoundary;
            return this;
        }

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder daysOfWeek(DayOfWeek first, DayOfWeek... rest) {
            this.daysOfWeek = EnumSet.of(first, rest);
            return this;
        }

        public Builder daysOfMonth(Integer... days) {
            this.daysOfMonth = Set.of(days);
            return this;
        }

        public Builder months(Month first, Month... rest) {
            this.months = EnumSet.of(first, rest);
            return this;
        }

        public Builder skipDates(LocalDate... dates) {
            this.skipDates = Set.of(dates);
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = ZoneId.of(timezone);
            return this;
        }

        public Builder time(String time) {
            this.time = LocalTime.parse(time);
            return this;
        }

        public ScheduleSpec build() {
            return new ScheduleSpec(cronExpression, startBoundary, endBoundary, interval, daysOfWeek, daysOfMonth,
                    months, skipDates, timezone, time);
        }
    }
}
