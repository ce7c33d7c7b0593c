package com.programmersdiary.taskdaemon.recurrence;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public sealed interface Trigger permits Trigger.Once, Trigger.Interval, Trigger.Calendar {

    String describe();

    record Once(Instant at) implements Trigger {
        public Once {
            Objects.requireNonNull(at, "at");
        }

        @Override
        public String describe() {
            return "once at " + at;
        }
    }

    record Interval(Duration period) implements Trigger {
        public Interval {
            Objects.requireNonNull(period, "period");
            if (period.isZero() || period.isNegative()) {
                throw new IllegalArgumentException("period must be > 0");
            }
        }

        @Override
        public String describe() {
            return "every " + period;
        }
    }

    // empty weekdays means every day
    record Calendar(int hour, int minute, Set<DayOfWeek> weekdays) implements Trigger {
        public Calendar {
            if (hour < 0 || hour > 23) throw new IllegalArgumentException("hour must be 0-23");
            if (minute < 0 || minute > 59) throw new IllegalArgumentException("minute must be 0-59");
            weekdays = weekdays == null || weekdays.isEmpty()
                    ? Set.of()
                    : Set.copyOf(EnumSet.copyOf(weekdays));
        }

        public static Calendar daily(int hour, int minute) {
            return new Calendar(hour, minute, Set.of());
        }

        public static Calendar weekly(DayOfWeek day, int hour, int minute) {
            return new Calendar(hour, minute, Set.of(day));
        }

        public boolean anyDay() {
            return weekdays.isEmpty();
        }

        public String cronExpression() {
            var days = anyDay()
                    ? "*"
                    : EnumSet.copyOf(weekdays).stream()
                            .map(d -> d.name().substring(0, 3))
                            .collect(Collectors.joining(","));
            return "0 " + minute + " " + hour + " * * " + days;
        }

        @Override
        public String describe() {
            var time = String.format(Locale.ROOT, "%02d:%02d", hour, minute);
            if (anyDay()) return "daily at " + time;
            var days = EnumSet.copyOf(weekdays).stream()
                    .map(DayOfWeek::name)
                    .collect(Collectors.joining(","));
            return "at " + time + " on " + days;
        }
    }
}
