package com.programmersdiary.taskdaemon.recurrence;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum Frequency {
    SECONDLY(ChronoUnit.SECONDS),
    MINUTELY(ChronoUnit.MINUTES),
    HOURLY(ChronoUnit.HOURS),
    DAILY(ChronoUnit.DAYS),
    WEEKLY(ChronoUnit.WEEKS),
    ONCE(null);

    private static final Map<String, Frequency> ALIASES = Map.ofEntries(
            Map.entry("SECOND", SECONDLY),
            Map.entry("SECONDS", SECONDLY),
            Map.entry("SEC", SECONDLY),
            Map.entry("MINUTE", MINUTELY),
            Map.entry("MINUTES", MINUTELY),
            Map.entry("MIN", MINUTELY),
            Map.entry("HOUR", HOURLY),
            Map.entry("HOURS", HOURLY),
            Map.entry("DAY", DAILY),
            Map.entry("DAYS", DAILY),
            Map.entry("WEEK", WEEKLY),
            Map.entry("WEEKS", WEEKLY));

    private final ChronoUnit unit;

    Frequency(ChronoUnit unit) {
        this.unit = unit;
    }

    public Duration period(int interval) {
        if (unit == null) {
            throw new IllegalStateException("A one-shot frequency has no period");
        }
        return unit.getDuration().multipliedBy(interval);
    }

    public static Optional<Frequency> fromToken(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        var upper = token.trim().toUpperCase(Locale.ROOT);
        var alias = ALIASES.get(upper);
        if (alias != null) return Optional.of(alias);
        for (var frequency : values()) {
            if (frequency.name().equals(upper)) return Optional.of(frequency);
        }
        return Optional.empty();
    }
}
