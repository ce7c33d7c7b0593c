package com.programmersdiary.taskdaemon.recurrence;

import com.programmersdiary.taskdaemon.config.SchedulingSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

@Component
public class RecurrenceParser {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceParser.class);

    static final String PREFIX = "RRULE:";
    static final int DEFAULT_HOUR = 9;
    static final int DEFAULT_MINUTE = 0;

    private static final Map<String, DayOfWeek> WEEKDAYS = Map.ofEntries(
            Map.entry("MO", DayOfWeek.MONDAY), Map.entry("MON", DayOfWeek.MONDAY),
            Map.entry("MONDAY", DayOfWeek.MONDAY),
            Map.entry("TU", DayOfWeek.TUESDAY), Map.entry("TUE", DayOfWeek.TUESDAY),
            Map.entry("TUESDAY", DayOfWeek.TUESDAY),
            Map.entry("WE", DayOfWeek.WEDNESDAY), Map.entry("WED", DayOfWeek.WEDNESDAY),
            Map.entry("WEDNESDAY", DayOfWeek.WEDNESDAY),
            Map.entry("TH", DayOfWeek.THURSDAY), Map.entry("THU", DayOfWeek.THURSDAY),
            Map.entry("THURSDAY", DayOfWeek.THURSDAY),
            Map.entry("FR", DayOfWeek.FRIDAY), Map.entry("FRI", DayOfWeek.FRIDAY),
            Map.entry("FRIDAY", DayOfWeek.FRIDAY),
            Map.entry("SA", DayOfWeek.SATURDAY), Map.entry("SAT", DayOfWeek.SATURDAY),
            Map.entry("SATURDAY", DayOfWeek.SATURDAY),
            Map.entry("SU", DayOfWeek.SUNDAY), Map.entry("SUN", DayOfWeek.SUNDAY),
            Map.entry("SUNDAY", DayOfWeek.SUNDAY));

    private final Clock clock;
    private final SchedulingSettings settings;

    public RecurrenceParser(Clock clock, SchedulingSettings settings) {
        this.clock = clock;
        this.settings = settings;
    }

    public static String normalize(String rule) {
        if (rule == null || rule.isBlank()) return rule;
        var parts = qualifiers(rule);
        var joiner = new StringJoiner(";", PREFIX, "");
        parts.forEach((key, value) -> {
            if ("FREQ".equals(key)) {
                value = Frequency.fromToken(value).map(Frequency::name).orElse(value);
            }
            joiner.add(key + "=" + value);
        });
        return joiner.toString();
    }

    public ParseOutcome parse(String rule) {
        if (rule == null || rule.isBlank()) {
            return ParseOutcome.unparseable("Empty recurrence rule");
        }
        try {
            return parseQualifiers(qualifiers(normalize(rule)));
        } catch (RuntimeException e) {
            log.warn("Could not parse recurrence rule '{}': {}", rule, e.getMessage());
            return ParseOutcome.unparseable("Could not parse '" + rule.trim() + "': " + e.getMessage());
        }
    }

    private ParseOutcome parseQualifiers(Map<String, String> parts) {
        var freqToken = parts.get("FREQ");
        var frequency = Frequency.fromToken(freqToken);

        if (frequency.isPresent() && frequency.get() == Frequency.ONCE) {
            return parseOnce(parts.get("RUN_AT"));
        }

        if (parts.containsKey("BYHOUR") || parts.containsKey("BYMINUTE") || parts.containsKey("BYDAY")) {
            int hour = parts.containsKey("BYHOUR") ? parseInt("BYHOUR", parts.get("BYHOUR")) : DEFAULT_HOUR;
            int minute = parts.containsKey("BYMINUTE") ? parseInt("BYMINUTE", parts.get("BYMINUTE")) : DEFAULT_MINUTE;
            var days = parts.containsKey("BYDAY") ? parseWeekdays(parts.get("BYDAY")) : Set.<DayOfWeek>of();
            return ParseOutcome.of(new Trigger.Calendar(hour, minute, days));
        }

        int interval = parts.containsKey("INTERVAL") ? parseInt("INTERVAL", parts.get("INTERVAL")) : 1;
        if (interval < 1) {
            throw new IllegalArgumentException("INTERVAL must be >= 1, got " + interval);
        }
        if (frequency.isEmpty()) {
            var reason = freqToken == null
                    ? "No FREQ given, defaulting to hourly"
                    : "Unknown FREQ '" + freqToken + "', defaulting to hourly";
            return ParseOutcome.degraded(new Trigger.Interval(Frequency.HOURLY.period(1)), reason);
        }
        return ParseOutcome.of(new Trigger.Interval(frequency.get().period(interval)));
    }

    private ParseOutcome parseOnce(String runAt) {
        var now = clock.instant();
        var requested = parseRunAt(runAt);
        if (requested.isPresent() && requested.get().isAfter(now)) {
            return ParseOutcome.of(new Trigger.Once(requested.get()));
        }
        return ParseOutcome.of(new Trigger.Once(now.plus(settings.onceDelay())));
    }

    private Optional<Instant> parseRunAt(String runAt) {
        if (runAt == null || runAt.isBlank()) return Optional.empty();
        try {
            return Optional.of(OffsetDateTime.parse(runAt).toInstant());
        } catch (DateTimeParseException ignored) {
            // no offset, read it as wall-clock time in the configured zone
        }
        try {
            return Optional.of(LocalDateTime.parse(runAt).atZone(settings.zoneId()).toInstant());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unreadable RUN_AT '{}'", runAt);
            return Optional.empty();
        }
    }

    private static Set<DayOfWeek> parseWeekdays(String value) {
        var days = EnumSet.noneOf(DayOfWeek.class);
        for (var token : value.split(",")) {
            var trimmed = token.trim();
            if (trimmed.isEmpty() || "*".equals(trimmed)) continue;
            var day = WEEKDAYS.get(trimmed);
            if (day == null) {
                throw new IllegalArgumentException("Unknown weekday '" + trimmed + "'");
            }
            days.add(day);
        }
        return days;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: '" + value + "'");
        }
    }

    private static Map<String, String> qualifiers(String rule) {
        var body = rule.trim().toUpperCase(Locale.ROOT).replace("EVERYDAY", "");
        if (body.startsWith(PREFIX)) {
            body = body.substring(PREFIX.length());
        }
        var parts = new LinkedHashMap<String, String>();
        for (var kv : body.split(";")) {
            int eq = kv.indexOf('=');
            if (eq < 0) continue;
            var key = kv.substring(0, eq).trim();
            var value = kv.substring(eq + 1).trim();
            if (key.isEmpty() || "UNTIL".equals(key)) continue;
            parts.put(key, value);
        }
        return parts;
    }
}
