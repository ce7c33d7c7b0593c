package com.programmersdiary.taskdaemon.command;

import com.programmersdiary.taskdaemon.config.SchedulingSettings;
import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import com.programmersdiary.taskdaemon.task.TaskRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class ScheduleCommandParser {

    private static final Pattern ORDER_RECURRING = Pattern.compile(
            "every\\s*(\\d+)?\\s*(second|seconds|minute|minutes|hour|hours|day|days|week|weeks)\\b");
    private static final Pattern ORDER_ONCE = Pattern.compile(
            "\\bin\\s+(\\d+)\\s*(second|seconds|minute|minutes|hour|hours)\\b");
    private static final Pattern REMINDER = Pattern.compile(
            "(?<action>.+?)\\s+every\\s+(?<num>\\d+)\\s*(?<unit>second|seconds|minute|minutes|hour|hours|day|days)\\b");
    private static final Pattern DAILY_DIGEST = Pattern.compile(
            "every\\s+day\\s+at\\s+(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?");
    private static final Pattern WEEKLY_DIGEST = Pattern.compile(
            "(?:every|weekly)\\s*(?:week)?(?:\\s*on)?\\s*"
                    + "(mon|monday|tue|tuesday|wed|wednesday|thu|thursday|fri|friday|sat|saturday|sun|sunday)\\b"
                    + "\\s*(?:at\\s*(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?)?");

    private static final Map<String, String> WEEKDAY_CODES = Map.ofEntries(
            Map.entry("monday", "MO"), Map.entry("mon", "MO"),
            Map.entry("tuesday", "TU"), Map.entry("tue", "TU"),
            Map.entry("wednesday", "WE"), Map.entry("wed", "WE"),
            Map.entry("thursday", "TH"), Map.entry("thu", "TH"),
            Map.entry("friday", "FR"), Map.entry("fri", "FR"),
            Map.entry("saturday", "SA"), Map.entry("sat", "SA"),
            Map.entry("sunday", "SU"), Map.entry("sun", "SU"));

    private final Clock clock;
    private final SchedulingSettings settings;

    public ScheduleCommandParser(Clock clock, SchedulingSettings settings) {
        this.clock = clock;
        this.settings = settings;
    }

    public Optional<TaskRequest> parse(String chatId, String text) {
        if (chatId == null || chatId.isBlank() || text == null || text.isBlank()) {
            return Optional.empty();
        }
        var trimmed = text.trim();
        var lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("/emailsummary")) {
            return parseEmailSummary(chatId, lower);
        }
        if (lower.startsWith("/remind")) {
            var parts = trimmed.split("\\s+", 2);
            if (parts.length < 2) return Optional.empty();
            return parseRemind(chatId, parts[1].trim());
        }
        return Optional.empty();
    }

    private Optional<TaskRequest> parseRemind(String chatId, String original) {
        var lower = original.toLowerCase(Locale.ROOT);
        if (lower.contains("order") && lower.contains(" from ")) {
            return parseOrder(chatId, original, lower);
        }
        var m = REMINDER.matcher(lower);
        if (!m.find()) return Optional.empty();
        var action = m.group("action").trim();
        var rule = intervalRule(Integer.parseInt(m.group("num")), m.group("unit"));
        return Optional.of(new TaskRequest(null, rule, new TaskAction.SendMessage(chatId, capitalize(action))));
    }

    private Optional<TaskRequest> parseOrder(String chatId, String original, String lower) {
        int idx = lower.lastIndexOf(" from ");
        var itemPart = original.substring(0, idx).replaceFirst("(?i)order", "").trim();
        var storePart = original.substring(idx + " from ".length()).trim();
        if (storePart.isEmpty()) return Optional.empty();

        var recurring = ORDER_RECURRING.matcher(lower);
        if (recurring.find()) {
            int num = recurring.group(1) != null ? Integer.parseInt(recurring.group(1)) : 1;
            var item = stripSchedule(itemPart, ORDER_RECURRING);
            var rule = intervalRule(num, recurring.group(2));
            return Optional.of(new TaskRequest(null, rule, new TaskAction.PlaceOrder(chatId, storePart, item)));
        }

        var once = ORDER_ONCE.matcher(lower);
        if (once.find()) {
            int num = Integer.parseInt(once.group(1));
            var delay = unitDuration(once.group(2)).multipliedBy(num);
            var runAt = clock.instant().plus(delay).atZone(settings.zoneId()).toOffsetDateTime();
            var item = stripSchedule(itemPart, ORDER_ONCE);
            var rule = "RRULE:FREQ=ONCE;RUN_AT=" + runAt;
            return Optional.of(new TaskRequest(null, rule, new TaskAction.PlaceOrder(chatId, storePart, item)));
        }

        // no schedule given: order as soon as the one-shot delay allows
        return Optional.of(new TaskRequest(null, "RRULE:FREQ=ONCE",
                new TaskAction.PlaceOrder(chatId, storePart, itemPart)));
    }

    private Optional<TaskRequest> parseEmailSummary(String chatId, String lower) {
        var daily = DAILY_DIGEST.matcher(lower);
        if (daily.find()) {
            int hour = to24h(Integer.parseInt(daily.group(1)), daily.group(3));
            int minute = daily.group(2) != null ? Integer.parseInt(daily.group(2)) : 0;
            var rule = "RRULE:FREQ=DAILY;BYHOUR=" + hour + ";BYMINUTE=" + minute;
            return Optional.of(new TaskRequest(null, rule,
                    new TaskAction.EmailSummary(chatId, TaskAction.EmailSummary.DEFAULT_MAX_RESULTS)));
        }
        var weekly = WEEKLY_DIGEST.matcher(lower);
        if (weekly.find()) {
            var day = WEEKDAY_CODES.get(weekly.group(1));
            int hour = weekly.group(2) != null ? to24h(Integer.parseInt(weekly.group(2)), weekly.group(4)) : 9;
            int minute = weekly.group(3) != null ? Integer.parseInt(weekly.group(3)) : 0;
            var rule = "RRULE:FREQ=WEEKLY;BYDAY=" + day + ";BYHOUR=" + hour + ";BYMINUTE=" + minute;
            return Optional.of(new TaskRequest(null, rule,
                    new TaskAction.EmailSummary(chatId, TaskAction.EmailSummary.DEFAULT_MAX_RESULTS)));
        }
        return Optional.empty();
    }

    private static String intervalRule(int num, String unit) {
        String freq;
        if (unit.startsWith("second")) freq = "SECONDLY";
        else if (unit.startsWith("minute")) freq = "MINUTELY";
        else if (unit.startsWith("hour")) freq = "HOURLY";
        else if (unit.startsWith("day")) freq = "DAILY";
        else freq = "WEEKLY";
        return "RRULE:FREQ=" + freq + ";INTERVAL=" + Math.max(1, num);
    }

    private static Duration unitDuration(String unit) {
        if (unit.startsWith("second")) return Duration.ofSeconds(1);
        if (unit.startsWith("minute")) return Duration.ofMinutes(1);
        return Duration.ofHours(1);
    }

    private static int to24h(int hour, String amPm) {
        if ("pm".equals(amPm) && hour < 12) return hour + 12;
        if ("am".equals(amPm) && hour == 12) return 0;
        return hour;
    }

    private static String stripSchedule(String item, Pattern schedule) {
        Matcher m = schedule.matcher(item.toLowerCase(Locale.ROOT));
        if (!m.find()) return item;
        return (item.substring(0, m.start()) + item.substring(m.end())).trim().replaceAll("\\s{2,}", " ");
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
