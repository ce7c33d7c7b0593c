package com.programmersdiary.taskdaemon.recurrence;

import com.programmersdiary.taskdaemon.config.SchedulingSettings;
import com.programmersdiary.taskdaemon.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceParserTest {

    private static final Instant NOW = Instant.parse("2026-10-19T04:30:00Z");

    private final MutableClock clock = new MutableClock(NOW, ZoneId.of("Asia/Kolkata"));
    private final RecurrenceParser parser = new RecurrenceParser(clock, SchedulingSettings.defaults("Asia/Kolkata"));

    @Test
    void normalizeMapsAliasesAndAddsPrefix() {
        assertEquals("RRULE:FREQ=DAILY;INTERVAL=2", RecurrenceParser.normalize("RRULE:FREQ=DAY;INTERVAL=2"));
        assertEquals("RRULE:FREQ=MINUTELY;INTERVAL=5", RecurrenceParser.normalize("freq=minutes;interval=5"));
        assertEquals("RRULE:FREQ=MINUTELY", RecurrenceParser.normalize("FREQ=MINUTELY"));
    }

    @Test
    void normalizeDropsUntilAndEveryday() {
        assertEquals("RRULE:FREQ=HOURLY;INTERVAL=1",
                RecurrenceParser.normalize("RRULE:FREQ=HOURLY;UNTIL=20261231T000000Z;INTERVAL=1"));
        assertEquals("RRULE:FREQ=DAILY;BYHOUR=9", RecurrenceParser.normalize("RRULE:FREQ=DAILY;BYHOUR=9;EVERYDAY"));
    }

    @ParameterizedTest
    @CsvSource({
            "RRULE:FREQ=SECONDLY;INTERVAL=30, PT30S",
            "RRULE:FREQ=MINUTELY;INTERVAL=15, PT15M",
            "RRULE:FREQ=HOURLY;INTERVAL=2, PT2H",
            "RRULE:FREQ=DAILY;INTERVAL=1, PT24H",
            "RRULE:FREQ=WEEKLY;INTERVAL=2, PT336H",
            "RRULE:FREQ=HOURLY, PT1H",
            "rrule:freq=hours;interval=3, PT3H",
            "FREQ=MINUTE;INTERVAL=10, PT10M",
            "RRULE:FREQ=HOURLY;INTERVAL=2;UNTIL=20260101T000000Z, PT2H",
            "RRULE:FREQ=DAILY;COUNT=3;WKST=MO, PT24H"
    })
    void intervalRules(String rule, String period) {
        var outcome = parser.parse(rule);

        assertFalse(outcome.isFallback());
        assertEquals(new Trigger.Interval(Duration.parse(period)), outcome.trigger().orElseThrow());
    }

    @Test
    void byQualifiersYieldCalendarTrigger() {
        var outcome = parser.parse("RRULE:FREQ=WEEKLY;BYDAY=MO;BYHOUR=9;BYMINUTE=0");

        assertEquals(Trigger.Calendar.weekly(DayOfWeek.MONDAY, 9, 0), outcome.trigger().orElseThrow());
        assertFalse(outcome.isFallback());
    }

    @Test
    void missingCalendarFieldsTakeDefaults() {
        assertEquals(Trigger.Calendar.daily(18, 0), parser.parse("RRULE:FREQ=DAILY;BYHOUR=18").trigger().orElseThrow());
        assertEquals(Trigger.Calendar.daily(9, 30), parser.parse("RRULE:FREQ=DAILY;BYMINUTE=30").trigger().orElseThrow());
        assertEquals(Trigger.Calendar.weekly(DayOfWeek.FRIDAY, 9, 0),
                parser.parse("RRULE:FREQ=WEEKLY;BYDAY=FR").trigger().orElseThrow());
    }

    @Test
    void byDayAcceptsListsAndLongNames() {
        var trigger = parser.parse("RRULE:FREQ=WEEKLY;BYDAY=MO,WED,friday;BYHOUR=7;BYMINUTE=15").trigger().orElseThrow();

        assertEquals(new Trigger.Calendar(7, 15, Set.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY)),
                trigger);
    }

    @Test
    void byDayWildcardMeansEveryDay() {
        var trigger = (Trigger.Calendar) parser.parse("RRULE:FREQ=DAILY;BYDAY=*;BYHOUR=8").trigger().orElseThrow();

        assertTrue(trigger.anyDay());
    }

    @Test
    void onceWithoutRunAtFiresAfterDefaultDelay() {
        var outcome = parser.parse("RRULE:FREQ=ONCE");

        assertEquals(new Trigger.Once(NOW.plusSeconds(60)), outcome.trigger().orElseThrow());
        assertFalse(outcome.isFallback());
    }

    @Test
    void onceHonoursFutureRunAt() {
        var withOffset = parser.parse("RRULE:FREQ=ONCE;RUN_AT=2026-10-19T12:00:00+05:30");
        var localTime = parser.parse("RRULE:FREQ=ONCE;RUN_AT=2026-10-19T12:00:00");

        var expected = new Trigger.Once(Instant.parse("2026-10-19T06:30:00Z"));
        assertEquals(expected, withOffset.trigger().orElseThrow());
        assertEquals(expected, localTime.trigger().orElseThrow());
    }

    @Test
    void onceIgnoresPastOrUnreadableRunAt() {
        var past = parser.parse("RRULE:FREQ=ONCE;RUN_AT=2020-01-01T00:00:00Z");
        var garbage = parser.parse("RRULE:FREQ=ONCE;RUN_AT=tomorrow");

        assertEquals(new Trigger.Once(NOW.plusSeconds(60)), past.trigger().orElseThrow());
        assertEquals(new Trigger.Once(NOW.plusSeconds(60)), garbage.trigger().orElseThrow());
    }

    @Test
    void unknownFrequencyDegradesToHourly() {
        var outcome = parser.parse("RRULE:FREQ=FORTNIGHTLY;INTERVAL=3");

        assertEquals(new Trigger.Interval(Duration.ofHours(1)), outcome.trigger().orElseThrow());
        assertTrue(outcome.fallbackReason().orElseThrow().contains("FORTNIGHTLY"));
    }

    @Test
    void missingFrequencyDegradesToHourly() {
        var outcome = parser.parse("RRULE:INTERVAL=4");

        assertEquals(new Trigger.Interval(Duration.ofHours(1)), outcome.trigger().orElseThrow());
        assertTrue(outcome.isFallback());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "   ",
            "RRULE:FREQ=DAILY;INTERVAL=abc",
            "RRULE:FREQ=DAILY;INTERVAL=0",
            "RRULE:FREQ=HOURLY;INTERVAL=-2",
            "RRULE:FREQ=DAILY;BYHOUR=25",
            "RRULE:FREQ=DAILY;BYMINUTE=75",
            "RRULE:FREQ=WEEKLY;BYDAY=XX",
            "RRULE:FREQ=DAILY;BYHOUR=nine"
    })
    void malformedRulesAreUnparseableNotExceptions(String rule) {
        var outcome = assertDoesNotThrow(() -> parser.parse(rule));

        assertTrue(outcome.trigger().isEmpty());
        assertTrue(outcome.fallbackReason().isPresent());
    }

    @Test
    void textWithoutQualifiersDegradesInsteadOfFailing() {
        var outcome = parser.parse("remind me sometime");

        assertEquals(new Trigger.Interval(Duration.ofHours(1)), outcome.trigger().orElseThrow());
        assertTrue(outcome.isFallback());
    }
}
