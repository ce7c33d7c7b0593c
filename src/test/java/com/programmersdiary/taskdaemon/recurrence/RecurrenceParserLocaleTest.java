package com.programmersdiary.taskdaemon.recurrence;

import com.programmersdiary.taskdaemon.config.SchedulingSettings;
import com.programmersdiary.taskdaemon.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

// Turkish upper-cases 'i' to a dotted capital, which breaks naive token matching
class RecurrenceParserLocaleTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T04:30:00Z"), ZoneId.of("Asia/Kolkata"));
    private final RecurrenceParser parser = new RecurrenceParser(clock, SchedulingSettings.defaults("Asia/Kolkata"));
    private Locale previous;

    @BeforeEach
    void useTurkishLocale() {
        previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previous);
    }

    @Test
    void lowerCaseRuleParsesUnderTurkishLocale() {
        var outcome = parser.parse("rrule:freq=daily;interval=2");

        assertEquals(new Trigger.Interval(Duration.ofHours(48)), outcome.trigger().orElseThrow());
        assertTrue(outcome.fallbackReason().isEmpty());
    }

    @Test
    void lowerCaseAliasParsesUnderTurkishLocale() {
        var outcome = parser.parse("RRULE:FREQ=minutes;INTERVAL=5");

        assertEquals(new Trigger.Interval(Duration.ofMinutes(5)), outcome.trigger().orElseThrow());
        assertTrue(outcome.fallbackReason().isEmpty());
    }

    @Test
    void normalizeIsLocaleIndependent() {
        assertEquals("RRULE:FREQ=DAILY;INTERVAL=2", RecurrenceParser.normalize("rrule:freq=daily;interval=2"));
    }
}
