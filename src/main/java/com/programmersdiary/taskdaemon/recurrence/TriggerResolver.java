package com.programmersdiary.taskdaemon.recurrence;

import com.programmersdiary.taskdaemon.config.SchedulingSettings;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

// calendar triggers are evaluated in the configured zone, never the host's
@Component
public class TriggerResolver {

    private final Clock clock;
    private final SchedulingSettings settings;

    public TriggerResolver(Clock clock, SchedulingSettings settings) {
        this.clock = clock;
        this.settings = settings;
    }

    public ResolvedTrigger resolve(ParseOutcome outcome) {
        if (outcome.trigger().isPresent()) {
            return new ResolvedTrigger(outcome.trigger().get(), outcome.fallbackReason());
        }
        var reason = outcome.fallbackReason().orElse("No trigger could be determined");
        return new ResolvedTrigger(fallback(), Optional.of(reason));
    }

    public Trigger fallback() {
        return new Trigger.Once(clock.instant().plus(settings.fallbackDelay()));
    }

    public Instant firstFireTime(Trigger trigger, Instant registeredAt) {
        if (trigger instanceof Trigger.Once once) {
            return once.at().isAfter(registeredAt) ? once.at() : registeredAt;
        }
        if (trigger instanceof Trigger.Interval interval) {
            return registeredAt.plus(interval.period());
        }
        // a slot falling exactly on registeredAt fires now
        return nextCalendarFire((Trigger.Calendar) trigger, registeredAt.minusNanos(1));
    }

    public Optional<Instant> nextFireAfter(Trigger trigger, Instant from) {
        if (trigger instanceof Trigger.Once once) {
            return once.at().isAfter(from) ? Optional.of(once.at()) : Optional.empty();
        }
        if (trigger instanceof Trigger.Interval interval) {
            return Optional.of(from.plus(interval.period()));
        }
        return Optional.of(nextCalendarFire((Trigger.Calendar) trigger, from));
    }

    // intervals count from the scheduled time and skip whole periods already missed
    public Instant rearmTime(Trigger trigger, Instant scheduledAt, Instant now) {
        if (trigger instanceof Trigger.Interval interval) {
            var period = interval.period();
            var next = scheduledAt.plus(period);
            if (!next.isAfter(now)) {
                long missed = Duration.between(scheduledAt, now).toMillis() / period.toMillis();
                next = scheduledAt.plus(period.multipliedBy(missed + 1));
            }
            return next;
        }
        if (trigger instanceof Trigger.Calendar calendar) {
            var from = scheduledAt.isAfter(now) ? scheduledAt : now;
            return nextCalendarFire(calendar, from);
        }
        throw new IllegalArgumentException("A one-shot trigger is never re-armed");
    }

    private Instant nextCalendarFire(Trigger.Calendar calendar, Instant after) {
        var next = CronExpression.parse(calendar.cronExpression()).next(after.atZone(settings.zoneId()));
        if (next == null) {
            throw new IllegalStateException("No occurrence of " + calendar.describe() + " after " + after);
        }
        return next.toInstant();
    }
}
