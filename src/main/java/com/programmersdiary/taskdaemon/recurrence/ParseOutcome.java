package com.programmersdiary.taskdaemon.recurrence;

import java.util.Optional;

// no trigger: not understood at all; trigger with a reason: a default replaced part of the rule
public record ParseOutcome(Optional<Trigger> trigger, Optional<String> fallbackReason) {

    public static ParseOutcome of(Trigger trigger) {
        return new ParseOutcome(Optional.of(trigger), Optional.empty());
    }

    public static ParseOutcome degraded(Trigger trigger, String reason) {
        return new ParseOutcome(Optional.of(trigger), Optional.of(reason));
    }

    public static ParseOutcome unparseable(String reason) {
        return new ParseOutcome(Optional.empty(), Optional.of(reason));
    }

    public boolean isFallback() {
        return fallbackReason.isPresent();
    }
}
