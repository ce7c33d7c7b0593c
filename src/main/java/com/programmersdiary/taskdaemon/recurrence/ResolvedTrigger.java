package com.programmersdiary.taskdaemon.recurrence;

import java.util.Optional;

public record ResolvedTrigger(Trigger trigger, Optional<String> fallbackReason) {

    public boolean isFallback() {
        return fallbackReason.isPresent();
    }
}
