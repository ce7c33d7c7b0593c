package com.programmersdiary.taskdaemon.scheduling;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;

// refuses to be armed again once cancelled
public class JobHandle {

    private final ScheduledJob job;
    private ScheduledFuture<?> future;
    private Instant nextFireTime;
    private boolean cancelled;

    public JobHandle(ScheduledJob job) {
        this.job = job;
    }

    public ScheduledJob job() {
        return job;
    }

    public String taskId() {
        return job.taskId();
    }

    public synchronized Instant nextFireTime() {
        return nextFireTime;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    synchronized boolean arm(Instant fireAt, Function<Instant, ScheduledFuture<?>> scheduler) {
        if (cancelled) return false;
        this.future = scheduler.apply(fireAt);
        this.nextFireTime = fireAt;
        return true;
    }

    synchronized void markFired() {
        this.nextFireTime = null;
    }

    public synchronized void cancel() {
        if (cancelled) return;
        cancelled = true;
        nextFireTime = null;
        if (future != null) {
            future.cancel(false);
        }
    }
}
