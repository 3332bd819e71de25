package io.relaywatch.schedule;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

public final class ScheduledTrigger {
    private final String name;
    private final ScheduleRule rule;
    private final AtomicLong fires = new AtomicLong(0L);
    private volatile ScheduledFuture<?> future;

    ScheduledTrigger(String name, ScheduleRule rule) {
        this.name = name;
        this.rule = rule;
    }

    public String name() {
        return name;
    }

    public ScheduleRule rule() {
        return rule;
    }

    /**
     * Ticks so far. Counts firings, not completed callbacks.
     */
    public long fireCount() {
        return fires.get();
    }

    public boolean isCancelled() {
        ScheduledFuture<?> f = future;
        return f != null && f.isCancelled();
    }

    /**
     * Stops future ticks. A callback already handed off keeps running.
     */
    public void cancel() {
        ScheduledFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
    }

    void attach(ScheduledFuture<?> scheduled) {
        this.future = scheduled;
    }

    long recordFire() {
        return fires.incrementAndGet();
    }
}
