package io.relaywatch.schedule;

import io.relaywatch.util.DaemonThreadFactory;
import io.relaywatch.util.Durations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-rate triggers. The scheduler thread only counts the tick and hands the
 * callback to a separate pool, so a slow callback never delays the next tick
 * and two invocations of one callback may overlap.
 */
public final class ScheduleEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScheduleEngine.class);

    private final ScheduledExecutorService ticker;
    private final ExecutorService callbacks;
    private final Clock clock;
    private final List<ScheduledTrigger> triggers = new CopyOnWriteArrayList<>();

    public ScheduleEngine() {
        this(Clock.systemUTC());
    }

    public ScheduleEngine(Clock clock) {
        this.clock = clock;
        this.ticker = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relaywatch-schedule-"));
        this.callbacks = Executors.newCachedThreadPool(new DaemonThreadFactory("relaywatch-schedule-task-"));
    }

    public ScheduledTrigger schedule(String name, ScheduleRule rule, Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        ScheduledTrigger trigger = new ScheduledTrigger(name, rule);
        long initialDelayMs = rule.delayUntilNext(clock.instant()).toMillis();
        long periodMs = rule.interval().toMillis();
        trigger.attach(ticker.scheduleAtFixedRate(() -> {
            long fire = trigger.recordFire();
            callbacks.execute(() -> invoke(trigger, fire, callback));
        }, initialDelayMs, periodMs, TimeUnit.MILLISECONDS));
        triggers.add(trigger);
        log.info("Scheduled {} every {} (first run in {})", name, Durations.format(rule.interval()),
                Durations.format(Duration.ofMillis(initialDelayMs)));
        return trigger;
    }

    public List<ScheduledTrigger> triggers() {
        return List.copyOf(triggers);
    }

    private void invoke(ScheduledTrigger trigger, long fire, Runnable callback) {
        try {
            log.debug("Running {} (tick {})", trigger.name(), fire);
            callback.run();
        } catch (RuntimeException e) {
            log.error("Scheduled task {} failed on tick {}", trigger.name(), fire, e);
        }
    }

    @Override
    public void close() {
        triggers.forEach(ScheduledTrigger::cancel);
        ticker.shutdownNow();
        callbacks.shutdown();
        try {
            if (!callbacks.awaitTermination(5, TimeUnit.SECONDS)) {
                callbacks.shutdownNow();
            }
        } catch (InterruptedException e) {
            callbacks.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
