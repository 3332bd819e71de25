package io.relaywatch.schedule;

import io.relaywatch.util.Durations;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fires at {@code start + k * interval} for every {@code k >= 1}.
 */
public record ScheduleRule(Duration interval, Instant start) {
    public static final Duration MIN_INTERVAL = Duration.ofSeconds(1);

    public ScheduleRule {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(start, "start");
        if (interval.compareTo(MIN_INTERVAL) < 0) {
            throw new IllegalArgumentException("Schedule interval must be at least 1s, got " + Durations.format(interval));
        }
    }

    public static ScheduleRule every(String interval) {
        return every(Durations.parse(interval));
    }

    public static ScheduleRule every(Duration interval) {
        return new ScheduleRule(interval, Instant.now());
    }

    public ScheduleRule startingAt(Instant anchor) {
        return new ScheduleRule(interval, anchor);
    }

    /**
     * Delay from {@code now} until the next firing strictly after {@code now}.
     */
    public Duration delayUntilNext(Instant now) {
        long intervalMs = interval.toMillis();
        long sinceStart = now.toEpochMilli() - start.toEpochMilli();
        if (sinceStart < 0L) {
            return Duration.ofMillis(-sinceStart);
        }
        long elapsedInPeriod = sinceStart % intervalMs;
        return Duration.ofMillis(intervalMs - elapsedInPeriod);
    }

    @Override
    public String toString() {
        return "every " + Durations.format(interval) + " from " + start;
    }
}
