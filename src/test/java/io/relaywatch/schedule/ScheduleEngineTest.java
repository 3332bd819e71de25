package io.relaywatch.schedule;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class ScheduleEngineTest {

    @Test
    void ruleRejectsSubSecondIntervals() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> ScheduleRule.every(Duration.ofMillis(500)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ScheduleRule.every("soon"));
    }

    @Test
    void nextFiringIsAlignedToTheStart() {
        Instant start = Instant.parse("2024-03-01T00:00:00Z");
        ScheduleRule rule = ScheduleRule.every("10m").startingAt(start);

        Assertions.assertEquals(Duration.ofMinutes(10), rule.delayUntilNext(start));
        Assertions.assertEquals(Duration.ofMinutes(7), rule.delayUntilNext(start.plus(Duration.ofMinutes(13))));
        Assertions.assertEquals(Duration.ofMinutes(5), rule.delayUntilNext(start.minus(Duration.ofMinutes(5))));
    }

    @Test
    void slowOrFailingCallbacksDoNotStopTheTicks() throws Exception {
        try (ScheduleEngine engine = new ScheduleEngine()) {
            CountDownLatch threeTicks = new CountDownLatch(3);
            AtomicInteger started = new AtomicInteger();
            ScheduledTrigger trigger = engine.schedule("slow", ScheduleRule.every(Duration.ofSeconds(1)), () -> {
                started.incrementAndGet();
                threeTicks.countDown();
                if (started.get() == 1) {
                    throw new IllegalStateException("first run fails");
                }
                try {
                    Thread.sleep(5_000L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            Assertions.assertTrue(threeTicks.await(10, TimeUnit.SECONDS));
            Assertions.assertTrue(trigger.fireCount() >= 3);
            Assertions.assertEquals(1, engine.triggers().size());
        }
    }

    @Test
    void cancelledTriggerStopsFiring() throws Exception {
        try (ScheduleEngine engine = new ScheduleEngine()) {
            CountDownLatch firstTick = new CountDownLatch(1);
            ScheduledTrigger trigger = engine.schedule("once", ScheduleRule.every(Duration.ofSeconds(1)), firstTick::countDown);
            Assertions.assertTrue(firstTick.await(5, TimeUnit.SECONDS));

            trigger.cancel();
            Assertions.assertTrue(trigger.isCancelled());
            long fired = trigger.fireCount();
            Thread.sleep(1_500L);
            Assertions.assertEquals(fired, trigger.fireCount());
        }
    }
}
