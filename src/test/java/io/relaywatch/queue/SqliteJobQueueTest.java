package io.relaywatch.queue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.config.RelayWatchConfig;
import io.relaywatch.store.Database;
import io.relaywatch.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

final class SqliteJobQueueTest {
    private static final Duration LOCK = Duration.ofSeconds(30);

    @Test
    void openJobsAreDeduplicatedByKey() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-queue-");
        try {
            SqliteJobQueue queue = queue(root, new RetryPolicy(1, 0L, 0L, 1), new MutableClock(1_000_000L));

            Optional<Job> first = queue.add(JobKinds.CHECK_SINGLE, payload("wss://a.example"), "checkSingle:a");
            Optional<Job> duplicate = queue.add(JobKinds.CHECK_SINGLE, payload("wss://a.example"), "checkSingle:a");
            Assertions.assertTrue(first.isPresent());
            Assertions.assertTrue(duplicate.isEmpty());

            Job claimed = queue.claimNext("w1", LOCK).orElseThrow();
            Assertions.assertTrue(queue.add(JobKinds.CHECK_SINGLE, payload("wss://a.example"), "checkSingle:a").isEmpty());
            Assertions.assertTrue(queue.complete(claimed));

            Assertions.assertTrue(queue.add(JobKinds.CHECK_SINGLE, payload("wss://a.example"), "checkSingle:a").isPresent());
            Assertions.assertTrue(queue.add(JobKinds.trawlBatch(0), payload("wss://a.example"), null).isPresent());
            Assertions.assertTrue(queue.add(JobKinds.trawlBatch(0), payload("wss://a.example"), null).isPresent());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void claimsInInsertionOrderWithFencedLeases() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-queue-");
        try {
            SqliteJobQueue queue = queue(root, new RetryPolicy(1, 0L, 0L, 1), new MutableClock(1_000_000L));
            queue.add(JobKinds.trawlBatch(0), payload("wss://a.example"), null);
            queue.add(JobKinds.trawlBatch(1), payload("wss://b.example"), null);

            Job a = queue.claimNext("w1", LOCK).orElseThrow();
            Job b = queue.claimNext("w2", LOCK).orElseThrow();
            Assertions.assertEquals("trawlBatch0", a.kind());
            Assertions.assertEquals("trawlBatch1", b.kind());
            Assertions.assertEquals(JobState.ACTIVE, a.state());
            Assertions.assertEquals(1L, a.leaseEpoch());
            Assertions.assertNotNull(a.leaseToken());
            Assertions.assertTrue(queue.claimNext("w3", LOCK).isEmpty());

            Map<JobState, Integer> counts = queue.counts();
            Assertions.assertEquals(2, counts.get(JobState.ACTIVE));
            Assertions.assertEquals(0, counts.get(JobState.WAITING));
            Assertions.assertEquals(0, counts.get(JobState.FAILED));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expiredLockIsRedeliveredAndStaleHolderIsRejected() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-queue-");
        try {
            MutableClock clock = new MutableClock(1_000_000L);
            SqliteJobQueue queue = queue(root, new RetryPolicy(3, 0L, 0L, 1), clock);
            queue.add(JobKinds.CHECK_SINGLE, payload("wss://a.example"), "checkSingle:a");

            Job stale = queue.claimNext("w1", LOCK).orElseThrow();
            clock.advance(LOCK.plusSeconds(1));

            JobQueue.ReclaimSummary summary = queue.reclaimExpired(clock.millis(), 10);
            Assertions.assertEquals(List.of(stale.jobId()), summary.redelivered());
            Assertions.assertTrue(summary.failed().isEmpty());

            Job fresh = queue.claimNext("w2", LOCK).orElseThrow();
            Assertions.assertEquals(stale.jobId(), fresh.jobId());
            Assertions.assertEquals(stale.leaseEpoch() + 1L, fresh.leaseEpoch());

            Assertions.assertFalse(queue.complete(stale));
            Assertions.assertFalse(queue.extendLock(stale, LOCK));
            Assertions.assertEquals(JobQueue.FailureOutcome.STALE_LEASE, queue.fail(stale, "late").outcome());

            Assertions.assertTrue(queue.extendLock(fresh, LOCK));
            Assertions.assertTrue(queue.complete(fresh));
            Assertions.assertEquals(JobState.COMPLETED, queue.get(fresh.jobId()).orElseThrow().state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void jobThatStallsTooOftenFails() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-queue-");
        try {
            MutableClock clock = new MutableClock(1_000_000L);
            SqliteJobQueue queue = queue(root, new RetryPolicy(3, 0L, 0L, 1), clock);
            String jobId = queue.add(JobKinds.POPULATE, Jsons.object(), null).orElseThrow().jobId();

            queue.claimNext("w1", LOCK).orElseThrow();
            clock.advance(LOCK.plusSeconds(1));
            Assertions.assertEquals(1, queue.reclaimExpired(clock.millis(), 10).redelivered().size());

            queue.claimNext("w1", LOCK).orElseThrow();
            clock.advance(LOCK.plusSeconds(1));
            JobQueue.ReclaimSummary summary = queue.reclaimExpired(clock.millis(), 10);
            Assertions.assertEquals(List.of(jobId), summary.failed());

            Job failed = queue.get(jobId).orElseThrow();
            Assertions.assertEquals(JobState.FAILED, failed.state());
            Assertions.assertEquals("job stalled more than allowable limit", failed.lastError());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failuresRetryUntilAttemptsAreExhausted() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-queue-");
        try {
            MutableClock clock = new MutableClock(1_000_000L);
            SqliteJobQueue queue = queue(root, new RetryPolicy(2, 0L, 0L, 1), clock);
            String jobId = queue.add(JobKinds.CHECK_SINGLE, payload("wss://a.example"), "checkSingle:a").orElseThrow().jobId();

            Job first = queue.claimNext("w1", LOCK).orElseThrow();
            JobQueue.FailureResolution retry = queue.fail(first, "boom");
            Assertions.assertEquals(JobQueue.FailureOutcome.RETRY_SCHEDULED, retry.outcome());
            Assertions.assertEquals(1, retry.attempt());
            Assertions.assertEquals(JobState.WAITING, queue.get(jobId).orElseThrow().state());

            Job second = queue.claimNext("w1", LOCK).orElseThrow();
            JobQueue.FailureResolution failed = queue.fail(second, "boom again");
            Assertions.assertEquals(JobQueue.FailureOutcome.FAILED, failed.outcome());
            Assertions.assertEquals(2, failed.attempt());

            Job stored = queue.get(jobId).orElseThrow();
            Assertions.assertEquals(JobState.FAILED, stored.state());
            Assertions.assertEquals("boom again", stored.lastError());
            Assertions.assertEquals(List.of(stored.jobId()), queue.list(JobState.FAILED, 10).stream().map(Job::jobId).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void purgeRemovesOnlyOldCompletedJobs() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-queue-");
        try {
            MutableClock clock = new MutableClock(1_000_000L);
            SqliteJobQueue queue = queue(root, new RetryPolicy(1, 0L, 0L, 1), clock);
            queue.add(JobKinds.POPULATE, Jsons.object(), null);
            queue.add(JobKinds.POPULATE, Jsons.object(), null);
            Assertions.assertTrue(queue.complete(queue.claimNext("w1", LOCK).orElseThrow()));
            clock.advance(Duration.ofMinutes(5));

            Assertions.assertEquals(1, queue.purgeFinished(clock.millis()));
            Assertions.assertEquals(0, queue.purgeFinished(clock.millis()));
            Assertions.assertEquals(1, queue.counts().get(JobState.WAITING));
        } finally {
            deleteRecursively(root);
        }
    }

    private static SqliteJobQueue queue(Path root, RetryPolicy policy, MutableClock clock) {
        Database db = new Database(RelayWatchConfig.fromRoot(root.toString()));
        db.init();
        return new SqliteJobQueue(db, "relaywatch/test", policy, clock);
    }

    static ObjectNode payload(String relay) {
        ObjectNode node = Jsons.object();
        node.put("relay", relay);
        return node;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
