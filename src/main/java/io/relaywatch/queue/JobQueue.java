package io.relaywatch.queue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable FIFO of jobs with at-least-once delivery. A claimed job is locked for
 * a fixed duration; if the holder neither completes, fails nor extends it in
 * time the job is reclaimed and delivered again under a new lease.
 */
public interface JobQueue extends JobEnqueuer {

    String queueName();

    Optional<Job> claimNext(String owner, Duration lockDuration);

    /**
     * @return false when {@code job}'s lease is no longer current; nothing is written
     */
    boolean complete(Job job);

    FailureResolution fail(Job job, String error);

    boolean extendLock(Job job, Duration lockDuration);

    ReclaimSummary reclaimExpired(long nowMs, int limit);

    Optional<Job> get(String jobId);

    List<Job> list(JobState state, int limit);

    Map<JobState, Integer> counts();

    int purgeFinished(long finishedBeforeMs);

    enum FailureOutcome { RETRY_SCHEDULED, FAILED, STALE_LEASE }

    record FailureResolution(FailureOutcome outcome, int attempt, Long nextAttemptAtMs) {
        public static FailureResolution retryScheduled(int attempt, long nextAttemptAtMs) {
            return new FailureResolution(FailureOutcome.RETRY_SCHEDULED, attempt, nextAttemptAtMs);
        }

        public static FailureResolution failed(int attempt) {
            return new FailureResolution(FailureOutcome.FAILED, attempt, null);
        }

        public static FailureResolution staleLease() {
            return new FailureResolution(FailureOutcome.STALE_LEASE, 0, null);
        }
    }

    record ReclaimSummary(List<String> redelivered, List<String> failed) {
        public int reclaimed() {
            return redelivered.size() + failed.size();
        }
    }
}
