package io.relaywatch.queue;

/**
 * Lifecycle notification for a queue. {@code jobId} and {@code kind} are null
 * for queue-level events (PAUSED, RESUMED, DRAINED).
 */
public record JobEvent(Type type, String queueName, String jobId, String kind, String detail, long atMs) {

    public enum Type {
        ADDED,
        DUPLICATE,
        ACTIVE,
        COMPLETED,
        FAILED,
        RETRY_SCHEDULED,
        STALLED,
        STALE_LEASE,
        PAUSED,
        RESUMED,
        DRAINED
    }

    public static JobEvent ofJob(Type type, Job job, String detail, long atMs) {
        return new JobEvent(type, job.queueName(), job.jobId(), job.kind(), detail, atMs);
    }

    public static JobEvent ofQueue(Type type, String queueName, long atMs) {
        return new JobEvent(type, queueName, null, null, null, atMs);
    }
}
