package io.relaywatch.queue;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A queued unit of work. {@code leaseToken} and {@code leaseEpoch} identify the
 * delivery currently holding the job; completions are accepted only for that delivery.
 */
public record Job(
        long seq,
        String jobId,
        String queueName,
        String kind,
        ObjectNode payload,
        String dedupKey,
        JobState state,
        int attempt,
        String leaseOwner,
        String leaseToken,
        long leaseEpoch,
        Long lockedUntilMs,
        long availableAtMs,
        String lastError,
        long createdAtMs,
        long updatedAtMs
) {
}
