package io.relaywatch.queue;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

@FunctionalInterface
public interface JobEnqueuer {
    /**
     * @param dedupKey jobs sharing a key are not enqueued twice while one is waiting or active; may be null
     * @return the queued job, or empty when a job with the same dedup key is still open
     */
    Optional<Job> add(String kind, ObjectNode payload, String dedupKey);
}
