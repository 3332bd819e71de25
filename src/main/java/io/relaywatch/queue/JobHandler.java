package io.relaywatch.queue;

@FunctionalInterface
public interface JobHandler {
    /**
     * Runs the job. Throwing fails the delivery; it is retried while attempts remain.
     */
    void handle(Job job) throws Exception;
}
