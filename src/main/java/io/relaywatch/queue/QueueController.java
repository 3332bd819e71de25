package io.relaywatch.queue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.check.RelayChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * One named queue with its event stream, the checker that handles its jobs and
 * the worker pool that runs them.
 */
public final class QueueController implements JobEnqueuer, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private final JobQueue queue;
    private final JobEvents events;
    private final RelayChecker checker;
    private final WorkerPool worker;
    private final Clock clock;
    private final Map<String, JobHandler> exactRoutes = new LinkedHashMap<>();
    private final Map<String, JobHandler> prefixRoutes = new LinkedHashMap<>();

    /**
     * @param checkerFactory builds the checker; it receives this controller to enqueue through
     */
    public QueueController(JobQueue queue,
                           JobEvents events,
                           WorkerPool.Options workerOptions,
                           Function<JobEnqueuer, RelayChecker> checkerFactory) {
        this(queue, events, workerOptions, checkerFactory, Clock.systemUTC());
    }

    public QueueController(JobQueue queue,
                           JobEvents events,
                           WorkerPool.Options workerOptions,
                           Function<JobEnqueuer, RelayChecker> checkerFactory,
                           Clock clock) {
        this.queue = queue;
        this.events = events;
        this.clock = clock;
        this.checker = checkerFactory.apply(this::add);
        this.worker = new WorkerPool(queue, events, this::routeWork, workerOptions, clock);

        exactRoutes.put(JobKinds.POPULATE, checker::populate);
        exactRoutes.put(JobKinds.CHECK_SINGLE, checker::checkSingle);
        prefixRoutes.put(JobKinds.TRAWL_BATCH_PREFIX, checker::checkBatch);
    }

    public JobQueue queue() {
        return queue;
    }

    public JobEvents events() {
        return events;
    }

    public RelayChecker checker() {
        return checker;
    }

    public WorkerPool worker() {
        return worker;
    }

    /**
     * Dispatches a job to its handler by kind. Unknown kinds fail the job.
     */
    public void routeWork(Job job) throws Exception {
        JobHandler handler = exactRoutes.get(job.kind());
        if (handler == null) {
            for (Map.Entry<String, JobHandler> route : prefixRoutes.entrySet()) {
                if (job.kind().startsWith(route.getKey())) {
                    handler = route.getValue();
                    break;
                }
            }
        }
        if (handler == null) {
            throw new IllegalArgumentException("No handler for job kind " + job.kind());
        }
        log.debug("Routing job {} ({})", job.jobId(), job.kind());
        handler.handle(job);
    }

    @Override
    public Optional<Job> add(String kind, ObjectNode payload, String dedupKey) {
        Optional<Job> added = queue.add(kind, payload, dedupKey);
        if (added.isPresent()) {
            events.emit(JobEvent.ofJob(JobEvent.Type.ADDED, added.get(), null, clock.millis()));
            worker.wake();
        } else {
            log.debug("Job {} with dedup key {} already open, not enqueued", kind, dedupKey);
            events.emit(new JobEvent(JobEvent.Type.DUPLICATE, queue.queueName(), null, kind, dedupKey, clock.millis()));
        }
        return added;
    }

    public void pause() {
        worker.pause();
    }

    public void resume() {
        worker.resume();
    }

    /**
     * Runs the populator once on the calling thread, then starts dequeuing.
     */
    public void start() {
        worker.start();
        int enqueued = checker.populator();
        log.info("Queue {} starting with {} check job(s) from the initial populator run", queue.queueName(), enqueued);
        worker.resume();
    }

    public boolean stop(Duration drainTimeout) {
        return worker.stop(drainTimeout);
    }

    public Map<JobState, Integer> counts() {
        return queue.counts();
    }

    @Override
    public void close() {
        worker.close();
    }
}
