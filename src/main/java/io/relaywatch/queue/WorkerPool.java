package io.relaywatch.queue;

import io.relaywatch.store.StoreUnavailableException;
import io.relaywatch.util.DaemonThreadFactory;
import io.relaywatch.util.Durations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Pulls jobs from a {@link JobQueue} and runs them on a fixed pool.
 *
 * <p>One dispatcher thread claims jobs while a concurrency slot is free, keeps
 * the locks of in-flight jobs extended and reclaims jobs whose holder let the
 * lock expire. The pool is created paused; {@link #resume()} starts dequeuing.
 * Claims happen under the same lock {@link #pause()} takes, so once pause
 * returns no further job is claimed until the next resume.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final int RECLAIM_BATCH = 100;
    private static final Duration FINISHED_RETENTION = Duration.ofDays(1);

    public record Options(String workerId, int concurrency, Duration lockDuration, Duration pollInterval) {
        public Options {
            concurrency = Math.max(1, concurrency);
            if (lockDuration == null || lockDuration.toMillis() < 1L) {
                throw new IllegalArgumentException("lockDuration must be positive");
            }
            if (pollInterval == null || pollInterval.toMillis() < 1L) {
                pollInterval = Duration.ofMillis(500);
            }
        }

        Duration maintenanceInterval() {
            Duration half = lockDuration.dividedBy(2);
            return half.compareTo(Duration.ofSeconds(5)) > 0 ? Duration.ofSeconds(5) : half;
        }
    }

    private final JobQueue queue;
    private final JobEvents events;
    private final JobHandler handler;
    private final Options options;
    private final Clock clock;
    private final Semaphore slots;
    private final ExecutorService executor;
    private final Map<String, Job> inFlight = new ConcurrentHashMap<>();
    private final Object claimLock = new Object();
    private final Object wakeLock = new Object();

    private volatile boolean paused = true;
    private volatile boolean stopped;
    private volatile boolean hadWork;
    private volatile Thread dispatcher;
    private volatile Consumer<StoreUnavailableException> fatalErrorHandler = e -> { };
    private long lastMaintenanceMs;
    private volatile long lastPurgeMs;

    public WorkerPool(JobQueue queue, JobEvents events, JobHandler handler, Options options) {
        this(queue, events, handler, options, Clock.systemUTC());
    }

    public WorkerPool(JobQueue queue, JobEvents events, JobHandler handler, Options options, Clock clock) {
        this.queue = queue;
        this.events = events;
        this.handler = handler;
        this.options = options;
        this.clock = clock;
        this.slots = new Semaphore(options.concurrency());
        this.executor = Executors.newFixedThreadPool(options.concurrency(),
                new DaemonThreadFactory("relaywatch-worker-" + options.workerId() + "-"));
    }

    public Options options() {
        return options;
    }

    /**
     * Called on the dispatcher thread when the store becomes unreachable. The
     * pool has already stopped claiming by then.
     */
    public void onFatalError(Consumer<StoreUnavailableException> handler) {
        this.fatalErrorHandler = handler == null ? e -> { } : handler;
    }

    /**
     * Starts the dispatcher thread. Jobs are only claimed after {@link #resume()}.
     */
    public synchronized void start() {
        if (dispatcher != null || stopped) {
            return;
        }
        Thread thread = new Thread(this::dispatchLoop, "relaywatch-dispatch-" + options.workerId());
        thread.setDaemon(true);
        dispatcher = thread;
        thread.start();
        log.info("Worker pool {} started on {} (concurrency={}, lock={})", options.workerId(), queue.queueName(),
                options.concurrency(), Durations.format(options.lockDuration()));
    }

    public void pause() {
        synchronized (claimLock) {
            paused = true;
        }
        events.emit(JobEvent.ofQueue(JobEvent.Type.PAUSED, queue.queueName(), clock.millis()));
    }

    public void resume() {
        if (stopped) {
            throw new IllegalStateException("Worker pool " + options.workerId() + " is stopped");
        }
        synchronized (claimLock) {
            paused = false;
        }
        events.emit(JobEvent.ofQueue(JobEvent.Type.RESUMED, queue.queueName(), clock.millis()));
        wake();
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isStopped() {
        return stopped;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Wakes an idle dispatcher, e.g. after a job was enqueued.
     */
    public void wake() {
        synchronized (wakeLock) {
            wakeLock.notifyAll();
        }
    }

    /**
     * Stops claiming, waits up to {@code drainTimeout} for in-flight jobs and
     * releases the threads. Jobs still running after the timeout are interrupted
     * and will be redelivered once their lock expires.
     *
     * @return true when every in-flight job finished in time
     */
    public boolean stop(Duration drainTimeout) {
        synchronized (claimLock) {
            stopped = true;
            paused = true;
        }
        wake();
        Thread thread = dispatcher;
        if (thread != null) {
            try {
                thread.join(Math.max(1L, options.pollInterval().toMillis() * 4L));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        executor.shutdown();
        boolean drained;
        try {
            drained = executor.awaitTermination(Math.max(0L, drainTimeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        if (!drained) {
            log.warn("Worker pool {} stopped with {} job(s) still running", options.workerId(), inFlight.size());
            executor.shutdownNow();
        } else {
            log.info("Worker pool {} stopped", options.workerId());
        }
        return drained;
    }

    @Override
    public void close() {
        stop(Duration.ofSeconds(10));
    }

    /**
     * Extends the locks of in-flight jobs, reclaims expired ones and purges old
     * completed jobs. Called periodically by the dispatcher.
     */
    public void maintain() {
        long nowMs = clock.millis();
        for (Job job : inFlight.values()) {
            if (!queue.extendLock(job, options.lockDuration())) {
                log.warn("Lost lock on job {} ({}); another worker may redeliver it", job.jobId(), job.kind());
            }
        }
        JobQueue.ReclaimSummary summary = queue.reclaimExpired(nowMs, RECLAIM_BATCH);
        for (String jobId : summary.redelivered()) {
            log.info("Job {} lock expired, returned to {}", jobId, queue.queueName());
            events.emit(new JobEvent(JobEvent.Type.STALLED, queue.queueName(), jobId, null, "redelivered", nowMs));
        }
        for (String jobId : summary.failed()) {
            log.warn("Job {} stalled too often, marked failed", jobId);
            events.emit(new JobEvent(JobEvent.Type.FAILED, queue.queueName(), jobId, null, "stalled", nowMs));
        }
        if (summary.reclaimed() > 0) {
            wake();
        }
        if (nowMs - lastPurgeMs >= Duration.ofHours(1).toMillis()) {
            lastPurgeMs = nowMs;
            int purged = queue.purgeFinished(nowMs - FINISHED_RETENTION.toMillis());
            if (purged > 0) {
                log.info("Purged {} completed job(s) from {}", purged, queue.queueName());
            }
        }
    }

    private void dispatchLoop() {
        long pollMs = options.pollInterval().toMillis();
        long maintenanceMs = options.maintenanceInterval().toMillis();
        while (!stopped) {
            try {
                long nowMs = clock.millis();
                if (nowMs - lastMaintenanceMs >= maintenanceMs) {
                    lastMaintenanceMs = nowMs;
                    maintain();
                }
                if (paused) {
                    idle(Math.min(pollMs, maintenanceMs));
                    continue;
                }
                if (!slots.tryAcquire(Math.min(pollMs, maintenanceMs), TimeUnit.MILLISECONDS)) {
                    continue;
                }
                Optional<Job> claimed;
                try {
                    synchronized (claimLock) {
                        claimed = paused || stopped
                                ? Optional.empty()
                                : queue.claimNext(options.workerId(), options.lockDuration());
                    }
                } catch (RuntimeException e) {
                    slots.release();
                    throw e;
                }
                if (claimed.isEmpty()) {
                    slots.release();
                    if (hadWork && inFlight.isEmpty() && !paused) {
                        hadWork = false;
                        events.emit(JobEvent.ofQueue(JobEvent.Type.DRAINED, queue.queueName(), clock.millis()));
                    }
                    idle(Math.min(pollMs, maintenanceMs));
                    continue;
                }
                Job job = claimed.get();
                hadWork = true;
                inFlight.put(job.jobId(), job);
                events.emit(JobEvent.ofJob(JobEvent.Type.ACTIVE, job, null, clock.millis()));
                executor.execute(() -> runJob(job));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (StoreUnavailableException e) {
                log.error("Worker pool {} lost its store, no longer claiming jobs", options.workerId(), e);
                stopped = true;
                paused = true;
                fatalErrorHandler.accept(e);
                break;
            } catch (RuntimeException e) {
                log.error("Worker pool {} dispatch failed", options.workerId(), e);
                idleQuietly(pollMs);
            }
        }
        log.debug("Dispatcher {} exited", options.workerId());
    }

    private void runJob(Job job) {
        try {
            log.debug("Running job {} ({}) attempt {}", job.jobId(), job.kind(), job.attempt() + 1);
            handler.handle(job);
            if (queue.complete(job)) {
                events.emit(JobEvent.ofJob(JobEvent.Type.COMPLETED, job, null, clock.millis()));
            } else {
                log.warn("Completion of job {} ({}) rejected: lease epoch {} is no longer current",
                        job.jobId(), job.kind(), job.leaseEpoch());
                events.emit(JobEvent.ofJob(JobEvent.Type.STALE_LEASE, job, "complete", clock.millis()));
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            try {
                recordFailure(job, e);
            } catch (RuntimeException recordError) {
                recordError.addSuppressed(e);
                log.error("Could not record failure of job {} ({})", job.jobId(), job.kind(), recordError);
            }
        } finally {
            inFlight.remove(job.jobId());
            slots.release();
            wake();
        }
    }

    private void recordFailure(Job job, Exception cause) {
        String error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        JobQueue.FailureResolution resolution = queue.fail(job, error);
        switch (resolution.outcome()) {
            case RETRY_SCHEDULED -> {
                log.warn("Job {} ({}) failed on attempt {}, retrying: {}", job.jobId(), job.kind(), resolution.attempt(), error);
                events.emit(JobEvent.ofJob(JobEvent.Type.RETRY_SCHEDULED, job, error, clock.millis()));
            }
            case FAILED -> {
                log.warn("Job {} ({}) failed after {} attempt(s): {}", job.jobId(), job.kind(), resolution.attempt(), error, cause);
                events.emit(JobEvent.ofJob(JobEvent.Type.FAILED, job, error, clock.millis()));
            }
            case STALE_LEASE -> {
                log.warn("Failure of job {} ({}) rejected: lease epoch {} is no longer current",
                        job.jobId(), job.kind(), job.leaseEpoch());
                events.emit(JobEvent.ofJob(JobEvent.Type.STALE_LEASE, job, "fail", clock.millis()));
            }
        }
    }

    private void idle(long millis) throws InterruptedException {
        synchronized (wakeLock) {
            if (!stopped) {
                wakeLock.wait(Math.max(1L, millis));
            }
        }
    }

    private void idleQuietly(long millis) {
        try {
            idle(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
