package io.relaywatch.runtime;

import io.relaywatch.cache.RelayCache;
import io.relaywatch.check.ReachabilityProbe;
import io.relaywatch.check.RelayChecker;
import io.relaywatch.check.RelayProbe;
import io.relaywatch.config.RelayWatchConfig;
import io.relaywatch.config.WatchSettings;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.observability.JobEventJournal;
import io.relaywatch.queue.JobEvents;
import io.relaywatch.queue.QueueController;
import io.relaywatch.queue.RetryPolicy;
import io.relaywatch.queue.SqliteJobQueue;
import io.relaywatch.queue.WorkerPool;
import io.relaywatch.schedule.ScheduleEngine;
import io.relaywatch.schedule.ScheduleRule;
import io.relaywatch.schedule.ScheduledTrigger;
import io.relaywatch.seed.SeedResult;
import io.relaywatch.seed.SeedSource;
import io.relaywatch.seed.StaticSeedSource;
import io.relaywatch.store.Database;
import io.relaywatch.store.InMemoryRecordStore;
import io.relaywatch.store.RecordStore;
import io.relaywatch.store.SqliteRecordStore;
import io.relaywatch.trawl.TrawlerPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Wires the cache, queue, checker, schedules and trawler for one monitor and
 * runs the daemon lifecycle.
 *
 * <p>Startup: bootstrap the cache if it is empty, schedule the populator and
 * the seed re-sync, run the populator once, then resume the worker pool.
 * Shutdown: cancel schedules, drain the worker pool, close the cache.
 */
public final class RelayWatchRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayWatchRuntime.class);
    public static final String DAEMON_NAME = "relaywatch";
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final RelayWatchConfig config;
    private final WatchSettings settings;
    private final Database database;
    private final RelayCache cache;
    private final SqliteJobQueue queue;
    private final JobEvents events;
    private final QueueController controller;
    private final ScheduleEngine scheduler;
    private final SeedSource seedSource;
    private final TrawlerPipeline trawler;
    private final List<ScheduledTrigger> triggers = new ArrayList<>();
    private JobEventJournal journal;
    private Runnable journalSubscription;
    private boolean initialized;

    public RelayWatchRuntime(RelayWatchConfig config, WatchSettings settings, Options options) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        RecordStore store = options.inMemoryCache() ? new InMemoryRecordStore() : new SqliteRecordStore(database);
        this.cache = new RelayCache(store);
        this.queue = new SqliteJobQueue(database, settings.queueName(), RetryPolicy.from(settings));
        this.events = new JobEvents();
        RelayProbe probe = options.probe() == null ? new ReachabilityProbe(settings.probeTimeout()) : options.probe();
        WorkerPool.Options workerOptions = new WorkerPool.Options(
                options.workerId() == null ? "w-" + UUID.randomUUID().toString().substring(0, 8) : options.workerId(),
                settings.workerConcurrency(),
                settings.workerLockDuration(),
                settings.workerPollInterval()
        );
        this.controller = new QueueController(queue, events, workerOptions,
                jobs -> new RelayChecker(cache, probe, jobs, settings));
        this.scheduler = new ScheduleEngine();
        this.seedSource = options.seedSource() == null ? defaultSeedSource(config, settings) : options.seedSource();
        this.trawler = new TrawlerPipeline(cache, controller, controller.checker()::sweep, seedSource, scheduler, settings);
    }

    public static RelayWatchRuntime fromRoot(String root) {
        RelayWatchConfig config = RelayWatchConfig.fromRoot(root);
        return new RelayWatchRuntime(config, WatchSettings.load(config.settingsFile()), Options.defaults());
    }

    public synchronized void init() {
        if (initialized) {
            return;
        }
        database.init();
        journal = new JobEventJournal(config.jobJournalFile());
        journalSubscription = events.subscribe(journal);
        initialized = true;
    }

    public RelayWatchConfig config() {
        return config;
    }

    public WatchSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public RelayCache cache() {
        return cache;
    }

    public QueueController controller() {
        return controller;
    }

    public JobEvents events() {
        return events;
    }

    public ScheduleEngine scheduler() {
        return scheduler;
    }

    public SeedSource seedSource() {
        return seedSource;
    }

    public TrawlerPipeline trawler() {
        return trawler;
    }

    public JobEventJournal journal() {
        return journal;
    }

    /**
     * Seeds from the configured source when the cache holds no relays yet.
     *
     * @return relays inserted
     */
    public int maybeBootstrap() {
        log.info("Bootstrapping...");
        if (cache.count().all() != 0) {
            return 0;
        }
        int persisted = syncRelaysIn().size();
        log.info("Bootstrapped {} relay(s)", persisted);
        return persisted;
    }

    /**
     * Pulls the seed list and inserts the relays not cached yet.
     */
    public List<RelayRecord> syncRelaysIn() {
        SeedResult seed = seedSource.bootstrap(DAEMON_NAME);
        List<RelayRecord> persisted = trawler.seed(seed.relays());
        log.info("Synced {} relay(s)", persisted.size());
        return persisted;
    }

    public synchronized StartOutcome start() {
        init();
        int bootstrapped = maybeBootstrap();
        triggers.add(scheduler.schedule("populator", ScheduleRule.every(settings.checkInterval()),
                () -> controller.checker().populator()));
        if (settings.seedSyncEnabled()) {
            triggers.add(scheduler.schedule("syncRelaysIn", ScheduleRule.every(settings.seedSyncInterval()),
                    this::syncRelaysIn));
        }
        controller.start();
        log.info("{} initialized: {}", DAEMON_NAME, queue.queueName());
        return new StartOutcome(queue.queueName(), bootstrapped, triggers.size());
    }

    /**
     * Trawler daemon entry: periodic full check plus chunked enqueue of the seed relays.
     */
    public synchronized TrawlerPipeline.TrawlOutcome runTrawler() {
        init();
        controller.worker().start();
        TrawlerPipeline.TrawlOutcome outcome = trawler.run();
        triggers.add(outcome.checkTrigger());
        return outcome;
    }

    public synchronized boolean stop(Duration drainTimeout) {
        log.info("Gracefully shutting down...");
        triggers.forEach(ScheduledTrigger::cancel);
        triggers.clear();
        boolean drained = controller.stop(drainTimeout);
        scheduler.close();
        if (journalSubscription != null) {
            journalSubscription.run();
            journalSubscription = null;
        }
        cache.close();
        return drained;
    }

    @Override
    public void close() {
        stop(DEFAULT_DRAIN_TIMEOUT);
    }

    private static SeedSource defaultSeedSource(RelayWatchConfig config, WatchSettings settings) {
        Path seedFile = null;
        if (settings.seedFile() != null && !settings.seedFile().isBlank()) {
            seedFile = config.rootDir().resolve(settings.seedFile());
        }
        return new StaticSeedSource(settings.seedRelays(), seedFile);
    }

    /**
     * Collaborator overrides. Null fields fall back to the defaults built from settings.
     */
    public record Options(boolean inMemoryCache, RelayProbe probe, SeedSource seedSource, String workerId) {
        public static Options defaults() {
            return new Options(false, null, null, null);
        }

        public Options withProbe(RelayProbe value) {
            return new Options(inMemoryCache, value, seedSource, workerId);
        }

        public Options withSeedSource(SeedSource value) {
            return new Options(inMemoryCache, probe, value, workerId);
        }

        public Options withInMemoryCache(boolean value) {
            return new Options(value, probe, seedSource, workerId);
        }
    }

    public record StartOutcome(String queueName, int bootstrapped, int schedules) {
    }
}
