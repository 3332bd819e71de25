package io.relaywatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.relaywatch.cache.Projection;
import io.relaywatch.cache.RelayCache;
import io.relaywatch.cache.RelayQueries;
import io.relaywatch.cache.Where;
import io.relaywatch.config.RelayWatchConfig;
import io.relaywatch.config.WatchSettings;
import io.relaywatch.model.Network;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.queue.Job;
import io.relaywatch.queue.JobState;
import io.relaywatch.runtime.RelayWatchRuntime;
import io.relaywatch.seed.SeedResult;
import io.relaywatch.trawl.TrawlerPipeline;
import io.relaywatch.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

@Command(
        name = "relaywatch",
        mixinStandardHelpOptions = true,
        description = "Relay cache and health-check queue",
        subcommands = {
                RelayWatchCommand.InitCommand.class,
                RelayWatchCommand.DaemonCommand.class,
                RelayWatchCommand.SeedCommand.class,
                RelayWatchCommand.RelayCommand.class,
                RelayWatchCommand.RelaysCommand.class,
                RelayWatchCommand.CountCommand.class,
                RelayWatchCommand.CheckCommand.class,
                RelayWatchCommand.TrawlCommand.class,
                RelayWatchCommand.JobsCommand.class
        }
)
public final class RelayWatchCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(RelayWatchCommand.class);

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = RelayWatchConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | daemon | seed | relay | relays | count | check | trawl | jobs");
    }

    RelayWatchRuntime runtime() {
        return runtime(false);
    }

    RelayWatchRuntime runtime(boolean inMemoryCache) {
        RelayWatchConfig config = RelayWatchConfig.fromRoot(root);
        WatchSettings settings = WatchSettings.load(config.settingsFile());
        RelayWatchRuntime runtime = new RelayWatchRuntime(config, settings,
                RelayWatchRuntime.Options.defaults().withInMemoryCache(inMemoryCache));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Create the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        RelayWatchCommand parent;

        @Override
        public Integer call() {
            RelayWatchRuntime runtime = parent.runtime();
            System.out.println("Initialized RelayWatch at: " + runtime.config().rootDir());
            System.out.println(Jsons.toJson(runtime.database().listSchemaMigrations(20)));
            return 0;
        }
    }

    @Command(name = "daemon", description = "Run the populator, schedules and worker pool until interrupted")
    static final class DaemonCommand implements Callable<Integer> {
        @ParentCommand
        RelayWatchCommand parent;

        @Option(names = {"--trawler"}, defaultValue = "false",
                description = "Also run the trawler: periodic full check and chunked seed enqueue")
        boolean trawler;

        @Option(names = {"--in-memory"}, defaultValue = "false", description = "Keep relay records in memory only")
        boolean inMemory;

        @Option(names = {"--drain-timeout-ms"}, defaultValue = "30000",
                description = "How long shutdown waits for running jobs")
        long drainTimeoutMs;

        @Override
        public Integer call() throws Exception {
            RelayWatchRuntime runtime = parent.runtime(inMemory);
            Duration drain = Duration.ofMillis(Math.max(0L, drainTimeoutMs));
            runtime.controller().worker().onFatalError(e -> {
                log.error("Store unreachable, exiting", e);
                System.exit(2);
            });
            Runtime.getRuntime().addShutdownHook(new Thread(() -> runtime.stop(drain), "relaywatch-shutdown-hook"));

            RelayWatchRuntime.StartOutcome started = runtime.start();
            System.out.println(Jsons.toJson(started));
            if (trawler) {
                TrawlerPipeline.TrawlOutcome trawled = runtime.runTrawler();
                System.out.println(Jsons.toJson(Map.of(
                        "checkedCache", trawled.checkedCache(),
                        "seeded", trawled.seeded(),
                        "jobsEnqueued", trawled.jobsEnqueued()
                )));
            }
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "seed", description = "Insert skeleton records for relays not cached yet")
    static final class SeedCommand implements Callable<Integer> {
        @ParentCommand
        RelayWatchCommand parent;

        @Parameters(arity = "0..*", description = "Relay urls; defaults to the configured seed list")
        List<String> urls;

        @Override
        public Integer call() {
            RelayWatchRuntime runtime = parent.runtime();
            List<RelayRecord> inserted;
            if (urls == null || urls.isEmpty()) {
                inserted = runtime.syncRelaysIn();
            } else {
                inserted = runtime.trawler().seed(urls);
            }
            List<String> out = new ArrayList<>();
            inserted.forEach(record -> out.add(record.url()));
            System.out.println(Jsons.toJson(Map.of("inserted", out)));
            return 0;
        }
    }

    @Command(name = "relay", description = "Show, patch or delete one relay")
    static final class RelayCommand implements Callable<Integer> {
        @ParentCommand
        RelayWatchCommand parent;

        @Parameters(index = "0", description = "Relay url")
        String url;

        @Option(names = {"--patch"}, description = "JSON object to overlay onto the record")
        String patch;

        @Option(names = {"--delete"}, defaultValue = "false", description = "Delete the record")
        boolean delete;

        @Override
        public Integer call() {
            RelayCache cache = parent.runtime().cache();
            if (delete) {
                cache.delete(url);
                System.out.println("Deleted " + url);
                return 0;
            }
            if (patch != null && !patch.isBlank()) {
                cache.patch(url, Jsons.readObject(patch));
            }
            Optional<RelayRecord> record = cache.get().one(url);
            if (record.isEmpty()) {
                System.err.println("Relay not found: " + url);
                return 2;
            }
            System.out.println(Jsons.toJson(record.get().document()));
            return 0;
        }
    }

    @Command(name = "relays", description = "List cached relays")
    static final class RelaysCommand implements Callable<Integer> {
        @ParentCommand
        RelayWatchCommand parent;

        @Option(names = {"--online"}, defaultValue = "false", description = "Only relays that accepted a connection")
        boolean online;

        @Option(names = {"--network"}, description = "clearnet|tor|i2p|loki|local")
        String network;

        @Option(names = {"--paid"}, defaultValue = "false", description = "Only relays that require payment")
        boolean paid;

        @Option(names = {"--public"}, defaultValue = "false", description = "Only relays that do not require payment")
        boolean publicOnly;

        @Option(names = {"--dead"}, defaultValue = "false", description = "Only relays flagged dead")
        boolean dead;

        @Option(names = {"--nip"}, description = "Only relays that support these NIPs")
        List<Integer> nips;

        @Option(names = {"--fields"}, split = ",", description = "Fields to print, e.g. url,connect")
        String[] fields;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            RelayCache cache = parent.runtime().cache();
            Where where = Where.any();
            if (online) {
                where = where.and(RelayQueries.whereOnline());
            }
            if (network != null && !network.isBlank()) {
                where = where.and(RelayQueries.whereNetwork(Network.fromString(network)));
            }
            if (paid) {
                where = where.and(RelayQueries.wherePaid());
            }
            if (publicOnly) {
                where = where.and(RelayQueries.wherePublic());
            }
            if (dead) {
                where = where.and(RelayQueries.whereDead());
            }
            if (nips != null) {
                for (Integer nip : nips) {
                    where = where.and(RelayQueries.whereSupportsNip(nip));
                }
            }
            Projection projection = fields == null ? Projection.all() : Projection.of(fields);
            List<JsonNode> rows = new ArrayList<>();
            try (Stream<JsonNode> stream = cache.select(projection, where)) {
                stream.limit(Math.max(1, limit)).forEach(rows::add);
            }
            System.out.println(Jsons.toJson(rows));
            return 0;
        }
    }

    @Command(name = "count", description = "Relay counts by status")
    static final class CountCommand implements Callable<Integer> {
        @ParentCommand
        RelayWatchCommand parent;

        @Override
        public Integer call() {
            RelayCache cache = parent.runtime().cache();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("all", cache.count().all());
            out.put("online", cache.count().online());
            out.put("public", cache.count().publicRelays());
            out.put("paid", cache.count().paid());
            out.put("dead", cache.count().dead());
            Map<String, Long> byNetwork = new LinkedHashMap<>();
            for (Network network : Network.values()) {
                byNetwork.put(network.label(), cache.count().network(network));
            }
            out.put("network", byNetwork);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "check", description = "Probe relays now and write the results")
    static final class CheckCommand implements Callable<Integer> {
        @ParentCommand
        RelayWatchCommand parent;

        @Parameters(arity = "0..*", description = "Relay urls")
        List<String> urls;

        @Option(names = {"--all"}, defaultValue = "false", description = "Check every cached relay")
        boolean all;

        @Override
        public Integer call() {
            RelayWatchRuntime runtime = parent.runtime();
            if (all) {
                System.out.println(Jsons.toJson(Map.of("written", runtime.controller().checker().sweep())));
                return 0;
            }
            if (urls == null || urls.isEmpty()) {
                System.err.println("Pass relay urls or --all");
                return 2;
            }
            List<JsonNode> out = new ArrayList<>();
            for (String url : urls) {
                runtime.controller().checker().checkUrl(url).ifPresent(record -> out.add(record.document()));
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "trawl", description = "Enqueue relays for checking in chunks")
    static final class TrawlCommand implements Callable<Integer> {
        @ParentCommand
        RelayWatchCommand parent;

        @Parameters(arity = "0..*", description = "Relay urls; defaults to the configured seed list")
        List<String> urls;

        @Override
        public Integer call() {
            RelayWatchRuntime runtime = parent.runtime();
            List<String> relays = urls;
            if (relays == null || relays.isEmpty()) {
                SeedResult seed = runtime.seedSource().bootstrap(TrawlerPipeline.DAEMON_NAME);
                relays = seed.relays();
            }
            int jobs = runtime.trawler().populateTrawler(relays);
            System.out.println(Jsons.toJson(Map.of("relays", relays.size(), "jobsEnqueued", jobs)));
            return 0;
        }
    }

    @Command(name = "jobs", description = "Queue counts and job listing")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        RelayWatchCommand parent;

        @Option(names = {"--state"}, description = "WAITING|ACTIVE|COMPLETED|FAILED")
        String state;

        @Option(names = {"--limit"}, defaultValue = "0", description = "List up to this many jobs")
        int limit;

        @Option(names = {"--verify-journal"}, defaultValue = "false", description = "Verify the job journal hash chain")
        boolean verifyJournal;

        @Override
        public Integer call() {
            RelayWatchRuntime runtime = parent.runtime();
            if (verifyJournal) {
                System.out.println(Jsons.toJson(runtime.journal().verify()));
                return runtime.journal().verify().intact() ? 0 : 3;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("queue", runtime.controller().queue().queueName());
            out.put("counts", runtime.controller().counts());
            if (limit > 0) {
                JobState filter = state == null || state.isBlank() ? null : JobState.fromString(state);
                List<Map<String, Object>> jobs = new ArrayList<>();
                for (Job job : runtime.controller().queue().list(filter, limit)) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("jobId", job.jobId());
                    row.put("kind", job.kind());
                    row.put("state", job.state());
                    row.put("attempt", job.attempt());
                    row.put("leaseEpoch", job.leaseEpoch());
                    row.put("lastError", job.lastError());
                    row.put("payload", job.payload());
                    jobs.add(row);
                }
                out.put("jobs", jobs);
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }
}
