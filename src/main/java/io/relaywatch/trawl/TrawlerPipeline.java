package io.relaywatch.trawl;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.cache.RelayCache;
import io.relaywatch.cache.RelayIds;
import io.relaywatch.config.WatchSettings;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.queue.JobKinds;
import io.relaywatch.queue.QueueController;
import io.relaywatch.schedule.ScheduleEngine;
import io.relaywatch.schedule.ScheduleRule;
import io.relaywatch.schedule.ScheduledTrigger;
import io.relaywatch.seed.SeedResult;
import io.relaywatch.seed.SeedSource;
import io.relaywatch.util.Jsons;
import io.relaywatch.util.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Discovery side of the daemon: seeds the cache with newly found relays, feeds
 * them to the queue in chunks and runs the periodic full-cache check.
 */
public final class TrawlerPipeline {
    private static final Logger log = LoggerFactory.getLogger(TrawlerPipeline.class);
    public static final String DAEMON_NAME = "trawler";

    private final RelayCache cache;
    private final QueueController controller;
    private final CacheSweep sweep;
    private final SeedSource seedSource;
    private final ScheduleEngine scheduler;
    private final WatchSettings settings;
    private final AtomicBoolean busy = new AtomicBoolean(false);

    public TrawlerPipeline(RelayCache cache,
                           QueueController controller,
                           CacheSweep sweep,
                           SeedSource seedSource,
                           ScheduleEngine scheduler,
                           WatchSettings settings) {
        this.cache = cache;
        this.controller = controller;
        this.sweep = sweep;
        this.seedSource = seedSource;
        this.scheduler = scheduler;
        this.settings = settings;
    }

    /**
     * Inserts a skeleton record for every URL not cached yet. Invalid URLs are
     * logged and skipped.
     *
     * @return the records actually inserted, in input order
     */
    public List<RelayRecord> seed(List<String> urls) {
        Map<String, RelayRecord> byId = new LinkedHashMap<>();
        List<RelayRecord> skeletons = new ArrayList<>();
        for (String url : urls) {
            if (url == null || url.isBlank()) {
                continue;
            }
            RelayRecord skeleton = RelayRecord.skeleton(url.trim());
            skeletons.add(skeleton);
            byId.putIfAbsent(RelayIds.id(url.trim()), skeleton);
        }
        List<String> inserted = cache.batch().insertIfNotExists(skeletons);
        List<RelayRecord> out = new ArrayList<>();
        for (String id : inserted) {
            RelayRecord record = byId.get(id);
            if (record != null) {
                out.add(record);
            }
        }
        log.info("Seeded {} new relay(s) out of {}", out.size(), urls.size());
        return out;
    }

    /**
     * Enqueues one {@code trawlBatch<i>} job per chunk of {@code urls}, in input
     * order, with the worker pool paused for the duration. The pool is resumed
     * exactly once, also when enqueueing fails.
     *
     * @return jobs enqueued
     */
    public int populateTrawler(List<String> urls) {
        List<List<String>> chunks = Lists.chunk(urls, settings.trawlChunkSize());
        controller.pause();
        int added = 0;
        try {
            for (int index = 0; index < chunks.size(); index++) {
                ObjectNode payload = Jsons.object();
                ArrayNode relays = payload.putArray("relays");
                chunks.get(index).forEach(relays::add);
                log.info("Adding batch {} ({} relay(s)) to {}", index, chunks.get(index).size(),
                        controller.queue().queueName());
                if (controller.add(JobKinds.trawlBatch(index), payload, null).isPresent()) {
                    added++;
                }
            }
        } finally {
            controller.resume();
        }
        return added;
    }

    /**
     * Runs the full-cache check unless the cache is empty, the check is disabled
     * or a previous run is still going.
     *
     * @return whether the check ran
     */
    public boolean maybeCheckRelays() {
        if (!settings.trawlCheckEnabled()) {
            return false;
        }
        if (cache.count().all() == 0) {
            return false;
        }
        if (!busy.compareAndSet(false, true)) {
            log.info("Relay check already running, skipped");
            return false;
        }
        try {
            log.info("Checking cached relays");
            int written = sweep.sweep();
            log.info("Checked cached relays, {} result(s) written", written);
            return true;
        } finally {
            busy.set(false);
        }
    }

    public boolean isBusy() {
        return busy.get();
    }

    /**
     * Schedules the periodic check, runs it once, then bootstraps, seeds and
     * enqueues the seed relays for checking.
     */
    public TrawlOutcome run() {
        ScheduledTrigger trigger = scheduler.schedule("maybeCheckRelays",
                ScheduleRule.every(settings.trawlCheckInterval()), this::maybeCheckRelays);
        boolean checked = maybeCheckRelays();
        SeedResult seed = seedSource.bootstrap(DAEMON_NAME);
        List<RelayRecord> seeded = seed(seed.relays());
        Set<String> unique = new HashSet<>();
        List<String> toTrawl = new ArrayList<>();
        for (String url : seed.relays()) {
            if (unique.add(url.trim())) {
                toTrawl.add(url.trim());
            }
        }
        int jobs = populateTrawler(toTrawl);
        return new TrawlOutcome(checked, seeded.size(), jobs, trigger);
    }

    public record TrawlOutcome(boolean checkedCache, int seeded, int jobsEnqueued, ScheduledTrigger checkTrigger) {
    }
}
