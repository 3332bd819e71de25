package io.relaywatch.check;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.cache.Projection;
import io.relaywatch.cache.RelayCache;
import io.relaywatch.cache.RelayIds;
import io.relaywatch.cache.Where;
import io.relaywatch.config.WatchSettings;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.queue.Job;
import io.relaywatch.queue.JobEnqueuer;
import io.relaywatch.queue.JobKinds;
import io.relaywatch.util.Jsons;
import io.relaywatch.util.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Decides which relays are due for a check and runs the checks the queue hands back.
 *
 * <p>Results are written with {@code upsert}, so a duplicate delivery of the same
 * job re-confirms the same fields. A relay whose probe fails is left untouched
 * and comes up again on the next populator run.
 */
public final class RelayChecker {
    private static final Logger log = LoggerFactory.getLogger(RelayChecker.class);

    private final RelayCache cache;
    private final RelayProbe probe;
    private final JobEnqueuer jobs;
    private final WatchSettings settings;
    private final Clock clock;

    public RelayChecker(RelayCache cache, RelayProbe probe, JobEnqueuer jobs, WatchSettings settings) {
        this(cache, probe, jobs, settings, Clock.systemUTC());
    }

    public RelayChecker(RelayCache cache, RelayProbe probe, JobEnqueuer jobs, WatchSettings settings, Clock clock) {
        this.cache = cache;
        this.probe = probe;
        this.jobs = jobs;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Enqueues a {@code checkSingle} job for every relay never checked or last
     * checked longer ago than the configured expiry. Relays that already have an
     * open check job are skipped.
     *
     * @return jobs enqueued
     */
    public int populator() {
        long cutoffMs = clock.millis() - settings.checkExpires().toMillis();
        Where due = Where.undefined(RelayRecord.CHECKED_AT)
                .or(Where.field(RelayRecord.CHECKED_AT, at -> at.isNumber() && at.asLong() < cutoffMs));
        List<JsonNode> rows = new ArrayList<>();
        try (Stream<JsonNode> stream = cache.select(Projection.of(RelayRecord.URL), due)) {
            stream.forEach(rows::add);
        }
        int enqueued = 0;
        for (JsonNode row : rows) {
            String url = row.path(RelayRecord.URL).asText(null);
            if (url == null) {
                continue;
            }
            ObjectNode payload = Jsons.object().put("relay", url);
            if (jobs.add(JobKinds.CHECK_SINGLE, payload, JobKinds.checkSingleDedupKey(RelayIds.id(url))).isPresent()) {
                enqueued++;
            }
        }
        log.info("Populator found {} relay(s) due, enqueued {} check job(s)", rows.size(), enqueued);
        return enqueued;
    }

    /**
     * Handler for {@code populate} jobs.
     */
    public void populate(Job job) {
        populator();
    }

    /**
     * Handler for {@code checkSingle} jobs: payload {@code {"relay": url}}.
     *
     * @return whether a result was written
     */
    public boolean checkSingle(Job job) {
        String url = job.payload().path("relay").asText(null);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("checkSingle job " + job.jobId() + " has no relay");
        }
        return checkUrl(url).isPresent();
    }

    /**
     * Probes one relay and writes the result.
     *
     * @return the record as written, empty when the probe failed
     */
    public Optional<RelayRecord> checkUrl(String url) {
        Optional<RelayRecord> result = probeOne(url);
        result.ifPresent(cache::upsert);
        return result;
    }

    /**
     * Handler for {@code trawlBatch<N>} jobs: payload {@code {"relays": [url, ...]}}.
     *
     * @return results written
     */
    public int checkBatch(Job job) {
        JsonNode relays = job.payload().path("relays");
        if (!relays.isArray()) {
            throw new IllegalArgumentException(job.kind() + " job " + job.jobId() + " has no relay list");
        }
        List<String> urls = new ArrayList<>();
        relays.forEach(url -> urls.add(url.asText()));
        int written = probeAndWrite(urls);
        log.info("{} checked {} relay(s), wrote {}", job.kind(), urls.size(), written);
        return written;
    }

    /**
     * Checks every cached relay, one chunk at a time.
     *
     * @return results written
     */
    public int sweep() {
        List<String> urls = new ArrayList<>();
        for (JsonNode row : cache.get().all(Projection.of(RelayRecord.URL))) {
            urls.add(row.path(RelayRecord.URL).asText());
        }
        int written = 0;
        for (List<String> chunk : Lists.chunk(urls, settings.trawlChunkSize())) {
            written += probeAndWrite(chunk);
        }
        log.info("Sweep checked {} relay(s), wrote {}", urls.size(), written);
        return written;
    }

    private int probeAndWrite(List<String> urls) {
        List<RelayRecord> results = new ArrayList<>();
        for (String url : urls) {
            probeOne(url).ifPresent(results::add);
        }
        return cache.batch().upsert(results).size();
    }

    private Optional<RelayRecord> probeOne(String url) {
        ObjectNode observed;
        try {
            observed = probe.probe(url);
        } catch (ProbeException e) {
            log.warn("Check of {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
        RelayRecord next = cache.one(url).orElseGet(() -> RelayRecord.skeleton(url.trim())).copy();
        if (observed != null) {
            ObjectNode overlay = observed.deepCopy();
            overlay.remove(RelayRecord.URL);
            overlay.remove(RelayRecord.ID);
            next.document().setAll(overlay);
        }
        long nowMs = clock.millis();
        next.put(RelayRecord.CHECKED_AT, nowMs);
        if (next.connect().orElse(false)) {
            next.put(RelayRecord.LAST_SEEN, nowMs);
        }
        return Optional.of(next);
    }
}
