package io.relaywatch.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk shape of {@code relaywatch-settings.json}. Every field is optional;
 * missing values fall back to {@link WatchSettings#defaults()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WatchSettingsFile(
        @JsonProperty("monitor_slug") String monitorSlug,
        @JsonProperty("check_interval") String checkInterval,
        @JsonProperty("check_expires") String checkExpires,
        @JsonProperty("trawl_chunk_size") Integer trawlChunkSize,
        @JsonProperty("trawl_check_enabled") Boolean trawlCheckEnabled,
        @JsonProperty("trawl_check_interval") String trawlCheckInterval,
        @JsonProperty("worker_concurrency") Integer workerConcurrency,
        @JsonProperty("worker_lock_duration") String workerLockDuration,
        @JsonProperty("worker_max_attempts") Integer workerMaxAttempts,
        @JsonProperty("worker_poll_interval") String workerPollInterval,
        @JsonProperty("seed_sync_enabled") Boolean seedSyncEnabled,
        @JsonProperty("seed_sync_interval") String seedSyncInterval,
        @JsonProperty("seed_relays") List<String> seedRelays,
        @JsonProperty("seed_file") String seedFile,
        @JsonProperty("probe_timeout") String probeTimeout
) {
}
