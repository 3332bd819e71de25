package io.relaywatch.config;

import io.relaywatch.util.Durations;
import io.relaywatch.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Effective settings, resolved once at startup.
 */
public record WatchSettings(
        String monitorSlug,
        Duration checkInterval,
        Duration checkExpires,
        int trawlChunkSize,
        boolean trawlCheckEnabled,
        Duration trawlCheckInterval,
        int workerConcurrency,
        Duration workerLockDuration,
        int workerMaxAttempts,
        Duration workerPollInterval,
        boolean seedSyncEnabled,
        Duration seedSyncInterval,
        List<String> seedRelays,
        String seedFile,
        Duration probeTimeout
) {
    private static final Logger log = LoggerFactory.getLogger(WatchSettings.class);

    public static final String DEFAULT_MONITOR_SLUG = "default";
    public static final int DEFAULT_TRAWL_CHUNK_SIZE = 50;
    public static final int DEFAULT_WORKER_CONCURRENCY = 1;
    public static final Duration DEFAULT_LOCK_DURATION = Duration.ofMinutes(2);

    public WatchSettings {
        seedRelays = seedRelays == null ? List.of() : List.copyOf(seedRelays);
    }

    public static WatchSettings defaults() {
        return new WatchSettings(
                DEFAULT_MONITOR_SLUG,
                Duration.ofMinutes(1),
                Duration.ofHours(1),
                DEFAULT_TRAWL_CHUNK_SIZE,
                true,
                Duration.ofHours(12),
                DEFAULT_WORKER_CONCURRENCY,
                DEFAULT_LOCK_DURATION,
                1,
                Duration.ofMillis(500),
                true,
                Duration.ofHours(1),
                List.of(),
                null,
                Duration.ofSeconds(10)
        );
    }

    public static WatchSettings load(Path settingsFile) {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            log.info("No settings file at {}, using defaults", settingsFile);
            return defaults();
        }
        try {
            WatchSettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), WatchSettingsFile.class);
            WatchSettings resolved = fromFile(file, defaults());
            log.info("Loaded settings from {}", settingsFile);
            return resolved;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    public static WatchSettings fromFile(WatchSettingsFile file, WatchSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Duration minTick = Duration.ofSeconds(1);
        return new WatchSettings(
                sanitizeSlug(file.monitorSlug(), defaults.monitorSlug()),
                Durations.parseOrDefault(file.checkInterval(), defaults.checkInterval(), minTick),
                Durations.parseOrDefault(file.checkExpires(), defaults.checkExpires(), Duration.ZERO),
                sanitizeInt(file.trawlChunkSize(), defaults.trawlChunkSize(), 1),
                sanitizeBoolean(file.trawlCheckEnabled(), defaults.trawlCheckEnabled()),
                Durations.parseOrDefault(file.trawlCheckInterval(), defaults.trawlCheckInterval(), minTick),
                sanitizeInt(file.workerConcurrency(), defaults.workerConcurrency(), 1),
                Durations.parseOrDefault(file.workerLockDuration(), defaults.workerLockDuration(), minTick),
                sanitizeInt(file.workerMaxAttempts(), defaults.workerMaxAttempts(), 1),
                Durations.parseOrDefault(file.workerPollInterval(), defaults.workerPollInterval(), Duration.ofMillis(10)),
                sanitizeBoolean(file.seedSyncEnabled(), defaults.seedSyncEnabled()),
                Durations.parseOrDefault(file.seedSyncInterval(), defaults.seedSyncInterval(), minTick),
                sanitizeRelays(file.seedRelays(), defaults.seedRelays()),
                file.seedFile() == null || file.seedFile().isBlank() ? defaults.seedFile() : file.seedFile().trim(),
                Durations.parseOrDefault(file.probeTimeout(), defaults.probeTimeout(), Duration.ofMillis(100))
        );
    }

    public String queueName() {
        return "relaywatch/" + monitorSlug;
    }

    public WatchSettings withWorkerConcurrency(int concurrency) {
        return new WatchSettings(monitorSlug, checkInterval, checkExpires, trawlChunkSize, trawlCheckEnabled,
                trawlCheckInterval, Math.max(1, concurrency), workerLockDuration, workerMaxAttempts,
                workerPollInterval, seedSyncEnabled, seedSyncInterval, seedRelays, seedFile, probeTimeout);
    }

    public WatchSettings withTrawlChunkSize(int chunkSize) {
        return new WatchSettings(monitorSlug, checkInterval, checkExpires, Math.max(1, chunkSize), trawlCheckEnabled,
                trawlCheckInterval, workerConcurrency, workerLockDuration, workerMaxAttempts,
                workerPollInterval, seedSyncEnabled, seedSyncInterval, seedRelays, seedFile, probeTimeout);
    }

    public WatchSettings withSeedRelays(List<String> relays) {
        return new WatchSettings(monitorSlug, checkInterval, checkExpires, trawlChunkSize, trawlCheckEnabled,
                trawlCheckInterval, workerConcurrency, workerLockDuration, workerMaxAttempts,
                workerPollInterval, seedSyncEnabled, seedSyncInterval, relays, seedFile, probeTimeout);
    }

    public WatchSettings withWorkerPollInterval(Duration pollInterval) {
        return new WatchSettings(monitorSlug, checkInterval, checkExpires, trawlChunkSize, trawlCheckEnabled,
                trawlCheckInterval, workerConcurrency, workerLockDuration, workerMaxAttempts,
                pollInterval, seedSyncEnabled, seedSyncInterval, seedRelays, seedFile, probeTimeout);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static List<String> sanitizeRelays(List<String> raw, List<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String url : raw) {
            if (url != null && !url.isBlank()) {
                out.add(url.trim());
            }
        }
        return out;
    }

    private static String sanitizeSlug(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        return value.isBlank() ? fallback : value;
    }
}
