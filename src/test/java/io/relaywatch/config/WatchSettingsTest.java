package io.relaywatch.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

final class WatchSettingsTest {

    @Test
    void missingFileFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-settings-");
        try {
            WatchSettings settings = WatchSettings.load(root.resolve("absent.json"));
            Assertions.assertEquals(WatchSettings.defaults(), settings);
            Assertions.assertEquals("relaywatch/default", settings.queueName());
            Assertions.assertEquals(50, settings.trawlChunkSize());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreSanitized() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-settings-");
        try {
            Path file = root.resolve(RelayWatchConfig.SETTINGS_FILE);
            Files.writeString(file, "{"
                    + "\"monitor_slug\":\"EU West #1\","
                    + "\"check_interval\":\"100ms\","
                    + "\"check_expires\":\"2h\","
                    + "\"trawl_chunk_size\":0,"
                    + "\"worker_concurrency\":4,"
                    + "\"seed_relays\":[\" wss://a.example \",\"\",null],"
                    + "\"unknown_field\":true"
                    + "}", StandardCharsets.UTF_8);

            WatchSettings settings = WatchSettings.load(file);
            Assertions.assertEquals("eu-west-1", settings.monitorSlug());
            Assertions.assertEquals("relaywatch/eu-west-1", settings.queueName());
            Assertions.assertEquals(Duration.ofSeconds(1), settings.checkInterval());
            Assertions.assertEquals(Duration.ofHours(2), settings.checkExpires());
            Assertions.assertEquals(1, settings.trawlChunkSize());
            Assertions.assertEquals(4, settings.workerConcurrency());
            Assertions.assertEquals(List.of("wss://a.example"), settings.seedRelays());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-settings-");
        try {
            Path file = root.resolve(RelayWatchConfig.SETTINGS_FILE);
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> WatchSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
