package io.relaywatch.runtime;

import io.relaywatch.config.RelayWatchConfig;
import io.relaywatch.config.WatchSettings;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.queue.JobState;
import io.relaywatch.seed.SeedResult;
import io.relaywatch.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

final class RelayWatchRuntimeTest {
    private static final List<String> SEEDS = List.of("wss://a.example", "wss://b.example");

    @Test
    void daemonBootstrapsChecksAndStopsCleanly() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-runtime-");
        try {
            RelayWatchRuntime runtime = runtime(root);
            RelayWatchRuntime.StartOutcome started = runtime.start();
            Assertions.assertEquals("relaywatch/default", started.queueName());
            Assertions.assertEquals(2, started.bootstrapped());
            Assertions.assertEquals(2, started.schedules());

            long deadline = System.currentTimeMillis() + 10_000L;
            while (runtime.cache().get().online().size() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20L);
            }
            Assertions.assertEquals(2, runtime.cache().get().online().size());
            Assertions.assertTrue(runtime.cache().one("wss://a.example").orElseThrow().checkedAt().isPresent());

            while (runtime.controller().counts().get(JobState.COMPLETED) < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20L);
            }
            Assertions.assertEquals(2, runtime.controller().counts().get(JobState.COMPLETED));

            Assertions.assertTrue(runtime.stop(Duration.ofSeconds(5)));
            Assertions.assertTrue(runtime.journal().verify().intact());
            Assertions.assertTrue(runtime.journal().verify().rows() >= 4);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void bootstrapOnlyRunsAgainstAnEmptyCache() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-runtime-");
        try {
            RelayWatchRuntime first = runtime(root);
            first.init();
            Assertions.assertEquals(2, first.maybeBootstrap());
            Assertions.assertEquals(0, first.maybeBootstrap());
            first.stop(Duration.ZERO);

            RelayWatchRuntime second = runtime(root);
            second.init();
            Assertions.assertEquals(0, second.maybeBootstrap());
            Assertions.assertEquals(2L, second.cache().count().all());
            Assertions.assertTrue(second.syncRelaysIn().isEmpty());
            second.stop(Duration.ZERO);
        } finally {
            deleteRecursively(root);
        }
    }

    private static RelayWatchRuntime runtime(Path root) {
        RelayWatchConfig config = RelayWatchConfig.fromRoot(root.toString());
        WatchSettings settings = WatchSettings.defaults().withWorkerPollInterval(Duration.ofMillis(20));
        RelayWatchRuntime.Options options = new RelayWatchRuntime.Options(
                false,
                url -> Jsons.object().put(RelayRecord.CONNECT, true),
                daemon -> new SeedResult(SEEDS, 0L),
                "test-worker"
        );
        return new RelayWatchRuntime(config, settings, options);
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
