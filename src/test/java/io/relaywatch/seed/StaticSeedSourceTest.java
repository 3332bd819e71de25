package io.relaywatch.seed;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class StaticSeedSourceTest {

    @Test
    void mergesListAndFileWithoutDuplicates() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-seed-");
        try {
            Path file = root.resolve("relays.txt");
            Files.writeString(file, "# seed relays\nwss://b.example\n\n  wss://a.example  \nwss://c.example\n", StandardCharsets.UTF_8);
            StaticSeedSource source = new StaticSeedSource(List.of("wss://a.example", " "), file);

            SeedResult result = source.bootstrap("test");
            Assertions.assertEquals(List.of("wss://a.example", "wss://b.example", "wss://c.example"), result.relays());
            Assertions.assertTrue(result.updatedAtMs() > 0L);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingFileFallsBackToTheList() {
        StaticSeedSource source = new StaticSeedSource(List.of("wss://a.example"), Path.of("does-not-exist.txt"));
        SeedResult result = source.bootstrap("test");
        Assertions.assertEquals(List.of("wss://a.example"), result.relays());
        Assertions.assertEquals(0L, result.updatedAtMs());
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
