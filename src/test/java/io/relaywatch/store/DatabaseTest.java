package io.relaywatch.store;

import io.relaywatch.config.RelayWatchConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class DatabaseTest {

    @Test
    void jobsTableIsCreatedWithLeaseAndRetentionColumns() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-db-");
        try {
            RelayWatchConfig config = RelayWatchConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            new Database(config).init();

            List<String> columns = new ArrayList<>();
            try (Connection conn = db.openConnection();
                 Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("PRAGMA table_info(jobs)")) {
                while (rs.next()) {
                    columns.add(rs.getString("name"));
                }
            }
            Assertions.assertTrue(columns.contains("lease_epoch"));
            Assertions.assertTrue(columns.contains("stalled_count"));
            Assertions.assertTrue(columns.contains("finished_at_ms"));
            Assertions.assertEquals(columns.size(), columns.stream().distinct().count());
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
