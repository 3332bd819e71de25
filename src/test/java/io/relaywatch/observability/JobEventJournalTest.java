package io.relaywatch.observability;

import io.relaywatch.queue.JobEvent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class JobEventJournalTest {

    @Test
    void rowsAreHashChainedAcrossReopen() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-journal-");
        try {
            Path file = root.resolve("journal").resolve("jobs.log");
            JobEventJournal journal = new JobEventJournal(file);
            Assertions.assertEquals("", journal.currentHash());

            journal.onEvent(new JobEvent(JobEvent.Type.ADDED, "relaywatch/test", "j1", "checkSingle", null, 1_000L));
            journal.onEvent(new JobEvent(JobEvent.Type.COMPLETED, "relaywatch/test", "j1", "checkSingle", null, 2_000L));
            String head = journal.currentHash();
            Assertions.assertFalse(head.isBlank());

            JobEventJournal reopened = new JobEventJournal(file);
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.onEvent(JobEvent.ofQueue(JobEvent.Type.DRAINED, "relaywatch/test", 3_000L));

            JobEventJournal.Verification verification = reopened.verify();
            Assertions.assertTrue(verification.intact());
            Assertions.assertEquals(3, verification.rows());
            Assertions.assertEquals(0, verification.brokenAtRow());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("relaywatch-test-journal-");
        try {
            Path file = root.resolve("jobs.log");
            JobEventJournal journal = new JobEventJournal(file);
            journal.onEvent(new JobEvent(JobEvent.Type.ADDED, "relaywatch/test", "j1", "checkSingle", null, 1_000L));
            journal.onEvent(new JobEvent(JobEvent.Type.FAILED, "relaywatch/test", "j1", "checkSingle", "boom", 2_000L));
            journal.onEvent(new JobEvent(JobEvent.Type.ADDED, "relaywatch/test", "j2", "checkSingle", null, 3_000L));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.set(1, lines.get(1).replace("boom", "fine"));
            Files.write(file, lines, StandardCharsets.UTF_8);

            JobEventJournal.Verification verification = journal.verify();
            Assertions.assertFalse(verification.intact());
            Assertions.assertEquals(2, verification.brokenAtRow());
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
