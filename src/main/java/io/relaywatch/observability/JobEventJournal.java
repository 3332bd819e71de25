package io.relaywatch.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.queue.JobEvent;
import io.relaywatch.queue.JobEvents;
import io.relaywatch.util.Hashing;
import io.relaywatch.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

/**
 * Append-only JSONL record of queue events. Each row carries the hash of the
 * previous row, so truncation or edits show up in {@link #verify()}.
 */
public final class JobEventJournal implements JobEvents.Listener {
    private static final Logger log = LoggerFactory.getLogger(JobEventJournal.class);

    private final Path journalFile;
    private String previousHash;

    public JobEventJournal(Path journalFile) {
        this.journalFile = journalFile;
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Journal {} created concurrently", journalFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize job journal: " + journalFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path file() {
        return journalFile;
    }

    @Override
    public synchronized void onEvent(JobEvent event) {
        ObjectNode row = Jsons.object();
        row.put("timestamp", Instant.ofEpochMilli(event.atMs()).toString());
        row.put("queue", event.queueName());
        row.put("event", event.type().name());
        row.put("job_id", event.jobId());
        row.put("kind", event.kind());
        row.put("detail", event.detail());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        try {
            Files.writeString(journalFile, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write job journal", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes the hash chain from the first row.
     */
    public synchronized Verification verify() {
        List<String> lines = readLines();
        String expectedPrev = "";
        int rows = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            rows++;
            ObjectNode row = Jsons.readObject(line);
            String hash = row.path("hash").asText("");
            row.remove("hash");
            if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                return new Verification(false, rows, rows);
            }
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                return new Verification(false, rows, rows);
            }
            expectedPrev = hash;
        }
        return new Verification(true, rows, 0);
    }

    private String loadLastHash() {
        String last = "";
        for (String line : readLines()) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            log.warn("Last row of {} is not valid JSON, starting a new chain", journalFile);
            return "";
        }
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(journalFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read job journal: " + journalFile, e);
        }
    }

    /**
     * @param brokenAtRow 1-based row where the chain breaks, 0 when intact
     */
    public record Verification(boolean intact, int rows, int brokenAtRow) {
    }
}
