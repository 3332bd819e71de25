package io.relaywatch.seed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Seeds from a fixed list plus an optional newline-separated file. Blank lines
 * and lines starting with {@code #} in the file are skipped; duplicates keep
 * their first position.
 */
public final class StaticSeedSource implements SeedSource {
    private static final Logger log = LoggerFactory.getLogger(StaticSeedSource.class);

    private final List<String> relays;
    private final Path seedFile;

    public StaticSeedSource(List<String> relays, Path seedFile) {
        this.relays = relays == null ? List.of() : List.copyOf(relays);
        this.seedFile = seedFile;
    }

    @Override
    public SeedResult bootstrap(String daemonName) {
        Set<String> out = new LinkedHashSet<>();
        for (String relay : relays) {
            if (relay != null && !relay.isBlank()) {
                out.add(relay.trim());
            }
        }
        long updatedAtMs = 0L;
        if (seedFile != null && Files.isRegularFile(seedFile)) {
            try {
                for (String line : Files.readAllLines(seedFile, StandardCharsets.UTF_8)) {
                    String trimmed = line.trim();
                    if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                        out.add(trimmed);
                    }
                }
                updatedAtMs = Files.getLastModifiedTime(seedFile).toMillis();
            } catch (IOException e) {
                throw new RuntimeException("Failed to read seed file: " + seedFile, e);
            }
        } else if (seedFile != null) {
            log.warn("Seed file {} not found, using the configured list only", seedFile);
        }
        log.info("{} bootstrap: {} seed relay(s)", daemonName, out.size());
        return new SeedResult(List.copyOf(out), updatedAtMs);
    }
}
