package io.relaywatch.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class RelayWatchConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "relaywatch-settings.json";

    private final Path rootDir;

    public RelayWatchConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static RelayWatchConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new RelayWatchConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("relaywatch.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path journalRoot() {
        return rootDir.resolve("journal");
    }

    public Path jobJournalFile() {
        return journalRoot().resolve("jobs.log");
    }
}
