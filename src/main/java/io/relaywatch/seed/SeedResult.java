package io.relaywatch.seed;

import java.util.List;

/**
 * @param updatedAtMs when the source last changed, or 0 when unknown
 */
public record SeedResult(List<String> relays, long updatedAtMs) {
    public SeedResult {
        relays = relays == null ? List.of() : List.copyOf(relays);
    }

    public static SeedResult empty() {
        return new SeedResult(List.of(), 0L);
    }
}
