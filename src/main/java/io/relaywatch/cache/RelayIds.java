package io.relaywatch.cache;

import io.relaywatch.util.Hashing;

public final class RelayIds {
    public static final String PREFIX = "Relay@";

    private RelayIds() {
    }

    /**
     * Store key for a relay URL. Callers pass the canonical (trimmed) URL.
     */
    public static String id(String url) {
        if (url == null) {
            throw new RelayValidationException("Relay url is required");
        }
        return PREFIX + Hashing.sha256Hex(url);
    }
}
