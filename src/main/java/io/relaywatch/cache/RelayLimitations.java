package io.relaywatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Lookups into the {@code limitation} object of a relay's NIP-11 document.
 * Missing data is logged and reported as empty, never thrown.
 */
public final class RelayLimitations {
    private static final Logger log = LoggerFactory.getLogger(RelayLimitations.class);

    private final RelayCache cache;

    RelayLimitations(RelayCache cache) {
        this.cache = cache;
    }

    public Optional<JsonNode> limitation(String url, String key) {
        if (key == null || key.isBlank()) {
            log.warn("Limitation key is required");
            return Optional.empty();
        }
        JsonNode limitation = cache.get().info(url).map(info -> info.get("limitation")).orElse(null);
        JsonNode value = limitation == null || !limitation.isObject() ? null : limitation.get(key);
        if (value == null || value.isNull()) {
            log.warn("Relay {} does not have limitation {} in its info document (NIP-11)", url, key);
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
