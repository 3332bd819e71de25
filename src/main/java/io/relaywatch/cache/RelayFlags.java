package io.relaywatch.cache;

import io.relaywatch.model.RelayRecord;

import java.util.Optional;
import java.util.function.Function;

/**
 * Health flags of a single relay. Unknown relays and unset flags read as false.
 */
public final class RelayFlags {
    private final RelayCache cache;

    RelayFlags(RelayCache cache) {
        this.cache = cache;
    }

    public boolean online(String url) {
        return flag(url, RelayRecord::connect);
    }

    public boolean readable(String url) {
        return flag(url, RelayRecord::readable);
    }

    public boolean writable(String url) {
        return flag(url, RelayRecord::writable);
    }

    public boolean dead(String url) {
        return flag(url, RelayRecord::dead);
    }

    public boolean publiclyAccessible(String url) {
        return !cache.requires().payment(url) && !cache.requires().auth(url);
    }

    private boolean flag(String url, Function<RelayRecord, Optional<Boolean>> field) {
        return cache.one(url).flatMap(field).orElse(false);
    }
}
