package io.relaywatch.cache;

import io.relaywatch.util.Jsons;

public final class RelayRequirements {
    private final RelayCache cache;

    RelayRequirements(RelayCache cache) {
        this.cache = cache;
    }

    /**
     * True when the last check saw an auth challenge, or the NIP-11 document
     * declares {@code auth_required}.
     */
    public boolean auth(String url) {
        return cache.one(url)
                .map(record -> RelayQueries.whereAuthRequired().test(record.document()))
                .orElse(false);
    }

    public boolean payment(String url) {
        return cache.has().limitation(url, "payment_required").map(Jsons::truthy).orElse(false);
    }
}
