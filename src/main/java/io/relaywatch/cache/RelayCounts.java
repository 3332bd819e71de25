package io.relaywatch.cache;

import io.relaywatch.model.Network;

/**
 * Sizes of the {@link RelayQueries} result sets, without materialising them.
 */
public final class RelayCounts {
    private final RelayCache cache;

    RelayCounts(RelayCache cache) {
        this.cache = cache;
    }

    public long all() {
        return allIds();
    }

    public long allIds() {
        return cache.selectCount(Where.any());
    }

    public long online() {
        return cache.selectCount(RelayQueries.whereOnline());
    }

    public long network(Network network) {
        return cache.selectCount(RelayQueries.whereNetwork(network));
    }

    public long publicRelays() {
        return cache.selectCount(RelayQueries.wherePublic());
    }

    public long paid() {
        return cache.selectCount(RelayQueries.wherePaid());
    }

    public long dead() {
        return cache.selectCount(RelayQueries.whereDead());
    }

    public long supportsNip(int nip) {
        return cache.selectCount(RelayQueries.whereSupportsNip(nip));
    }

    public long doesNotSupportNip(int nip) {
        return cache.selectCount(RelayQueries.whereDoesNotSupportNip(nip));
    }
}
