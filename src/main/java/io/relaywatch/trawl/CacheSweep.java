package io.relaywatch.trawl;

/**
 * A full pass over the cached relays.
 */
@FunctionalInterface
public interface CacheSweep {
    /**
     * @return records written
     */
    int sweep();
}
