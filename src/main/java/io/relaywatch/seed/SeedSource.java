package io.relaywatch.seed;

/**
 * Where relay URLs come from before anything has been discovered.
 */
@FunctionalInterface
public interface SeedSource {
    SeedResult bootstrap(String daemonName);
}
