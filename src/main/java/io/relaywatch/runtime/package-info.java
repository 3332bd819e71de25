/**
 * Runtime orchestration package.
 *
 * <p>{@link io.relaywatch.runtime.RelayWatchRuntime} owns the daemon lifecycle:
 * bootstrap, scheduled population and seed sync, worker start and graceful stop.
 */
package io.relaywatch.runtime;
