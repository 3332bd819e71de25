/**
 * RelayWatch source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.relaywatch.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.relaywatch.cli.RelayWatchCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.relaywatch.runtime.RelayWatchRuntime} wires the cache, queue, schedules and trawler.</li>
 *   <li>{@code io.relaywatch.cache.RelayCache} is the relay record facade over a {@code RecordStore}.</li>
 *   <li>{@code io.relaywatch.queue.SqliteJobQueue} is the durable job queue with lease fencing.</li>
 * </ul>
 */
package io.relaywatch;
