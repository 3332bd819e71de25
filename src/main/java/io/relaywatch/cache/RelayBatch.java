package io.relaywatch.cache;

import io.relaywatch.model.RelayRecord;
import io.relaywatch.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * List forms of the single-record writes. Items are applied one at a time in
 * input order; a failing item is logged and left out of the result, the rest
 * still go through.
 */
public final class RelayBatch {
    private static final Logger log = LoggerFactory.getLogger(RelayBatch.class);

    private final RelayCache cache;

    RelayBatch(RelayCache cache) {
        this.cache = cache;
    }

    public List<String> insert(List<RelayRecord> records) {
        return each("insert", records, record -> Optional.of(cache.insert(record)));
    }

    /**
     * @return ids of the records actually written; existing ones are skipped
     */
    public List<String> insertIfNotExists(List<RelayRecord> records) {
        return each("insertIfNotExists", records, cache::insertIfNotExists);
    }

    public List<String> upsert(List<RelayRecord> records) {
        return each("upsert", records, record -> Optional.of(cache.upsert(record)));
    }

    public List<String> update(List<RelayRecord> records) {
        return each("update", records, record -> Optional.of(cache.update(record)));
    }

    /**
     * @return the URLs that were deleted
     */
    public List<String> delete(List<String> urls) {
        return each("delete", urls, url -> {
            cache.delete(url);
            return Optional.of(url);
        });
    }

    private <T> List<String> each(String operation, List<T> items, Function<T, Optional<String>> op) {
        if (items == null) {
            throw new RelayValidationException("Relay batch " + operation + ": must be a list");
        }
        List<String> out = new ArrayList<>();
        for (T item : items) {
            try {
                op.apply(item).ifPresent(out::add);
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Relay batch {} skipped an item: {}", operation, e.getMessage());
            }
        }
        return out;
    }
}
