package io.relaywatch.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Process-local {@link RecordStore}. Nothing survives a restart.
 */
public final class InMemoryRecordStore implements RecordStore {
    private final ConcurrentSkipListMap<String, ObjectNode> records = new ConcurrentSkipListMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Override
    public Optional<ObjectNode> get(String key) {
        ensureOpen();
        ObjectNode value = records.get(key);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }

    @Override
    public List<ObjectNode> getOnline(String keyPrefix) {
        ensureOpen();
        return range(keyPrefix).values().stream()
                .filter(value -> {
                    JsonNode connect = value.get("connect");
                    return connect != null && connect.isBoolean() && connect.booleanValue();
                })
                .map(ObjectNode::deepCopy)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<JsonNode> getMeta(String key, String field) {
        ensureOpen();
        ObjectNode value = records.get(key);
        if (value == null || field == null || !value.has(field)) {
            return Optional.empty();
        }
        return Optional.of(value.get(field).deepCopy());
    }

    @Override
    public String insert(String key, ObjectNode value) {
        ensureOpen();
        records.put(key, value.deepCopy());
        return key;
    }

    @Override
    public Optional<String> insertIfNotExists(String key, ObjectNode value) {
        ensureOpen();
        return records.putIfAbsent(key, value.deepCopy()) == null ? Optional.of(key) : Optional.empty();
    }

    @Override
    public boolean update(String key, ObjectNode value) {
        ensureOpen();
        return records.replace(key, value.deepCopy()) != null;
    }

    @Override
    public boolean patch(String key, ObjectNode value) {
        ensureOpen();
        ObjectNode overlay = value.deepCopy();
        ObjectNode merged = records.computeIfPresent(key, (k, current) -> {
            ObjectNode next = current.deepCopy();
            next.setAll(overlay);
            return next;
        });
        return merged != null;
    }

    @Override
    public boolean delete(String key) {
        ensureOpen();
        return records.remove(key) != null;
    }

    @Override
    public boolean deleteIfExists(String key) {
        return delete(key);
    }

    @Override
    public Stream<StoredRecord> scan(String keyPrefix) {
        ensureOpen();
        return range(keyPrefix).entrySet().stream()
                .map(e -> new StoredRecord(e.getKey(), e.getValue().deepCopy()));
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private ConcurrentNavigableMap<String, ObjectNode> range(String keyPrefix) {
        if (keyPrefix == null || keyPrefix.isEmpty()) {
            return records;
        }
        return records.subMap(keyPrefix, true, keyPrefix + Character.MAX_VALUE, false);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new StoreUnavailableException("Record store is closed");
        }
    }
}
