package io.relaywatch.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Key/value document store the relay cache is built on.
 *
 * <p>Backends implement the primitives; {@link #exists}, {@link #insertIfNotExists}
 * and {@link #upsert} are derived from them and may be overridden with atomic
 * variants. Values handed in and out are owned by the caller: backends copy them.
 */
public interface RecordStore extends AutoCloseable {

    Optional<ObjectNode> get(String key);

    /**
     * Every record under {@code keyPrefix} whose {@code connect} flag is true.
     */
    List<ObjectNode> getOnline(String keyPrefix);

    /**
     * A single top-level field of a stored record, without materialising the
     * whole document where the backend can avoid it.
     */
    Optional<JsonNode> getMeta(String key, String field);

    /**
     * Put. Overwrites any existing value under {@code key}.
     *
     * @return the key written
     */
    String insert(String key, ObjectNode value);

    /**
     * Full replace of an existing record.
     *
     * @return false when nothing is stored under {@code key}
     */
    boolean update(String key, ObjectNode value);

    /**
     * Shallow overlay of {@code value}'s top-level fields onto an existing record.
     *
     * @return false when nothing is stored under {@code key}
     */
    boolean patch(String key, ObjectNode value);

    boolean delete(String key);

    boolean deleteIfExists(String key);

    /**
     * Lazy stream over all records under {@code keyPrefix}, ordered by key.
     * Single use; close it to release backend resources.
     */
    Stream<StoredRecord> scan(String keyPrefix);

    @Override
    void close();

    default boolean exists(String key) {
        return get(key).isPresent();
    }

    /**
     * @return the key when a record was written, empty when one already existed
     */
    default Optional<String> insertIfNotExists(String key, ObjectNode value) {
        if (exists(key)) {
            return Optional.empty();
        }
        return Optional.of(insert(key, value));
    }

    default String upsert(String key, ObjectNode value) {
        if (update(key, value)) {
            return key;
        }
        return insert(key, value);
    }
}
