package io.relaywatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.model.Network;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.model.RelayUrl;
import io.relaywatch.store.RecordStore;
import io.relaywatch.store.StoredRecord;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Relay records keyed by {@link RelayIds#id(String)}, on top of any {@link RecordStore}.
 *
 * <p>Single-record writes validate first and fail with {@link RelayValidationException}
 * or {@link RelayNotFoundException}. The typed helpers ({@link #get()}, {@link #count()},
 * {@link #batch()} and friends) are views over this cache and hold no state of their own.
 */
public final class RelayCache implements AutoCloseable {
    private final RecordStore store;
    private final Clock clock;

    private final RelayQueries queries;
    private final RelayCounts counts;
    private final RelayFlags flags;
    private final RelayLimitations limitations;
    private final RelayRequirements requirements;
    private final RelaySupport support;
    private final RelayLimits limits;
    private final RelayBatch batch;

    public RelayCache(RecordStore store) {
        this(store, Clock.systemUTC());
    }

    public RelayCache(RecordStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.queries = new RelayQueries(this);
        this.counts = new RelayCounts(this);
        this.flags = new RelayFlags(this);
        this.limitations = new RelayLimitations(this);
        this.requirements = new RelayRequirements(this);
        this.support = new RelaySupport(this);
        this.limits = new RelayLimits(this);
        this.batch = new RelayBatch(this);
    }

    public RecordStore store() {
        return store;
    }

    public RelayQueries get() {
        return queries;
    }

    public RelayCounts count() {
        return counts;
    }

    public RelayFlags is() {
        return flags;
    }

    public RelayLimitations has() {
        return limitations;
    }

    public RelayRequirements requires() {
        return requirements;
    }

    public RelaySupport supports() {
        return support;
    }

    public RelayLimits limits() {
        return limits;
    }

    public RelayBatch batch() {
        return batch;
    }

    public String insert(RelayRecord record) {
        String url = validate(record);
        String id = RelayIds.id(url);
        return store.insert(id, stamp(record, url, id));
    }

    /**
     * @return the id when written, empty when a record for the URL already existed
     */
    public Optional<String> insertIfNotExists(RelayRecord record) {
        String url = validate(record);
        String id = RelayIds.id(url);
        return store.insertIfNotExists(id, stamp(record, url, id));
    }

    /**
     * Full replace of an existing record. {@code created_at} carries over when the
     * replacement does not set it.
     */
    public String update(RelayRecord record) {
        String url = validate(record);
        String id = RelayIds.id(url);
        ObjectNode current = store.get(id).orElseThrow(() -> new RelayNotFoundException("update", url));
        ObjectNode next = stamp(record, url, id);
        JsonNode createdAt = current.get(RelayRecord.CREATED_AT);
        if (createdAt != null && !createdAt.isNull()) {
            next.set(RelayRecord.CREATED_AT, createdAt);
        }
        if (!store.update(id, next)) {
            throw new RelayNotFoundException("update", url);
        }
        return id;
    }

    /**
     * Shallow overlay of the record's fields. {@code url} and {@code #} in the
     * patch are ignored.
     */
    public String patch(RelayRecord record) {
        String url = validate(record);
        String id = RelayIds.id(url);
        ObjectNode overlay = record.document().deepCopy();
        overlay.remove(RelayRecord.URL);
        overlay.remove(RelayRecord.ID);
        overlay.put(RelayRecord.UPDATED_AT, clock.millis());
        if (!store.patch(id, overlay)) {
            throw new RelayNotFoundException("patch", url);
        }
        return id;
    }

    public String patch(String url, ObjectNode fields) {
        RelayRecord record = RelayRecord.withUrl(url);
        if (fields != null) {
            ObjectNode overlay = fields.deepCopy();
            overlay.remove(RelayRecord.URL);
            record.document().setAll(overlay);
        }
        return patch(record);
    }

    public String upsert(RelayRecord record) {
        String url = validate(record);
        if (exists(url)) {
            return update(record);
        }
        return insert(record);
    }

    public void delete(String url) {
        String canonical = canonicalUrl(url);
        if (!store.delete(RelayIds.id(canonical))) {
            throw new RelayNotFoundException("delete", canonical);
        }
    }

    public void delete(RelayRecord record) {
        delete(record == null ? null : record.url());
    }

    public boolean exists(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        return store.exists(RelayIds.id(url.trim()));
    }

    public Optional<RelayRecord> one(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        return store.get(RelayIds.id(url.trim())).map(RelayRecord::of);
    }

    /**
     * Advisory freshness metadata. Never enforced by the cache.
     */
    public Optional<JsonNode> retention(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        return store.getMeta(RelayIds.id(url.trim()), RelayRecord.RETENTION).filter(node -> !node.isNull());
    }

    /**
     * Lazy, single-use query over every cached relay. Close the stream when done.
     */
    public Stream<JsonNode> select(Projection projection, Where where) {
        Projection shape = Projection.orAll(projection);
        Where filter = where == null ? Where.any() : where;
        Stream<StoredRecord> rows = store.scan(RelayIds.PREFIX);
        return rows.filter(row -> filter.test(row.value()))
                .map(row -> shape.apply(row.key(), row.value()));
    }

    List<JsonNode> selectList(Projection projection, Where where) {
        try (Stream<JsonNode> rows = select(projection, where)) {
            return rows.collect(Collectors.toList());
        }
    }

    long selectCount(Where where) {
        try (Stream<JsonNode> rows = select(Projection.ids(), where)) {
            return rows.count();
        }
    }

    /**
     * @return the canonical URL
     */
    public String validate(RelayRecord record) {
        if (record == null) {
            throw new RelayValidationException("Relay object must have a url property");
        }
        return canonicalUrl(record.url());
    }

    static String canonicalUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new RelayValidationException("Relay object must have a url property");
        }
        String trimmed = url.trim();
        URI uri;
        try {
            uri = URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw new RelayValidationException("Relay url is not a valid URI: " + trimmed);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"ws".equals(scheme) && !"wss".equals(scheme)) {
            throw new RelayValidationException("Relay url must use ws:// or wss://: " + trimmed);
        }
        String host = RelayUrl.host(uri);
        if (host == null || host.isBlank()) {
            throw new RelayValidationException("Relay url has no host: " + trimmed);
        }
        return trimmed;
    }

    private ObjectNode stamp(RelayRecord record, String url, String id) {
        long nowMs = clock.millis();
        ObjectNode doc = record.document().deepCopy();
        doc.put(RelayRecord.ID, id);
        doc.put(RelayRecord.URL, url);
        JsonNode network = doc.get(RelayRecord.NETWORK);
        if (network == null || network.isNull()) {
            doc.put(RelayRecord.NETWORK, Network.ofUrl(url).label());
        }
        JsonNode createdAt = doc.get(RelayRecord.CREATED_AT);
        if (createdAt == null || createdAt.isNull()) {
            doc.put(RelayRecord.CREATED_AT, nowMs);
        }
        doc.put(RelayRecord.UPDATED_AT, nowMs);
        return doc;
    }

    @Override
    public void close() {
        store.close();
    }
}
