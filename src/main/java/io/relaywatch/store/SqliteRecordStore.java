package io.relaywatch.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.relaywatch.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link RecordStore} over the {@code records} table. Documents are stored as
 * JSON text; the {@code kind} column holds the key prefix before {@code '@'}.
 */
public final class SqliteRecordStore implements RecordStore {
    private final Database database;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SqliteRecordStore(Database database) {
        this.database = database;
    }

    @Override
    public Optional<ObjectNode> get(String key) {
        ensureOpen();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT document FROM records WHERE record_key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(Jsons.readObject(rs.getString("document")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read record: " + key, e);
        }
    }

    @Override
    public List<ObjectNode> getOnline(String keyPrefix) {
        ensureOpen();
        String sql = """
                SELECT document FROM records
                WHERE substr(record_key,1,?)=? AND json_extract(document,'$.connect')=1
                ORDER BY record_key
                """;
        List<ObjectNode> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bindPrefix(ps, 1, keyPrefix);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(Jsons.readObject(rs.getString("document")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read online records under " + keyPrefix, e);
        }
    }

    @Override
    public Optional<JsonNode> getMeta(String key, String field) {
        ensureOpen();
        if (field == null || field.isBlank()) {
            return Optional.empty();
        }
        String path = "$.\"" + field.replace("\"", "") + "\"";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT json_type(document,?) AS t, json_extract(document,?) AS v FROM records WHERE record_key=?")) {
            ps.setString(1, path);
            ps.setString(2, path);
            ps.setString(3, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String type = rs.getString("t");
                if (type == null) {
                    return Optional.empty();
                }
                return Optional.of(toNode(type, rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read field " + field + " of record: " + key, e);
        }
    }

    private JsonNode toNode(String type, ResultSet rs) throws SQLException {
        return switch (type) {
            case "null" -> NullNode.getInstance();
            case "true" -> BooleanNode.TRUE;
            case "false" -> BooleanNode.FALSE;
            case "integer" -> LongNode.valueOf(rs.getLong("v"));
            case "real" -> DoubleNode.valueOf(rs.getDouble("v"));
            case "text" -> TextNode.valueOf(rs.getString("v"));
            default -> readTree(rs.getString("v"));
        };
    }

    private JsonNode readTree(String raw) {
        try {
            return Jsons.mapper().readTree(raw);
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse stored JSON fragment", e);
        }
    }

    @Override
    public String insert(String key, ObjectNode value) {
        ensureOpen();
        long nowMs = System.currentTimeMillis();
        String sql = """
                INSERT INTO records(record_key,kind,document,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?)
                ON CONFLICT(record_key) DO UPDATE SET document=excluded.document, updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, kindOf(key));
            ps.setString(3, Jsons.toCompactJson(value));
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            ps.executeUpdate();
            return key;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert record: " + key, e);
        }
    }

    @Override
    public Optional<String> insertIfNotExists(String key, ObjectNode value) {
        ensureOpen();
        long nowMs = System.currentTimeMillis();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR IGNORE INTO records(record_key,kind,document,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?)")) {
            ps.setString(1, key);
            ps.setString(2, kindOf(key));
            ps.setString(3, Jsons.toCompactJson(value));
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            return ps.executeUpdate() > 0 ? Optional.of(key) : Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert record: " + key, e);
        }
    }

    @Override
    public boolean update(String key, ObjectNode value) {
        ensureOpen();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE records SET document=?,updated_at_ms=? WHERE record_key=?")) {
            ps.setString(1, Jsons.toCompactJson(value));
            ps.setLong(2, System.currentTimeMillis());
            ps.setString(3, key);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update record: " + key, e);
        }
    }

    @Override
    public boolean patch(String key, ObjectNode value) {
        ensureOpen();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement("SELECT document FROM records WHERE record_key=?");
                 PreparedStatement write = c.prepareStatement(
                         "UPDATE records SET document=?,updated_at_ms=? WHERE record_key=?")) {
                read.setString(1, key);
                ObjectNode current;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()) {
                        c.rollback();
                        return false;
                    }
                    current = Jsons.readObject(rs.getString("document"));
                }
                current.setAll(value);
                write.setString(1, Jsons.toCompactJson(current));
                write.setLong(2, System.currentTimeMillis());
                write.setString(3, key);
                write.executeUpdate();
                c.commit();
                return true;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to patch record: " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        ensureOpen();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM records WHERE record_key=?")) {
            ps.setString(1, key);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete record: " + key, e);
        }
    }

    @Override
    public boolean deleteIfExists(String key) {
        return delete(key);
    }

    @Override
    public boolean exists(String key) {
        ensureOpen();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM records WHERE record_key=? LIMIT 1")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check record: " + key, e);
        }
    }

    @Override
    public Stream<StoredRecord> scan(String keyPrefix) {
        ensureOpen();
        Connection c = database.openConnection();
        PreparedStatement ps = null;
        ResultSet rs;
        try {
            ps = c.prepareStatement(
                    "SELECT record_key,document FROM records WHERE substr(record_key,1,?)=? ORDER BY record_key");
            bindPrefix(ps, 1, keyPrefix);
            rs = ps.executeQuery();
        } catch (SQLException e) {
            closeQuietly(ps, c, e);
            throw new RuntimeException("Failed to scan records under " + keyPrefix, e);
        }
        PreparedStatement statement = ps;
        ResultSet cursor = rs;
        Spliterator<StoredRecord> rows = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super StoredRecord> action) {
                try {
                    if (!cursor.next()) {
                        return false;
                    }
                    action.accept(new StoredRecord(cursor.getString("record_key"), Jsons.readObject(cursor.getString("document"))));
                    return true;
                } catch (SQLException e) {
                    throw new RuntimeException("Failed to advance record scan under " + keyPrefix, e);
                }
            }
        };
        return StreamSupport.stream(rows, false).onClose(() -> {
            try {
                cursor.close();
                statement.close();
                c.close();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to close record scan", e);
            }
        });
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new StoreUnavailableException("Record store is closed");
        }
    }

    private static void bindPrefix(PreparedStatement ps, int index, String keyPrefix) throws SQLException {
        String prefix = keyPrefix == null ? "" : keyPrefix;
        ps.setInt(index, prefix.length());
        ps.setString(index + 1, prefix);
    }

    private static String kindOf(String key) {
        int at = key.indexOf('@');
        return at > 0 ? key.substring(0, at) : "";
    }

    private static void closeQuietly(PreparedStatement ps, Connection c, SQLException cause) {
        try {
            if (ps != null) {
                ps.close();
            }
            c.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
