package io.relaywatch.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A relay document as stored in the cache. The backing {@link ObjectNode} is
 * the source of truth; accessors read from it and never cache values.
 */
public final class RelayRecord {
    public static final String ID = "#";
    public static final String URL = "url";
    public static final String NETWORK = "network";
    public static final String CONNECT = "connect";
    public static final String READ = "read";
    public static final String WRITE = "write";
    public static final String AUTH = "auth";
    public static final String DEAD = "dead";
    public static final String INFO = "info";
    public static final String DNS = "dns";
    public static final String GEO = "geo";
    public static final String SSL = "ssl";
    public static final String RETENTION = "retention";
    public static final String LAST_SEEN = "last_seen";
    public static final String CHECKED_AT = "checked_at";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    private final ObjectNode document;

    private RelayRecord(ObjectNode document) {
        this.document = document;
    }

    public static RelayRecord of(ObjectNode document) {
        return new RelayRecord(document == null ? Jsons.object() : document);
    }

    public static RelayRecord withUrl(String url) {
        ObjectNode node = Jsons.object();
        if (url != null) {
            node.put(URL, url);
        }
        return new RelayRecord(node);
    }

    /**
     * Freshly discovered relay: url and network set, health and capability fields empty.
     */
    public static RelayRecord skeleton(String url) {
        ObjectNode node = Jsons.object();
        node.put(URL, url);
        node.put(NETWORK, Network.ofUrl(url).label());
        node.putNull(CONNECT);
        node.putNull(INFO);
        node.putNull(DNS);
        node.putNull(GEO);
        node.putNull(SSL);
        return new RelayRecord(node);
    }

    public ObjectNode document() {
        return document;
    }

    public RelayRecord copy() {
        return new RelayRecord(document.deepCopy());
    }

    public String url() {
        JsonNode url = document.get(URL);
        return url == null || url.isNull() ? null : url.asText();
    }

    public Optional<String> id() {
        JsonNode id = document.get(ID);
        return id == null || id.isNull() ? Optional.empty() : Optional.of(id.asText());
    }

    public Optional<String> network() {
        return text(NETWORK);
    }

    public Optional<Boolean> connect() {
        return flag(CONNECT);
    }

    public Optional<Boolean> readable() {
        return flag(READ);
    }

    public Optional<Boolean> writable() {
        return flag(WRITE);
    }

    public Optional<Boolean> auth() {
        return flag(AUTH);
    }

    public Optional<Boolean> dead() {
        return flag(DEAD);
    }

    public Optional<JsonNode> info() {
        JsonNode info = document.get(INFO);
        return info == null || !info.isObject() ? Optional.empty() : Optional.of(info);
    }

    public List<Integer> supportedNips() {
        List<Integer> out = new ArrayList<>();
        JsonNode nips = Jsons.at(document, INFO + ".supported_nips");
        if (nips != null && nips.isArray()) {
            for (JsonNode nip : nips) {
                if (nip.canConvertToInt()) {
                    out.add(nip.asInt());
                }
            }
        }
        return out;
    }

    public Optional<Long> checkedAt() {
        JsonNode value = document.get(CHECKED_AT);
        return value == null || !value.isNumber() ? Optional.empty() : Optional.of(value.asLong());
    }

    public RelayRecord set(String field, JsonNode value) {
        document.set(field, value);
        return this;
    }

    public RelayRecord put(String field, Boolean value) {
        if (value == null) {
            document.putNull(field);
        } else {
            document.put(field, value);
        }
        return this;
    }

    public RelayRecord put(String field, String value) {
        document.put(field, value);
        return this;
    }

    public RelayRecord put(String field, long value) {
        document.put(field, value);
        return this;
    }

    public RelayRecord withInfo(List<Integer> supportedNips, ObjectNode limitation, List<String> countries) {
        ObjectNode info = Jsons.object();
        if (supportedNips != null) {
            supportedNips.forEach(info.putArray("supported_nips")::add);
        }
        if (limitation != null) {
            info.set("limitation", limitation);
        }
        if (countries != null) {
            countries.forEach(info.putArray("relay_countries")::add);
        }
        document.set(INFO, info);
        return this;
    }

    private Optional<String> text(String field) {
        JsonNode value = document.get(field);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value.asText());
    }

    private Optional<Boolean> flag(String field) {
        JsonNode value = document.get(field);
        return value == null || !value.isBoolean() ? Optional.empty() : Optional.of(value.booleanValue());
    }

    @Override
    public String toString() {
        return Jsons.toCompactJson(document);
    }
}
