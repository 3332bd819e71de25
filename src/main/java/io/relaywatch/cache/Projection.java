package io.relaywatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.relaywatch.util.Jsons;

import java.util.List;

/**
 * Shape of each row returned by {@link RelayCache#select}.
 */
public final class Projection {
    private static final Projection ALL = new Projection(Mode.ALL, List.of());
    private static final Projection IDS = new Projection(Mode.IDS, List.of());

    private enum Mode { ALL, IDS, FIELDS }

    private final Mode mode;
    private final List<String> fields;

    private Projection(Mode mode, List<String> fields) {
        this.mode = mode;
        this.fields = fields;
    }

    public static Projection all() {
        return ALL;
    }

    /**
     * Each row is the record's store key as a JSON string.
     */
    public static Projection ids() {
        return IDS;
    }

    public static Projection of(String... fields) {
        if (fields == null || fields.length == 0) {
            return ALL;
        }
        return new Projection(Mode.FIELDS, List.of(fields));
    }

    static Projection orAll(Projection projection) {
        return projection == null ? ALL : projection;
    }

    JsonNode apply(String key, ObjectNode document) {
        switch (mode) {
            case IDS:
                return TextNode.valueOf(key);
            case FIELDS:
                ObjectNode out = Jsons.object();
                for (String field : fields) {
                    JsonNode value = document.get(field);
                    if (value != null) {
                        out.set(field, value);
                    }
                }
                return out;
            default:
                return document;
        }
    }
}
