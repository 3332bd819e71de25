package io.relaywatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import io.relaywatch.util.Jsons;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Predicate over a stored relay document. Paths are dotted, e.g.
 * {@code info.limitation.payment_required}.
 */
@FunctionalInterface
public interface Where {

    boolean test(JsonNode document);

    default Where and(Where other) {
        Objects.requireNonNull(other, "other");
        return doc -> test(doc) && other.test(doc);
    }

    default Where or(Where other) {
        Objects.requireNonNull(other, "other");
        return doc -> test(doc) || other.test(doc);
    }

    default Where negate() {
        return doc -> !test(doc);
    }

    static Where any() {
        return doc -> true;
    }

    static Where not(Where where) {
        return where.negate();
    }

    static Where eq(String path, Object value) {
        JsonNode expected = Jsons.mapper().valueToTree(value);
        return doc -> sameValue(Jsons.at(doc, path), expected);
    }

    static Where in(String path, Collection<?> values) {
        List<JsonNode> candidates = toNodes(values);
        return doc -> {
            JsonNode actual = Jsons.at(doc, path);
            return candidates.stream().anyMatch(candidate -> sameValue(actual, candidate));
        };
    }

    static Where notIn(String path, Collection<?> values) {
        return in(path, values).negate();
    }

    /**
     * Array field containing {@code value}, or text field containing it as a substring.
     */
    static Where includes(String path, Object value) {
        JsonNode expected = Jsons.mapper().valueToTree(value);
        return doc -> {
            JsonNode actual = Jsons.at(doc, path);
            if (actual == null) {
                return false;
            }
            if (actual.isArray()) {
                for (JsonNode item : actual) {
                    if (sameValue(item, expected)) {
                        return true;
                    }
                }
                return false;
            }
            return actual.isTextual() && expected.isTextual() && actual.textValue().contains(expected.textValue());
        };
    }

    /**
     * Present and not JSON null.
     */
    static Where defined(String path) {
        return doc -> {
            JsonNode actual = Jsons.at(doc, path);
            return actual != null && !actual.isNull() && !actual.isMissingNode();
        };
    }

    static Where undefined(String path) {
        return defined(path).negate();
    }

    static Where type(String path, JsonNodeType type) {
        return doc -> {
            JsonNode actual = Jsons.at(doc, path);
            return actual != null && actual.getNodeType() == type;
        };
    }

    static Where matches(String path, String regex) {
        return matches(path, Pattern.compile(regex));
    }

    /**
     * Scalar field whose text form matches {@code pattern} anywhere.
     */
    static Where matches(String path, Pattern pattern) {
        return doc -> {
            JsonNode actual = Jsons.at(doc, path);
            if (actual == null || actual.isNull() || actual.isContainerNode()) {
                return false;
            }
            return pattern.matcher(actual.asText()).find();
        };
    }

    /**
     * Arbitrary predicate on the node at {@code path}; receives {@code null} when absent.
     */
    static Where field(String path, Predicate<JsonNode> predicate) {
        return doc -> predicate.test(Jsons.at(doc, path));
    }

    private static boolean sameValue(JsonNode actual, JsonNode expected) {
        if (actual == null || actual.isMissingNode()) {
            return expected == null || expected.isNull();
        }
        if (actual.isNumber() && expected.isNumber()) {
            return actual.decimalValue().compareTo(expected.decimalValue()) == 0;
        }
        return actual.equals(expected);
    }

    private static List<JsonNode> toNodes(Collection<?> values) {
        List<JsonNode> out = new ArrayList<>();
        if (values != null) {
            for (Object value : values) {
                out.add(Jsons.mapper().valueToTree(value));
            }
        }
        return out;
    }
}
