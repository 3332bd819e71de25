package io.relaywatch.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record StoredRecord(String key, ObjectNode value) {
}
