package io.relaywatch.check;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Checks one relay and reports what it saw as record fields ({@code connect},
 * {@code read}, {@code write}, {@code info}, {@code dns}, ...). Fields the probe
 * did not look at are left out and keep their stored values.
 */
@FunctionalInterface
public interface RelayProbe {
    ObjectNode probe(String url) throws ProbeException;
}
