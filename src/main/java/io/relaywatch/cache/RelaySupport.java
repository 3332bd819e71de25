package io.relaywatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.relaywatch.model.RelayRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * NIP support checks, per relay or across the cache. An empty NIP list is
 * satisfied by every relay.
 */
public final class RelaySupport {
    private final RelayCache cache;

    RelaySupport(RelayCache cache) {
        this.cache = cache;
    }

    public boolean nip(String url, int nip) {
        return cache.one(url).map(record -> record.supportedNips().contains(nip)).orElse(false);
    }

    /**
     * Every cached relay that supports {@code nip}.
     */
    public List<JsonNode> nip(int nip, Projection projection) {
        return cache.get().supportsNip(nip, projection);
    }

    public Map<Integer, Boolean> nips(String url, List<Integer> nips) {
        requireList(nips);
        List<Integer> supported = cache.one(url).map(RelayRecord::supportedNips).orElse(List.of());
        Map<Integer, Boolean> out = new LinkedHashMap<>();
        for (Integer nip : nips) {
            out.put(nip, supported.contains(nip));
        }
        return out;
    }

    public boolean allNips(String url, List<Integer> nips) {
        return nips(url, nips).values().stream().allMatch(Boolean::booleanValue);
    }

    public Map<Integer, List<JsonNode>> nipsAcross(List<Integer> nips, Projection projection) {
        requireList(nips);
        Map<Integer, List<JsonNode>> out = new LinkedHashMap<>();
        for (Integer nip : nips) {
            out.put(nip, cache.get().supportsNip(nip, projection));
        }
        return out;
    }

    /**
     * URLs of relays that support every NIP in {@code nips}, in key order.
     */
    public List<String> allNipsAcross(List<Integer> nips) {
        requireList(nips);
        Where where = Where.any();
        for (Integer nip : nips) {
            where = where.and(RelayQueries.whereSupportsNip(nip));
        }
        Set<String> urls = new LinkedHashSet<>();
        for (JsonNode row : cache.selectList(Projection.of(RelayRecord.URL), where)) {
            urls.add(row.path(RelayRecord.URL).asText());
        }
        return new ArrayList<>(urls);
    }

    private static void requireList(List<Integer> nips) {
        if (nips == null) {
            throw new RelayValidationException("NIP list is required");
        }
    }
}
