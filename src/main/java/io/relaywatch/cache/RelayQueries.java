package io.relaywatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.relaywatch.model.Network;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.util.Jsons;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-side queries over the relay cache. A {@code null} projection means the whole document.
 */
public final class RelayQueries {
    static final String PAYMENT_REQUIRED = "info.limitation.payment_required";
    static final String AUTH_REQUIRED = "info.limitation.auth_required";
    static final String SUPPORTED_NIPS = "info.supported_nips";

    private final RelayCache cache;

    RelayQueries(RelayCache cache) {
        this.cache = cache;
    }

    public Optional<RelayRecord> one(String url) {
        return cache.one(url);
    }

    public List<JsonNode> all(Projection projection) {
        return cache.selectList(projection, Where.any());
    }

    public List<JsonNode> all() {
        return all(null);
    }

    public List<String> allIds() {
        return cache.selectList(Projection.ids(), Where.any()).stream()
                .map(JsonNode::asText)
                .collect(Collectors.toList());
    }

    public List<JsonNode> online(Projection projection) {
        return cache.selectList(projection, whereOnline());
    }

    public List<JsonNode> online() {
        return online(null);
    }

    public List<JsonNode> network(Network network, Projection projection) {
        return cache.selectList(projection, whereNetwork(network));
    }

    public List<JsonNode> publicRelays(Projection projection) {
        return cache.selectList(projection, wherePublic());
    }

    public List<JsonNode> paid(Projection projection) {
        return cache.selectList(projection, wherePaid());
    }

    public List<JsonNode> dead(Projection projection) {
        return cache.selectList(projection, whereDead());
    }

    public List<JsonNode> supportsNip(int nip, Projection projection) {
        return cache.selectList(projection, whereSupportsNip(nip));
    }

    public List<JsonNode> doesNotSupportNip(int nip, Projection projection) {
        return cache.selectList(projection, whereDoesNotSupportNip(nip));
    }

    /**
     * The relay's NIP-11 document, when one has been fetched.
     */
    public Optional<JsonNode> info(String url) {
        return cache.one(url).flatMap(RelayRecord::info);
    }

    public static Where whereOnline() {
        return Where.eq(RelayRecord.CONNECT, true);
    }

    public static Where whereNetwork(Network network) {
        return Where.eq(RelayRecord.NETWORK, network.label());
    }

    public static Where wherePaid() {
        return Where.field(PAYMENT_REQUIRED, Jsons::truthy);
    }

    /**
     * Auth challenge seen by the last check, or {@code auth_required} declared in NIP-11.
     */
    public static Where whereAuthRequired() {
        return Where.eq(RelayRecord.AUTH, true).or(Where.field(AUTH_REQUIRED, Jsons::truthy));
    }

    /**
     * Neither payment nor auth required.
     */
    public static Where wherePublic() {
        return wherePaid().or(whereAuthRequired()).negate();
    }

    public static Where whereDead() {
        return Where.eq(RelayRecord.DEAD, true);
    }

    public static Where whereSupportsNip(int nip) {
        return Where.includes(SUPPORTED_NIPS, nip);
    }

    public static Where whereDoesNotSupportNip(int nip) {
        return whereSupportsNip(nip).negate();
    }
}
