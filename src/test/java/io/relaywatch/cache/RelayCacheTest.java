package io.relaywatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.model.Network;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.store.InMemoryRecordStore;
import io.relaywatch.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class RelayCacheTest {
    private static final String DAMUS = "wss://relay.damus.io";
    private static final String NOS = "wss://nos.lol";
    private static final String PAID = "wss://paid.example";
    private static final String AUTH_ONLY = "wss://auth.example";

    @Test
    void insertIsIdempotentPerUrl() {
        RelayCache cache = new RelayCache(new InMemoryRecordStore());
        String first = cache.insert(RelayRecord.withUrl(DAMUS));
        String second = cache.insert(RelayRecord.withUrl(DAMUS));

        Assertions.assertEquals(first, second);
        Assertions.assertEquals(RelayIds.id(DAMUS), first);
        Assertions.assertEquals(1L, cache.count().all());
        Assertions.assertEquals(Optional.empty(), cache.insertIfNotExists(RelayRecord.withUrl(DAMUS)));
    }

    @Test
    void writesStampIdNetworkAndTimestamps() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
        RelayCache cache = new RelayCache(new InMemoryRecordStore(), clock);
        cache.insert(RelayRecord.withUrl("ws://abcdefghijklmnop.onion"));

        RelayRecord stored = cache.one("ws://abcdefghijklmnop.onion").orElseThrow();
        Assertions.assertEquals(Optional.of(RelayIds.id("ws://abcdefghijklmnop.onion")), stored.id());
        Assertions.assertEquals(Optional.of(Network.TOR.label()), stored.network());
        Assertions.assertEquals(clock.millis(), stored.document().get(RelayRecord.CREATED_AT).asLong());
        Assertions.assertEquals(clock.millis(), stored.document().get(RelayRecord.UPDATED_AT).asLong());
    }

    @Test
    void invalidRecordsAreRejected() {
        RelayCache cache = new RelayCache(new InMemoryRecordStore());
        Assertions.assertThrows(RelayValidationException.class, () -> cache.insert(RelayRecord.withUrl(null)));
        Assertions.assertThrows(RelayValidationException.class, () -> cache.insert(RelayRecord.withUrl("   ")));
        Assertions.assertThrows(RelayValidationException.class, () -> cache.insert(RelayRecord.withUrl("https://relay.example")));
        Assertions.assertThrows(RelayValidationException.class, () -> cache.insert(null));
        Assertions.assertEquals(0L, cache.count().all());
    }

    @Test
    void underscoreHostnamesAreAccepted() {
        RelayCache cache = new RelayCache(new InMemoryRecordStore());
        String url = "wss://relay_1.example.com";

        Assertions.assertEquals(RelayIds.id(url), cache.insert(RelayRecord.withUrl(url)));
        Assertions.assertTrue(cache.exists(url));
        Assertions.assertEquals("clearnet", cache.one(url).orElseThrow().network().orElseThrow());
        Assertions.assertThrows(RelayValidationException.class, () -> cache.insert(RelayRecord.withUrl("ws://")));
    }

    @Test
    void updatePatchAndDeleteRequireAnExistingRecord() {
        RelayCache cache = new RelayCache(new InMemoryRecordStore());
        RelayNotFoundException update = Assertions.assertThrows(RelayNotFoundException.class,
                () -> cache.update(RelayRecord.withUrl(NOS)));
        Assertions.assertEquals("Cannot update because " + NOS + " does not exist", update.getMessage());
        Assertions.assertThrows(RelayNotFoundException.class, () -> cache.patch(RelayRecord.withUrl(NOS)));
        Assertions.assertThrows(RelayNotFoundException.class, () -> cache.delete(NOS));
        Assertions.assertFalse(cache.exists(NOS));
    }

    @Test
    void upsertInsertsThenReplacesKeepingCreatedAt() {
        RelayCache cache = new RelayCache(new InMemoryRecordStore());
        cache.upsert(RelayRecord.withUrl(NOS).put(RelayRecord.CONNECT, true).put("note", "first"));
        long createdAt = cache.one(NOS).orElseThrow().document().get(RelayRecord.CREATED_AT).asLong();

        cache.upsert(RelayRecord.withUrl(NOS).put(RelayRecord.CONNECT, false));
        RelayRecord stored = cache.one(NOS).orElseThrow();
        Assertions.assertEquals(Optional.of(false), stored.connect());
        Assertions.assertNull(stored.document().get("note"));
        Assertions.assertEquals(createdAt, stored.document().get(RelayRecord.CREATED_AT).asLong());
        Assertions.assertEquals(1L, cache.count().all());
    }

    @Test
    void patchOverlaysFieldsAndKeepsIdentity() {
        RelayCache cache = new RelayCache(new InMemoryRecordStore());
        cache.insert(RelayRecord.withUrl(DAMUS).put(RelayRecord.READ, true));

        ObjectNode fields = Jsons.object();
        fields.put(RelayRecord.CONNECT, true);
        fields.put(RelayRecord.URL, "wss://hijack.example");
        fields.put(RelayRecord.ID, "Relay@bogus");
        cache.patch(DAMUS, fields);

        RelayRecord stored = cache.one(DAMUS).orElseThrow();
        Assertions.assertEquals(DAMUS, stored.url());
        Assertions.assertEquals(Optional.of(RelayIds.id(DAMUS)), stored.id());
        Assertions.assertEquals(Optional.of(true), stored.connect());
        Assertions.assertEquals(Optional.of(true), stored.readable());
        Assertions.assertFalse(cache.exists("wss://hijack.example"));
    }

    @Test
    void batchSkipsInvalidItemsAndKeepsTheRest() {
        RelayCache cache = new RelayCache(new InMemoryRecordStore());
        List<RelayRecord> records = new ArrayList<>();
        records.add(RelayRecord.withUrl(DAMUS));
        records.add(RelayRecord.withUrl("not a relay"));
        records.add(RelayRecord.withUrl(NOS));

        List<String> ids = cache.batch().insert(records);
        Assertions.assertEquals(List.of(RelayIds.id(DAMUS), RelayIds.id(NOS)), ids);
        Assertions.assertEquals(2L, cache.count().all());

        List<String> fresh = cache.batch().insertIfNotExists(List.of(RelayRecord.withUrl(NOS), RelayRecord.withUrl(PAID)));
        Assertions.assertEquals(List.of(RelayIds.id(PAID)), fresh);

        List<String> deleted = cache.batch().delete(List.of(DAMUS, "wss://missing.example"));
        Assertions.assertEquals(List.of(DAMUS), deleted);
        Assertions.assertThrows(RelayValidationException.class, () -> cache.batch().upsert(null));
    }

    @Test
    void queriesAndCountsFilterOnHealthAndInfo() {
        RelayCache cache = seeded();

        Assertions.assertEquals(4L, cache.count().all());
        Assertions.assertEquals(3L, cache.count().online());
        Assertions.assertEquals(1L, cache.count().paid());
        Assertions.assertEquals(2L, cache.count().publicRelays());
        Assertions.assertEquals(1L, cache.count().dead());
        Assertions.assertEquals(4L, cache.count().network(Network.CLEARNET));
        Assertions.assertEquals(0L, cache.count().network(Network.TOR));

        List<JsonNode> online = cache.get().online(Projection.of(RelayRecord.URL));
        List<String> urls = new ArrayList<>();
        online.forEach(row -> urls.add(row.get(RelayRecord.URL).asText()));
        Assertions.assertTrue(urls.contains(DAMUS));
        Assertions.assertTrue(urls.contains(PAID));
        Assertions.assertEquals(1, online.get(0).size());

        List<String> ids = cache.get().allIds();
        Assertions.assertEquals(4, ids.size());
        Assertions.assertTrue(ids.contains(RelayIds.id(NOS)));
    }

    @Test
    void publicRelaysExcludeAuthRequired() {
        RelayCache cache = seeded();

        List<String> publicUrls = new ArrayList<>();
        cache.get().publicRelays(Projection.of(RelayRecord.URL))
                .forEach(row -> publicUrls.add(row.get(RelayRecord.URL).asText()));
        Assertions.assertEquals(2, publicUrls.size());
        Assertions.assertTrue(publicUrls.contains(DAMUS));
        Assertions.assertTrue(publicUrls.contains(NOS));
        Assertions.assertFalse(publicUrls.contains(AUTH_ONLY));

        Assertions.assertTrue(cache.requires().auth(AUTH_ONLY));
        Assertions.assertFalse(cache.requires().payment(AUTH_ONLY));
        Assertions.assertFalse(cache.is().publiclyAccessible(AUTH_ONLY));

        cache.patch(DAMUS, Jsons.object().put(RelayRecord.AUTH, true));
        Assertions.assertEquals(1L, cache.count().publicRelays());
        Assertions.assertFalse(cache.is().publiclyAccessible(DAMUS));
    }

    @Test
    void flagsRequirementsAndLimits() {
        RelayCache cache = seeded();

        Assertions.assertTrue(cache.is().online(DAMUS));
        Assertions.assertFalse(cache.is().online(NOS));
        Assertions.assertTrue(cache.is().dead(NOS));
        Assertions.assertFalse(cache.is().online("wss://unknown.example"));

        Assertions.assertTrue(cache.requires().payment(PAID));
        Assertions.assertTrue(cache.requires().auth(PAID));
        Assertions.assertFalse(cache.requires().payment(DAMUS));
        Assertions.assertTrue(cache.is().publiclyAccessible(DAMUS));
        Assertions.assertFalse(cache.is().publiclyAccessible(PAID));

        Assertions.assertEquals(Optional.empty(), cache.has().limitation(DAMUS, "max_message_length"));
        Assertions.assertEquals(16384, cache.has().limitation(PAID, "max_message_length").orElseThrow().asInt());

        Assertions.assertTrue(cache.limits().country(PAID, "de"));
        Assertions.assertFalse(cache.limits().country(DAMUS, "US"));
        Assertions.assertThrows(RelayValidationException.class, () -> cache.limits().country(PAID, " "));
    }

    @Test
    void nipSupportAcrossTheCache() {
        RelayCache cache = seeded();

        Assertions.assertTrue(cache.supports().nip(DAMUS, 11));
        Assertions.assertFalse(cache.supports().nip(DAMUS, 99));
        Assertions.assertFalse(cache.supports().nip("wss://unknown.example", 11));

        Map<Integer, Boolean> nips = cache.supports().nips(DAMUS, List.of(1, 42));
        Assertions.assertEquals(Boolean.TRUE, nips.get(1));
        Assertions.assertEquals(Boolean.FALSE, nips.get(42));
        Assertions.assertFalse(cache.supports().allNips(DAMUS, List.of(1, 42)));

        Assertions.assertEquals(2, cache.supports().nip(11, null).size());
        Assertions.assertEquals(List.of(PAID), cache.supports().allNipsAcross(List.of(11, 42)));
        Assertions.assertEquals(4, cache.supports().allNipsAcross(List.of()).size());
        Assertions.assertEquals(2L, cache.count().supportsNip(11));
        Assertions.assertEquals(2L, cache.count().doesNotSupportNip(11));
        Assertions.assertThrows(RelayValidationException.class, () -> cache.supports().allNipsAcross(null));
    }

    private static RelayCache seeded() {
        RelayCache cache = new RelayCache(new InMemoryRecordStore());
        cache.insert(RelayRecord.withUrl(DAMUS)
                .put(RelayRecord.CONNECT, true)
                .withInfo(List.of(1, 11), null, null));
        cache.insert(RelayRecord.withUrl(NOS)
                .put(RelayRecord.CONNECT, false)
                .put(RelayRecord.DEAD, true)
                .withInfo(List.of(1), null, null));
        ObjectNode limitation = Jsons.object();
        limitation.put("payment_required", true);
        limitation.put("auth_required", true);
        limitation.put("max_message_length", 16384);
        cache.insert(RelayRecord.withUrl(PAID)
                .put(RelayRecord.CONNECT, true)
                .withInfo(List.of(1, 11, 42), limitation, List.of("DE")));
        ObjectNode authOnly = Jsons.object();
        authOnly.put("auth_required", true);
        cache.insert(RelayRecord.withUrl(AUTH_ONLY)
                .put(RelayRecord.CONNECT, true)
                .withInfo(List.of(1), authOnly, null));
        return cache;
    }
}
