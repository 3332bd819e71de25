package io.relaywatch.cache;

import io.relaywatch.model.Network;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RelayIdsTest {

    @Test
    void idIsStableAndPrefixed() {
        String id = RelayIds.id("wss://relay.damus.io");
        Assertions.assertTrue(id.startsWith(RelayIds.PREFIX));
        Assertions.assertEquals(RelayIds.PREFIX.length() + 64, id.length());
        Assertions.assertEquals(id, RelayIds.id("wss://relay.damus.io"));
        Assertions.assertNotEquals(id, RelayIds.id("wss://relay.damus.io/"));
        Assertions.assertThrows(RelayValidationException.class, () -> RelayIds.id(null));
    }

    @Test
    void networkFollowsTheHost() {
        Assertions.assertEquals(Network.TOR, Network.ofUrl("ws://abcdefghijklmnop.onion"));
        Assertions.assertEquals(Network.I2P, Network.ofUrl("ws://relay.i2p"));
        Assertions.assertEquals(Network.LOKI, Network.ofUrl("ws://relay.loki"));
        Assertions.assertEquals(Network.LOCAL, Network.ofUrl("ws://192.168.1.20:7777"));
        Assertions.assertEquals(Network.LOCAL, Network.ofUrl("ws://172.20.0.1"));
        Assertions.assertEquals(Network.CLEARNET, Network.ofUrl("ws://172.40.0.1"));
        Assertions.assertEquals(Network.CLEARNET, Network.ofUrl("wss://nos.lol"));
        Assertions.assertEquals(Network.TOR, Network.fromString("TOR"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Network.fromString("carrier-pigeon"));
    }
}
