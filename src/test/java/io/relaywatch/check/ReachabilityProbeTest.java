package io.relaywatch.check;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.model.RelayRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;

final class ReachabilityProbeTest {
    private final ReachabilityProbe probe = new ReachabilityProbe(Duration.ofSeconds(2));

    @Test
    void listeningPortIsReportedConnectable() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            ObjectNode result = probe.probe("ws://127.0.0.1:" + server.getLocalPort());
            Assertions.assertTrue(result.get(RelayRecord.CONNECT).asBoolean());
            Assertions.assertEquals("127.0.0.1", result.get(RelayRecord.DNS).get("addresses").get(0).asText());
            Assertions.assertTrue(result.has("latency"));
        }
    }

    @Test
    void closedPortIsReportedOffline() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }
        ObjectNode result = probe.probe("ws://127.0.0.1:" + port);
        Assertions.assertFalse(result.get(RelayRecord.CONNECT).asBoolean());
    }

    @Test
    void overlayNetworksAreNotProbed() {
        ProbeException error = Assertions.assertThrows(ProbeException.class,
                () -> probe.probe("ws://abcdefghijklmnop.onion"));
        Assertions.assertEquals("ws://abcdefghijklmnop.onion", error.url());
        Assertions.assertThrows(ProbeException.class, () -> probe.probe("wss://"));
    }
}
