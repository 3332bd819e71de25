package io.relaywatch.check;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaywatch.model.Network;
import io.relaywatch.model.RelayRecord;
import io.relaywatch.model.RelayUrl;
import io.relaywatch.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;

/**
 * DNS lookup plus a TCP connect to the relay's port. Says nothing about the
 * relay protocol itself, so {@code read}/{@code write} are not reported.
 */
public final class ReachabilityProbe implements RelayProbe {
    private static final Logger log = LoggerFactory.getLogger(ReachabilityProbe.class);

    private final Duration timeout;

    public ReachabilityProbe(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public ObjectNode probe(String url) throws ProbeException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ProbeException(url, "Invalid relay url", e);
        }
        String host = RelayUrl.host(uri);
        if (host == null) {
            throw new ProbeException(url, "Relay url has no host");
        }
        Network network = Network.ofUrl(url);
        if (network == Network.TOR || network == Network.I2P || network == Network.LOKI) {
            throw new ProbeException(url, "No route to " + network.label() + " relays from this probe");
        }
        int port = RelayUrl.port(uri) > 0 ? RelayUrl.port(uri) : ("wss".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);

        ObjectNode out = Jsons.object();
        InetAddress[] addresses;
        try {
            addresses = InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            log.debug("DNS lookup failed for {}: {}", host, e.getMessage());
            out.put(RelayRecord.CONNECT, false);
            out.putNull(RelayRecord.DNS);
            return out;
        }
        ObjectNode dns = out.putObject(RelayRecord.DNS);
        ArrayNode ips = dns.putArray("addresses");
        for (InetAddress address : addresses) {
            ips.add(address.getHostAddress());
        }

        long started = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(addresses[0], port), (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
            out.put(RelayRecord.CONNECT, true);
            out.putObject("latency").put("connect", Duration.ofNanos(System.nanoTime() - started).toMillis());
        } catch (IOException e) {
            log.debug("TCP connect to {}:{} failed: {}", host, port, e.getMessage());
            out.put(RelayRecord.CONNECT, false);
        }
        return out;
    }
}
