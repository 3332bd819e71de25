package io.relaywatch.model;

import java.net.URI;

/**
 * Host and port of a relay URL. {@link URI} leaves both unset for registry-based
 * authorities such as {@code relay_1.example.com}, which are still valid relay hosts.
 */
public final class RelayUrl {
    private RelayUrl() {
    }

    /**
     * @return the host, or null when the URI has no authority
     */
    public static String host(URI uri) {
        if (uri.getHost() != null) {
            return uri.getHost();
        }
        String hostPort = hostPort(uri.getRawAuthority());
        if (hostPort == null) {
            return null;
        }
        int colon = portSeparator(hostPort);
        String host = colon < 0 ? hostPort : hostPort.substring(0, colon);
        return host.isBlank() ? null : host;
    }

    /**
     * @return the explicit port, or -1
     */
    public static int port(URI uri) {
        if (uri.getHost() != null) {
            return uri.getPort();
        }
        String hostPort = hostPort(uri.getRawAuthority());
        if (hostPort == null) {
            return -1;
        }
        int colon = portSeparator(hostPort);
        if (colon < 0) {
            return -1;
        }
        try {
            return Integer.parseInt(hostPort.substring(colon + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String hostPort(String authority) {
        if (authority == null || authority.isBlank()) {
            return null;
        }
        int at = authority.lastIndexOf('@');
        return at < 0 ? authority : authority.substring(at + 1);
    }

    private static int portSeparator(String hostPort) {
        int colon = hostPort.lastIndexOf(':');
        if (colon < 0 || hostPort.indexOf(']') > colon) {
            return -1;
        }
        return colon;
    }
}
