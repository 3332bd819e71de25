package io.relaywatch.model;

import java.net.URI;
import java.util.Locale;

public enum Network {
    CLEARNET("clearnet"),
    TOR("tor"),
    I2P("i2p"),
    LOKI("loki"),
    LOCAL("local");

    private final String label;

    Network(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Network fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CLEARNET;
        }
        for (Network value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.label.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown network: " + raw);
    }

    /**
     * Classifies a relay URL by its host. Unparseable URLs are treated as clearnet.
     */
    public static Network ofUrl(String url) {
        String host = hostOf(url);
        if (host == null) {
            return CLEARNET;
        }
        if (host.endsWith(".onion")) {
            return TOR;
        }
        if (host.endsWith(".i2p")) {
            return I2P;
        }
        if (host.endsWith(".loki")) {
            return LOKI;
        }
        if (isLocalHost(host)) {
            return LOCAL;
        }
        return CLEARNET;
    }

    private static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = RelayUrl.host(URI.create(url.trim()));
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isLocalHost(String host) {
        if ("localhost".equals(host) || host.endsWith(".local") || "[::1]".equals(host) || "::1".equals(host)) {
            return true;
        }
        if (host.startsWith("127.") || host.startsWith("10.") || host.startsWith("192.168.")) {
            return true;
        }
        if (host.startsWith("172.")) {
            String[] parts = host.split("\\.");
            if (parts.length == 4) {
                try {
                    int second = Integer.parseInt(parts[1]);
                    return second >= 16 && second <= 31;
                } catch (NumberFormatException ignored) {
                    return false;
                }
            }
        }
        return false;
    }
}
