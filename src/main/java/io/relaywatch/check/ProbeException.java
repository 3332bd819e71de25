package io.relaywatch.check;

/**
 * The probe could not produce a result for a relay. The relay keeps its previous fields.
 */
public class ProbeException extends Exception {
    private final String url;

    public ProbeException(String url, String message) {
        super(message);
        this.url = url;
    }

    public ProbeException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
