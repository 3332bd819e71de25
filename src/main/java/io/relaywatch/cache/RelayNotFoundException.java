package io.relaywatch.cache;

public class RelayNotFoundException extends RuntimeException {
    private final String url;

    public RelayNotFoundException(String operation, String url) {
        super("Cannot " + operation + " because " + url + " does not exist");
        this.url = url;
    }

    public String url() {
        return url;
    }
}
