package io.relaywatch.cache;

public class RelayValidationException extends IllegalArgumentException {
    public RelayValidationException(String message) {
        super(message);
    }
}
