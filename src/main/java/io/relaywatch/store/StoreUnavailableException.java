package io.relaywatch.store;

/**
 * The backing store cannot be reached. Not recoverable by the caller.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
