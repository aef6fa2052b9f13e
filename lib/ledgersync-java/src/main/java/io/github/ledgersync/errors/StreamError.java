package io.github.ledgersync.errors;

/**
 * Thrown when a push stream fails in a way reconnecting cannot fix.
 * A subscription receiving this error moves to the failed state.
 */
public class StreamError extends LedgerException {

    /**
     * Creates a new StreamError.
     *
     * @param message the error message
     */
    public StreamError(String message) {
        super(message);
    }

    /**
     * Creates a new StreamError with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public StreamError(String message, Throwable cause) {
        super(message, cause);
    }
}
