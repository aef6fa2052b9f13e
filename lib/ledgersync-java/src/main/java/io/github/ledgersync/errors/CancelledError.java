package io.github.ledgersync.errors;

/**
 * Thrown when a caller gives up waiting, as opposed to the wait failing.
 */
public class CancelledError extends LedgerException {

    /**
     * Creates a new CancelledError.
     *
     * @param message the error message
     */
    public CancelledError(String message) {
        super(message);
    }
}
