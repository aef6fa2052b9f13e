package io.github.ledgersync.errors;

/**
 * Base exception for all ledger client errors.
 */
public class LedgerException extends RuntimeException {

    /**
     * Creates a new LedgerException with a message.
     *
     * @param message the error message
     */
    public LedgerException(String message) {
        super(message);
    }

    /**
     * Creates a new LedgerException with a message and cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
