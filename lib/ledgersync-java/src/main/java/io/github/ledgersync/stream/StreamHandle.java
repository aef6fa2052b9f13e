package io.github.ledgersync.stream;

import io.github.ledgersync.Registration;

/**
 * Handle to a live push connection.
 */
public interface StreamHandle extends Registration {

    /**
     * Releases the connection and cancels any pending reconnect.
     * Safe to call multiple times, and while a reconnect is pending.
     */
    @Override
    void close();

    /**
     * Checks whether the handle was closed or stopped after an unrecoverable error.
     *
     * @return true if no further messages will arrive
     */
    boolean isClosed();
}
