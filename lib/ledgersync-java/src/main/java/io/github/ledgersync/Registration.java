package io.github.ledgersync;

/**
 * Handle to a registered listener or an opened resource.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    /**
     * Detaches the listener or releases the resource. Safe to call multiple times.
     */
    @Override
    void close();
}
