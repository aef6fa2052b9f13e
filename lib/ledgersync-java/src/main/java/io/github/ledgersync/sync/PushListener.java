package io.github.ledgersync.sync;

/**
 * Receives signals from a {@link PushSource}.
 *
 * @param <T> the payload type
 */
public interface PushListener<T> {

    /**
     * Called for every pushed event.
     *
     * @param payload the decoded payload, or null when the push only signals
     *                that the resource changed and must be re-fetched
     */
    void onPush(T payload);

    /**
     * Called when the source will never push again because the resource ended.
     */
    void onTerminal();

    /**
     * Called when the source failed in a way it cannot recover from.
     *
     * @param error the failure
     */
    void onError(Throwable error);
}
