package io.github.ledgersync;

/**
 * Receives the values emitted by a {@link Subscription}.
 * <p>
 * Callbacks for one subscription are never invoked concurrently and arrive
 * in acceptance order. They run on library threads and must not block.
 *
 * @param <T> the value type
 */
public interface UpdateListener<T> {

    /**
     * Called for the baseline value and every accepted update.
     *
     * @param value the value
     */
    void onUpdate(T value);

    /**
     * Called once when the resource ended its lifetime.
     */
    default void onComplete() {
    }

    /**
     * Called once when the subscription failed.
     *
     * @param error the failure
     */
    default void onError(Throwable error) {
    }
}
