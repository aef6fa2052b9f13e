package io.github.ledgersync.sync;

import java.util.concurrent.CompletableFuture;

/**
 * Resource-specific half of an {@link UpdateMultiplexer}: how to obtain the
 * baseline, where pushes come from, how to turn a push into a candidate and
 * which candidates carry new information.
 * <p>
 * {@link #shouldApplyUpdate(Object)}, {@link #applyUpdate(Object)} and
 * {@link #isTerminal(Object)} are called under the multiplexer's lock and may
 * update cursor or snapshot bookkeeping without further synchronization.
 * {@link #init()} and {@link #fetchUpdate(Object)} may run concurrently with
 * them and must only read that bookkeeping.
 *
 * @param <T> the value type
 */
public interface UpdateAdapter<T> {

    /**
     * Obtains the first value and initializes the bookkeeping from it.
     *
     * @return future with the baseline value; null means there is nothing to emit yet
     */
    CompletableFuture<T> init();

    /**
     * Computes a candidate update.
     *
     * @param pushed the pushed payload, or null to re-fetch independently
     * @return future with the candidate, may complete with null if there is none
     */
    CompletableFuture<T> fetchUpdate(T pushed);

    /**
     * Decides whether a candidate is new information relative to the last accepted value.
     *
     * @param candidate the candidate, never null
     * @return true to accept
     */
    boolean shouldApplyUpdate(T candidate);

    /**
     * Folds an accepted candidate into the emitted value.
     *
     * @param candidate the accepted candidate
     * @return the value to emit
     */
    T applyUpdate(T candidate);

    /**
     * Returns where pushes for this resource come from.
     *
     * @return the push source
     */
    PushSource<T> pushSource();

    /**
     * Checks whether the candidate signals that the resource's lifetime ended.
     *
     * @param candidate the candidate
     * @return true to complete the subscription
     */
    default boolean isTerminal(T candidate) {
        return false;
    }

    /**
     * Whether to re-fetch when no update was accepted for a while. Feeds whose
     * push channel is known to be complete switch this off.
     *
     * @return true to poll when idle
     */
    default boolean pollWhenIdle() {
        return true;
    }

    /**
     * Releases resources held for an unfinished {@link #init()}, such as a
     * pending existence wait. Called when the subscription ends, possibly
     * more than once.
     */
    default void close() {
    }
}
