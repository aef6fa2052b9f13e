package io.github.ledgersync;

/**
 * Live, deduplicated update stream of one ledger resource.
 * <p>
 * Subscriptions are shared: every consumer asking for the same
 * {@link EntityKey} gets the same instance. A consumer attaching late first
 * receives the latest accepted value.
 * <pre>{@code
 * Subscription<AccountRecord> account = client.subscribeToAccount("GABC...");
 * try (Registration reg = account.subscribe(value -> render(value.getBalances()))) {
 *     ...
 * }
 * }</pre>
 *
 * @param <T> the value type
 */
public interface Subscription<T> {

    /**
     * Returns the key this subscription is bound to.
     *
     * @return the key
     */
    EntityKey getKey();

    /**
     * Returns the current lifecycle state.
     *
     * @return the state
     */
    SubscriptionState getState();

    /**
     * Returns the latest accepted value, or null if none yet.
     *
     * @return the latest value
     */
    T getLatestValue();

    /**
     * Attaches a listener, replaying the latest value first.
     *
     * @param listener the listener
     * @return registration that detaches the listener
     */
    default Registration subscribe(UpdateListener<? super T> listener) {
        return subscribe(listener, true);
    }

    /**
     * Attaches a listener.
     * Completion and failure are always replayed to late listeners.
     *
     * @param listener     the listener
     * @param replayLatest whether to deliver the latest value immediately
     * @return registration that detaches the listener
     */
    Registration subscribe(UpdateListener<? super T> listener, boolean replayLatest);

    /**
     * Opens a blocking iterable view over this subscription.
     *
     * @return the stream, close it when done
     */
    default UpdateStream<T> stream() {
        UpdateStream<T> stream = new UpdateStream<>();
        stream.attach(subscribe(stream));
        return stream;
    }
}
