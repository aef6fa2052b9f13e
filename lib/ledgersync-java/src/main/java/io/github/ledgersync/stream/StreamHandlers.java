package io.github.ledgersync.stream;

/**
 * Callbacks of a push stream opened through {@link ReconnectingStreamClient}.
 * Both are invoked on the stream's worker thread.
 */
public interface StreamHandlers {

    /**
     * Called once per received event, in arrival order.
     *
     * @param message the raw event
     */
    void onMessage(StreamMessage message);

    /**
     * Called at most once when the stream stops for a reason reconnecting cannot fix.
     * The caller decides whether this fails the whole subscription.
     *
     * @param error the failure, a {@link io.github.ledgersync.errors.StreamError}
     */
    void onUnexpectedError(Throwable error);
}
