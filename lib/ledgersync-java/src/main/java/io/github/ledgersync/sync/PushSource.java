package io.github.ledgersync.sync;

import io.github.ledgersync.Registration;

/**
 * Origin of push notifications for one subscription: either a push stream
 * of its own ({@link StreamPushSource}) or the updates of another
 * subscription it depends on ({@link DerivedPushSource}).
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface PushSource<T> {

    /**
     * Starts delivering pushes.
     *
     * @param listener receives the pushes
     * @return registration that stops delivery
     */
    Registration open(PushListener<T> listener);

    /**
     * Returns a source that never pushes.
     *
     * @param <T> the payload type
     * @return the silent source
     */
    static <T> PushSource<T> none() {
        return listener -> () -> {
        };
    }
}
