package io.github.ledgersync.sync;

import io.github.ledgersync.Registration;
import io.github.ledgersync.Subscription;
import io.github.ledgersync.UpdateListener;

import java.util.Objects;

/**
 * Push source of a derived feed: a feed without a push channel of its own
 * that re-fetches whenever the upstream subscription it depends on accepts
 * an update. The upstream is exposed through {@link #getUpstream()} so the
 * dependency between feeds can be inspected.
 * <p>
 * Only updates accepted after opening trigger a re-fetch; the upstream's
 * latest value is not replayed. Completion and failure of the upstream are
 * forwarded.
 *
 * @param <T> the payload type of the derived feed
 */
public final class DerivedPushSource<T> implements PushSource<T> {

    private final Subscription<?> upstream;

    private DerivedPushSource(Subscription<?> upstream) {
        this.upstream = Objects.requireNonNull(upstream, "upstream cannot be null");
    }

    /**
     * Creates a source triggered by the given subscription.
     *
     * @param upstream the subscription whose updates signal a change
     * @param <T>      the payload type of the derived feed
     * @return the derived source
     */
    public static <T> DerivedPushSource<T> from(Subscription<?> upstream) {
        return new DerivedPushSource<>(upstream);
    }

    /**
     * Returns the subscription this source depends on.
     *
     * @return the upstream subscription
     */
    public Subscription<?> getUpstream() {
        return upstream;
    }

    @Override
    public Registration open(PushListener<T> listener) {
        return upstream.subscribe(new UpdateListener<Object>() {
            @Override
            public void onUpdate(Object value) {
                listener.onPush(null);
            }

            @Override
            public void onComplete() {
                listener.onTerminal();
            }

            @Override
            public void onError(Throwable error) {
                listener.onError(error);
            }
        }, false);
    }
}
