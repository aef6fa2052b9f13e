package io.github.ledgersync.sync;

import io.github.ledgersync.EntityKey;
import io.github.ledgersync.Subscription;
import io.github.ledgersync.SubscriptionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Holds exactly one live {@link UpdateMultiplexer} per {@link EntityKey},
 * shared by every consumer of that key.
 * <p>
 * Creation is atomic per key: concurrent calls for an unseen key run the
 * factory once and all observe the same instance. A failed subscription is
 * replaced by a fresh attempt on the next call; a completed one stays cached
 * and replays its completion. Subscriptions live until {@link #close()}.
 */
public final class SubscriptionRegistry implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ConcurrentMap<EntityKey, UpdateMultiplexer<?>> subscriptions = new ConcurrentHashMap<>();

    /**
     * Returns the subscription for a key, creating and starting it on first use.
     * <p>
     * The factory must not call back into this registry; resolve the
     * subscriptions a feed depends on before calling this method.
     *
     * @param key     the resource key
     * @param factory builds the multiplexer for an unseen or failed key
     * @param <T>     the value type
     * @return the shared subscription
     */
    @SuppressWarnings("unchecked")
    public <T> Subscription<T> getOrCreate(EntityKey key, Supplier<UpdateMultiplexer<T>> factory) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");

        UpdateMultiplexer<?> multiplexer = subscriptions.compute(key, (k, existing) -> {
            if (existing != null && existing.getState() != SubscriptionState.FAILED) {
                return existing;
            }
            if (existing != null) {
                log.info("{}: previous subscription failed, starting a new attempt", k);
            } else {
                log.debug("{}: creating subscription", k);
            }
            return Objects.requireNonNull(factory.get(), "factory returned null");
        });
        multiplexer.start();
        return (Subscription<T>) multiplexer;
    }

    /**
     * Returns the subscription registered for a key, or null.
     *
     * @param key the resource key
     * @return the subscription
     */
    public Subscription<?> get(EntityKey key) {
        return subscriptions.get(key);
    }

    /**
     * Returns the number of registered subscriptions.
     *
     * @return the size
     */
    public int size() {
        return subscriptions.size();
    }

    /**
     * Closes and forgets every subscription.
     */
    @Override
    public void close() {
        List<UpdateMultiplexer<?>> all = new ArrayList<>(subscriptions.values());
        subscriptions.clear();
        for (UpdateMultiplexer<?> multiplexer : all) {
            multiplexer.close();
        }
        log.debug("closed {} subscriptions", all.size());
    }
}
