package io.github.ledgersync.sync;

import io.github.ledgersync.EntityKey;
import io.github.ledgersync.Registration;
import io.github.ledgersync.Subscription;
import io.github.ledgersync.SubscriptionState;
import io.github.ledgersync.UpdateListener;
import io.github.ledgersync.errors.StreamError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Merges the baseline fetch, the push source and an idle poll of one
 * resource into a single deduplicated, ordered stream of values.
 * <p>
 * Lifecycle: {@code INIT -> LIVE -> (TERMINAL | FAILED)}. In {@code LIVE}
 * every candidate, pushed or polled, passes the adapter's gate under this
 * multiplexer's lock; accepted candidates are folded and emitted to all
 * listeners in acceptance order. Candidate fetches run one at a time in
 * trigger order, and re-fetch triggers arriving while one is waiting to run
 * merge into it, so a slow response can never overtake a newer one.
 * Rejected candidates and failed re-fetches are dropped. A failed baseline or an unrecoverable push error moves the
 * subscription to {@code FAILED}; it never restarts by itself.
 *
 * @param <T> the value type
 */
public final class UpdateMultiplexer<T> implements Subscription<T> {

    private static final Logger log = LoggerFactory.getLogger(UpdateMultiplexer.class);

    private final EntityKey key;
    private final UpdateAdapter<T> adapter;
    private final ScheduledExecutorService scheduler;
    private final Duration pollInterval;

    private final Object lock = new Object();
    private final List<UpdateListener<? super T>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean pollInFlight = new AtomicBoolean(false);

    // candidate fetches run one after another; guarded by lock
    private CompletableFuture<Void> fetchTail = CompletableFuture.completedFuture(null);
    private CompletableFuture<Void> queuedRefetch;

    private volatile SubscriptionState state = SubscriptionState.INIT;
    private volatile T latest;
    private volatile long lastAcceptedNanos;
    private Throwable failure;
    private Registration pushRegistration;
    private ScheduledFuture<?> pollTimer;

    /**
     * Creates a multiplexer. Nothing happens until {@link #start()}.
     *
     * @param key          the resource key
     * @param adapter      the resource-specific operations
     * @param scheduler    runs the idle poll timer
     * @param pollInterval idle time after which the resource is re-fetched
     */
    public UpdateMultiplexer(EntityKey key, UpdateAdapter<T> adapter, ScheduledExecutorService scheduler,
                             Duration pollInterval) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.adapter = Objects.requireNonNull(adapter, "adapter cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    private UpdateMultiplexer(EntityKey key, T value) {
        this.key = key;
        this.adapter = null;
        this.scheduler = null;
        this.pollInterval = null;
        this.latest = value;
        this.state = SubscriptionState.TERMINAL;
        this.started.set(true);
    }

    /**
     * Creates a subscription that already ended with a single value and
     * never touches the network.
     *
     * @param key   the resource key
     * @param value the only value
     * @param <T>   the value type
     * @return the completed subscription
     */
    public static <T> UpdateMultiplexer<T> completed(EntityKey key, T value) {
        return new UpdateMultiplexer<>(Objects.requireNonNull(key, "key cannot be null"), value);
    }

    /**
     * Runs the baseline fetch. Later calls have no effect.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.debug("{}: fetching baseline", key);

        CompletableFuture<T> baseline;
        try {
            baseline = adapter.init();
        } catch (RuntimeException e) {
            baseline = CompletableFuture.failedFuture(e);
        }
        baseline.whenComplete((value, error) -> {
            if (error != null) {
                fail(ExistencePoller.unwrap(error));
            } else {
                goLive(value);
            }
        });
    }

    private void goLive(T baseline) {
        synchronized (lock) {
            if (state != SubscriptionState.INIT) {
                return;
            }
            state = SubscriptionState.LIVE;
            lastAcceptedNanos = System.nanoTime();
            if (baseline != null) {
                latest = baseline;
                emit(baseline);
            }
        }
        log.info("{}: live", key);

        // opened outside the lock: a derived source subscribes to another multiplexer
        Registration registration;
        try {
            registration = adapter.pushSource().open(new PushListener<T>() {
                @Override
                public void onPush(T payload) {
                    candidateFrom(payload);
                }

                @Override
                public void onTerminal() {
                    complete();
                }

                @Override
                public void onError(Throwable error) {
                    fail(error instanceof StreamError ? error : new StreamError("push source failed", error));
                }
            });
        } catch (RuntimeException e) {
            fail(new StreamError("cannot open push source", e));
            return;
        }

        synchronized (lock) {
            if (state == SubscriptionState.LIVE) {
                pushRegistration = registration;
                if (adapter.pollWhenIdle()) {
                    schedulePoll(pollInterval);
                }
                return;
            }
        }
        // ended while opening
        registration.close();
    }

    private void candidateFrom(T payload) {
        if (state != SubscriptionState.LIVE) {
            return;
        }
        enqueueFetch(payload);
    }

    /**
     * Queues a candidate fetch behind the ones already queued. A re-fetch
     * (null payload) joins a re-fetch that has not started yet instead of
     * queuing another one.
     *
     * @param payload the pushed payload, or null to re-fetch
     * @return completes once the fetched candidate went through the gate
     */
    CompletableFuture<Void> enqueueFetch(T payload) {
        CompletableFuture<Void> previous;
        CompletableFuture<Void> next = new CompletableFuture<>();
        synchronized (lock) {
            if (payload == null && queuedRefetch != null) {
                log.debug("{}: re-fetch already queued, merging trigger", key);
                return queuedRefetch;
            }
            if (payload == null) {
                queuedRefetch = next;
            }
            previous = fetchTail;
            fetchTail = next;
        }
        previous.whenComplete((ignored, error) -> runFetch(payload, next));
        return next;
    }

    private void runFetch(T payload, CompletableFuture<Void> done) {
        if (payload == null) {
            synchronized (lock) {
                if (queuedRefetch == done) {
                    queuedRefetch = null;
                }
            }
        }
        if (state != SubscriptionState.LIVE) {
            done.complete(null);
            return;
        }
        CompletableFuture<T> candidate;
        try {
            candidate = adapter.fetchUpdate(payload);
        } catch (RuntimeException e) {
            candidate = CompletableFuture.failedFuture(e);
        }
        candidate.whenComplete((value, error) -> {
            try {
                if (error != null) {
                    log.warn("{}: dropping failed update fetch: {}", key, ExistencePoller.unwrap(error).toString());
                } else {
                    offer(value);
                }
            } finally {
                done.complete(null);
            }
        });
    }

    /**
     * Passes a candidate through the gate and emits it if accepted.
     *
     * @param candidate the candidate, null is ignored
     * @return true if the candidate was accepted
     */
    boolean offer(T candidate) {
        if (candidate == null) {
            return false;
        }
        boolean accepted = false;
        boolean terminal;
        synchronized (lock) {
            if (state != SubscriptionState.LIVE) {
                return false;
            }
            if (adapter.shouldApplyUpdate(candidate)) {
                T value = adapter.applyUpdate(candidate);
                lastAcceptedNanos = System.nanoTime();
                if (value != null && !Objects.equals(value, latest)) {
                    latest = value;
                    emit(value);
                    accepted = true;
                }
            } else {
                log.debug("{}: candidate rejected by gate", key);
            }
            terminal = adapter.isTerminal(candidate);
        }
        if (terminal) {
            complete();
        }
        return accepted;
    }

    private void schedulePoll(Duration delay) {
        if (scheduler.isShutdown()) {
            return;
        }
        pollTimer = scheduler.schedule(this::pollIfIdle, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void pollIfIdle() {
        synchronized (lock) {
            if (state != SubscriptionState.LIVE) {
                return;
            }
            long idleNanos = System.nanoTime() - lastAcceptedNanos;
            long remaining = pollInterval.toNanos() - idleNanos;
            if (remaining > 0 || pollInFlight.get()) {
                schedulePoll(remaining > 0 ? Duration.ofNanos(remaining) : pollInterval);
                return;
            }
            pollInFlight.set(true);
        }

        log.debug("{}: no update for {} ms, polling", key, pollInterval.toMillis());
        enqueueFetch(null).whenComplete((ignored, error) -> {
            synchronized (lock) {
                pollInFlight.set(false);
                if (state == SubscriptionState.LIVE) {
                    schedulePoll(pollInterval);
                }
            }
        });
    }

    private void complete() {
        List<UpdateListener<? super T>> current;
        synchronized (lock) {
            if (state == SubscriptionState.TERMINAL || state == SubscriptionState.FAILED) {
                return;
            }
            state = SubscriptionState.TERMINAL;
            current = List.copyOf(listeners);
            for (UpdateListener<? super T> listener : current) {
                notifyComplete(listener);
            }
            listeners.clear();
        }
        log.info("{}: resource ended, subscription completed", key);
        release();
    }

    private void fail(Throwable error) {
        synchronized (lock) {
            if (state == SubscriptionState.TERMINAL || state == SubscriptionState.FAILED) {
                return;
            }
            state = SubscriptionState.FAILED;
            failure = error;
            for (UpdateListener<? super T> listener : listeners) {
                notifyError(listener, error);
            }
            listeners.clear();
        }
        log.warn("{}: subscription failed: {}", key, error.toString());
        release();
    }

    /**
     * Stops push and poll. Attached listeners receive a completion signal
     * unless the subscription had already ended.
     */
    public void close() {
        synchronized (lock) {
            if (state == SubscriptionState.INIT || state == SubscriptionState.LIVE) {
                state = SubscriptionState.TERMINAL;
                for (UpdateListener<? super T> listener : listeners) {
                    notifyComplete(listener);
                }
            }
            listeners.clear();
        }
        release();
    }

    private void release() {
        Registration registration;
        synchronized (lock) {
            registration = pushRegistration;
            pushRegistration = null;
            if (pollTimer != null) {
                pollTimer.cancel(false);
                pollTimer = null;
            }
        }
        if (registration != null) {
            registration.close();
        }
        if (adapter != null) {
            adapter.close();
        }
    }

    private void emit(T value) {
        for (UpdateListener<? super T> listener : listeners) {
            notifyUpdate(listener, value);
        }
    }

    private void notifyUpdate(UpdateListener<? super T> listener, T value) {
        try {
            listener.onUpdate(value);
        } catch (RuntimeException e) {
            log.warn("{}: listener failed on update: {}", key, e.toString());
        }
    }

    private void notifyComplete(UpdateListener<? super T> listener) {
        try {
            listener.onComplete();
        } catch (RuntimeException e) {
            log.warn("{}: listener failed on completion: {}", key, e.toString());
        }
    }

    private void notifyError(UpdateListener<? super T> listener, Throwable error) {
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            log.warn("{}: listener failed on error: {}", key, e.toString());
        }
    }

    @Override
    public Registration subscribe(UpdateListener<? super T> listener, boolean replayLatest) {
        Objects.requireNonNull(listener, "listener cannot be null");
        synchronized (lock) {
            switch (state) {
                case FAILED:
                    notifyError(listener, failure);
                    return () -> {
                    };
                case TERMINAL:
                    if (replayLatest && latest != null) {
                        notifyUpdate(listener, latest);
                    }
                    notifyComplete(listener);
                    return () -> {
                    };
                default:
                    if (replayLatest && latest != null) {
                        notifyUpdate(listener, latest);
                    }
                    listeners.add(listener);
                    return () -> listeners.remove(listener);
            }
        }
    }

    /**
     * Returns the number of attached listeners.
     *
     * @return the consumer count
     */
    public int getConsumerCount() {
        return listeners.size();
    }

    /**
     * Returns the failure that ended this subscription, or null.
     *
     * @return the failure
     */
    public Throwable getFailure() {
        synchronized (lock) {
            return failure;
        }
    }

    /**
     * Returns the resource-specific operations.
     *
     * @return the adapter, null for a pre-completed subscription
     */
    public UpdateAdapter<T> getAdapter() {
        return adapter;
    }

    @Override
    public EntityKey getKey() {
        return key;
    }

    @Override
    public SubscriptionState getState() {
        return state;
    }

    @Override
    public T getLatestValue() {
        return latest;
    }

    @Override
    public String toString() {
        return "UpdateMultiplexer{" +
                "key=" + key +
                ", state=" + state +
                '}';
    }
}
