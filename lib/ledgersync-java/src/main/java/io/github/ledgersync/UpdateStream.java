package io.github.ledgersync;

import io.github.ledgersync.errors.LedgerException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Blocking iterable view over a {@link Subscription}.
 * <p>
 * Use with try-with-resources for automatic cleanup:
 * <pre>{@code
 * try (UpdateStream<EffectRecord> effects = client.subscribeToAccountEffects(id).stream()) {
 *     for (EffectRecord effect : effects) {
 *         System.out.println(effect.getType());
 *     }
 * }
 * }</pre>
 * Iteration ends when the subscription completes or the stream is closed.
 * If the subscription fails, the iterator throws the failure.
 *
 * @param <T> the value type
 */
public final class UpdateStream<T> implements UpdateListener<T>, Iterable<T>, AutoCloseable {

    private static final Object COMPLETED = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Registration registration;

    UpdateStream() {
    }

    void attach(Registration registration) {
        this.registration = registration;
        if (closed.get()) {
            registration.close();
        }
    }

    @Override
    public void onUpdate(T value) {
        queue.add(value);
    }

    @Override
    public void onComplete() {
        queue.add(COMPLETED);
    }

    @Override
    public void onError(Throwable error) {
        queue.add(new Failure(error));
    }

    /**
     * Returns an iterator over subscription values.
     * The iterator blocks waiting for new values until the subscription ends or this stream is closed.
     *
     * @return iterator over values
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private Object next = null;
            private boolean finished = false;

            @Override
            public boolean hasNext() {
                if (finished) {
                    return false;
                }
                if (next == null) {
                    next = take();
                }
                if (next == null || next == COMPLETED) {
                    finished = true;
                    return false;
                }
                if (next instanceof Failure) {
                    finished = true;
                    Throwable error = ((Failure) next).error;
                    if (error instanceof RuntimeException) {
                        throw (RuntimeException) error;
                    }
                    throw new LedgerException("subscription failed", error);
                }
                return true;
            }

            @Override
            @SuppressWarnings("unchecked")
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T result = (T) next;
                next = null;
                return result;
            }
        };
    }

    private Object take() {
        try {
            // poll with timeout to allow checking closed flag
            while (!closed.get()) {
                Object item = queue.poll(100, TimeUnit.MILLISECONDS);
                if (item != null) {
                    return item;
                }
            }
            // drain remaining queue after close
            return queue.poll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    /**
     * Detaches from the subscription and ends iteration. Safe to call multiple times.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            Registration current = registration;
            if (current != null) {
                current.close();
            }
        }
    }

    private static final class Failure {
        private final Throwable error;

        private Failure(Throwable error) {
            this.error = error;
        }
    }
}
