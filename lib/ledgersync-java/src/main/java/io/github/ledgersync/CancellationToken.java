package io.github.ledgersync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for long waits such as
 * {@link LedgerApi#awaitAccount(String, CancellationToken)}.
 * <p>
 * The token can be checked with {@link #isCancelled()} or observed through
 * {@link #onCancel(Runnable)}. Cancelling is permanent.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Creates a token that is not cancelled yet.
     */
    public CancellationToken() {
    }

    /**
     * Returns a shared token that is never cancelled.
     *
     * @return the token
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Cancels the token and runs the registered callbacks once. Has no effect
     * on {@link #none()} or an already cancelled token.
     */
    public void cancel() {
        if (this == NONE || !cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            run(callback);
        }
    }

    /**
     * Checks whether the token has been cancelled.
     *
     * @return true if cancelled
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback to run when the token is cancelled. The callback
     * runs right away if the token is already cancelled. Closing the returned
     * registration drops the callback.
     *
     * @param callback the callback to run at most once
     * @return handle that removes the callback
     */
    public Registration onCancel(Runnable callback) {
        if (this == NONE) {
            return () -> { };
        }
        callbacks.add(callback);
        if (cancelled.get()) {
            run(callback);
        }
        return () -> callbacks.remove(callback);
    }

    int getCallbackCount() {
        return callbacks.size();
    }

    private void run(Runnable callback) {
        // cancel() and a late onCancel() may race for the same callback
        if (!callbacks.remove(callback)) {
            return;
        }
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("cancellation callback failed: {}", e.toString());
        }
    }
}
