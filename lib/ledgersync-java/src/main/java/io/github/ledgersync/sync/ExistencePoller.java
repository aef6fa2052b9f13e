package io.github.ledgersync.sync;

import io.github.ledgersync.ApiResponse;
import io.github.ledgersync.CancellationToken;
import io.github.ledgersync.ExistenceResult;
import io.github.ledgersync.Registration;
import io.github.ledgersync.errors.CancelledError;
import io.github.ledgersync.errors.RequestFailedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Waits, with backoff, for a newly referenced resource to begin existing.
 * <p>
 * Each round issues a read: 200 completes the wait, 404 schedules another
 * round after the current backoff interval, any other status fails with
 * {@link RequestFailedError}. The wait is retried until the resource shows
 * up or the caller's {@link CancellationToken} is cancelled, which fails the
 * wait with {@link CancelledError}.
 * <p>
 * Concurrent waits for the same key share one poll loop: later callers
 * attach to the pending result of the first one, whose token governs the loop.
 *
 * @param <T> the resource type
 */
public final class ExistencePoller<T> {

    private static final Logger log = LoggerFactory.getLogger(ExistencePoller.class);

    private final Function<String, CompletableFuture<ApiResponse>> fetcher;
    private final Function<ApiResponse, T> decoder;
    private final BackoffPolicy backoff;
    private final Delayer delayer;
    private final ConcurrentMap<String, CompletableFuture<ExistenceResult<T>>> waiting = new ConcurrentHashMap<>();

    /**
     * Creates a new poller.
     *
     * @param fetcher reads the resource identified by a key, any status must complete normally
     * @param decoder decodes a 200 response
     * @param backoff the interval schedule between "not found yet" answers
     * @param delayer timer for the waits
     */
    public ExistencePoller(Function<String, CompletableFuture<ApiResponse>> fetcher,
                           Function<ApiResponse, T> decoder,
                           BackoffPolicy backoff,
                           Delayer delayer) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff cannot be null");
        this.delayer = Objects.requireNonNull(delayer, "delayer cannot be null");
    }

    /**
     * Waits until the resource exists.
     *
     * @param key    identifies the resource
     * @param cancel stops the wait between rounds
     * @return future with the found value and whether the caller had to wait
     */
    public CompletableFuture<ExistenceResult<T>> awaitExistence(String key, CancellationToken cancel) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(cancel, "cancel cannot be null");

        CompletableFuture<ExistenceResult<T>> started = new CompletableFuture<>();
        CompletableFuture<ExistenceResult<T>> pending = waiting.putIfAbsent(key, started);
        if (pending != null) {
            log.debug("attaching to pending existence wait for {}", key);
            return pending.copy();
        }

        started.whenComplete((result, error) -> waiting.remove(key, started));
        poll(key, cancel, backoff.getInitial(), false, started);
        return started.copy();
    }

    /**
     * Returns the number of keys with a wait in progress.
     *
     * @return pending waits
     */
    public int getPendingCount() {
        return waiting.size();
    }

    private void poll(String key, CancellationToken cancel, Duration interval, boolean waited,
                      CompletableFuture<ExistenceResult<T>> result) {
        if (cancel.isCancelled()) {
            result.completeExceptionally(new CancelledError("stopped waiting for " + key + " to exist"));
            return;
        }

        CompletableFuture<ApiResponse> read;
        try {
            read = fetcher.apply(key);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }

        read.whenComplete((response, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else if (response.getStatus() == ApiResponse.HTTP_OK) {
                complete(response, waited, result);
            } else if (response.isNotFound()) {
                log.debug("{} does not exist yet, checking again in {} ms", key, interval.toMillis());
                CompletableFuture<Void> wake = new CompletableFuture<>();
                // wake up early when cancelled
                Registration onCancel = cancel.onCancel(() -> wake.complete(null));
                delayer.delay(interval).whenComplete((ignored, delayError) -> {
                    if (delayError != null) {
                        wake.completeExceptionally(delayError);
                    } else {
                        wake.complete(null);
                    }
                });
                wake.whenComplete((ignored, delayError) -> {
                    onCancel.close();
                    if (delayError != null) {
                        result.completeExceptionally(unwrap(delayError));
                    } else {
                        poll(key, cancel, backoff.next(interval), true, result);
                    }
                });
            } else {
                result.completeExceptionally(new RequestFailedError(response.getStatus(), response.getUrl()));
            }
        });
    }

    private void complete(ApiResponse response, boolean waited, CompletableFuture<ExistenceResult<T>> result) {
        try {
            result.complete(new ExistenceResult<>(decoder.apply(response), waited));
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
