package io.github.ledgersync.sync;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Non-blocking timer used by retry loops.
 */
@FunctionalInterface
public interface Delayer {

    /**
     * Returns a future completing after the given delay.
     *
     * @param delay the delay
     * @return the timer future
     */
    CompletableFuture<Void> delay(Duration delay);

    /**
     * Creates a delayer backed by a scheduler.
     *
     * @param scheduler the scheduler
     * @return the delayer
     */
    static Delayer using(ScheduledExecutorService scheduler) {
        return delay -> {
            CompletableFuture<Void> timer = new CompletableFuture<>();
            scheduler.schedule(() -> timer.complete(null), delay.toNanos(), TimeUnit.NANOSECONDS);
            return timer;
        };
    }
}
