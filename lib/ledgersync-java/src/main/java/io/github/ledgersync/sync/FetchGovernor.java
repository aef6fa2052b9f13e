package io.github.ledgersync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Bounds and prioritizes outbound reads against the ledger API.
 * <p>
 * At most {@code concurrency} tasks run at a time; further tasks wait in a
 * single queue ordered by {@link FetchPriority} (higher first) and then by
 * submission order. A failed task only fails its own future, and the queue
 * never retries.
 * <p>
 * This class is thread-safe.
 */
public final class FetchGovernor {

    /** default number of concurrently running fetches */
    public static final int DEFAULT_CONCURRENCY = 8;

    private static final Logger log = LoggerFactory.getLogger(FetchGovernor.class);

    private static final Comparator<QueuedTask<?>> ORDER = Comparator
            .<QueuedTask<?>, Integer>comparing(task -> task.priority.ordinal(), Comparator.reverseOrder())
            .thenComparingLong(task -> task.sequence);

    private final int concurrency;
    private final Object lock = new Object();
    private final PriorityQueue<QueuedTask<?>> queue = new PriorityQueue<>(ORDER);
    private long nextSequence;
    private int running;

    /**
     * Creates a governor with the default concurrency of {@value #DEFAULT_CONCURRENCY}.
     */
    public FetchGovernor() {
        this(DEFAULT_CONCURRENCY);
    }

    /**
     * Creates a governor.
     *
     * @param concurrency the maximum number of running tasks, at least 1
     * @throws IllegalArgumentException if concurrency is less than 1
     */
    public FetchGovernor(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got: " + concurrency);
        }
        this.concurrency = concurrency;
    }

    /**
     * Queues a task. The task is started once a slot is free and no queued
     * task of higher priority, or of equal priority submitted earlier, is waiting.
     *
     * @param task     starts the fetch and returns its completion
     * @param priority the priority class
     * @param <T>      the result type
     * @return future completed with the task's outcome
     */
    public <T> CompletableFuture<T> submit(Supplier<? extends CompletionStage<T>> task, FetchPriority priority) {
        Objects.requireNonNull(task, "task cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");

        CompletableFuture<T> result = new CompletableFuture<>();
        synchronized (lock) {
            queue.add(new QueuedTask<>(task, priority, nextSequence++, result));
        }
        drain();
        return result;
    }

    /**
     * Returns the maximum number of running tasks.
     *
     * @return the concurrency
     */
    public int getConcurrency() {
        return concurrency;
    }

    /**
     * Returns the number of tasks currently running.
     *
     * @return running tasks
     */
    public int getRunningCount() {
        synchronized (lock) {
            return running;
        }
    }

    /**
     * Returns the number of tasks waiting for a slot.
     *
     * @return queued tasks
     */
    public int getQueuedCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    private void drain() {
        List<QueuedTask<?>> admitted = new ArrayList<>();
        synchronized (lock) {
            while (running < concurrency && !queue.isEmpty()) {
                admitted.add(queue.poll());
                running++;
            }
        }
        // start outside the lock, tasks may complete synchronously
        for (QueuedTask<?> task : admitted) {
            start(task);
        }
    }

    private <T> void start(QueuedTask<T> task) {
        CompletionStage<T> stage;
        try {
            stage = task.supplier.get();
            if (stage == null) {
                stage = CompletableFuture.failedFuture(new NullPointerException("task returned no completion stage"));
            }
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        stage.whenComplete((value, error) -> {
            synchronized (lock) {
                running--;
            }
            if (error != null) {
                log.debug("governed {} fetch failed: {}", task.priority, error.toString());
                task.result.completeExceptionally(error);
            } else {
                task.result.complete(value);
            }
            drain();
        });
    }

    private static final class QueuedTask<T> {
        private final Supplier<? extends CompletionStage<T>> supplier;
        private final FetchPriority priority;
        private final long sequence;
        private final CompletableFuture<T> result;

        private QueuedTask(Supplier<? extends CompletionStage<T>> supplier, FetchPriority priority, long sequence,
                           CompletableFuture<T> result) {
            this.supplier = supplier;
            this.priority = priority;
            this.sequence = sequence;
            this.result = result;
        }
    }
}
