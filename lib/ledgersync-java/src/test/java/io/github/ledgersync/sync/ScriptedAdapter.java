package io.github.ledgersync.sync;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter driven by the test: the baseline future, poll results and pushes
 * are controlled from outside. Values are accepted when they differ from
 * the last accepted one; "end" is terminal and "boom" fails its fetch.
 * With {@code holdRefetches} set, re-fetches stay pending in
 * {@code heldRefetches} until the test completes them.
 */
class ScriptedAdapter implements UpdateAdapter<String> {

    final CompletableFuture<String> baseline = new CompletableFuture<>();
    final Queue<String> pollResults = new ConcurrentLinkedQueue<>();
    final AtomicInteger initCalls = new AtomicInteger();
    final AtomicInteger polls = new AtomicInteger();
    final AtomicInteger closeCalls = new AtomicInteger();
    final AtomicBoolean pushClosed = new AtomicBoolean();
    final Queue<CompletableFuture<String>> heldRefetches = new ConcurrentLinkedQueue<>();

    volatile PushListener<String> push;
    volatile boolean acceptEverything;
    volatile boolean pollWhenIdle = true;
    volatile boolean holdRefetches;

    private String last;

    @Override
    public CompletableFuture<String> init() {
        initCalls.incrementAndGet();
        return baseline.thenApply(value -> {
            last = value;
            return value;
        });
    }

    @Override
    public CompletableFuture<String> fetchUpdate(String pushed) {
        if (pushed == null) {
            polls.incrementAndGet();
            if (holdRefetches) {
                CompletableFuture<String> held = new CompletableFuture<>();
                heldRefetches.add(held);
                return held;
            }
            return CompletableFuture.completedFuture(pollResults.poll());
        }
        if ("boom".equals(pushed)) {
            return CompletableFuture.failedFuture(new IllegalStateException("fetch failed"));
        }
        return CompletableFuture.completedFuture(pushed);
    }

    @Override
    public boolean shouldApplyUpdate(String candidate) {
        return acceptEverything || !candidate.equals(last);
    }

    @Override
    public String applyUpdate(String candidate) {
        last = candidate;
        return candidate;
    }

    @Override
    public boolean isTerminal(String candidate) {
        return "end".equals(candidate);
    }

    @Override
    public boolean pollWhenIdle() {
        return pollWhenIdle;
    }

    @Override
    public PushSource<String> pushSource() {
        return listener -> {
            push = listener;
            return () -> pushClosed.set(true);
        };
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
    }
}
