package io.github.ledgersync.sync;

import io.github.ledgersync.EntityKey;
import io.github.ledgersync.FeedType;
import io.github.ledgersync.Registration;
import io.github.ledgersync.SubscriptionState;
import io.github.ledgersync.UpdateListener;
import io.github.ledgersync.errors.RequestFailedError;
import io.github.ledgersync.errors.StreamError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class UpdateMultiplexerTest {

    private static final EntityKey KEY = EntityKey.forAccount(FeedType.ACCOUNT, "http://ledger", "GABC");

    private ScheduledExecutorService scheduler;
    private ScriptedAdapter adapter;
    private UpdateMultiplexer<String> multiplexer;
    private RecordingListener<String> listener;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        adapter = new ScriptedAdapter();
        adapter.pollWhenIdle = false;
        multiplexer = new UpdateMultiplexer<>(KEY, adapter, scheduler, Duration.ofSeconds(10));
        listener = new RecordingListener<>();
        multiplexer.subscribe(listener);
    }

    @AfterEach
    void tearDown() {
        multiplexer.close();
        scheduler.shutdownNow();
    }

    @Test
    void emitsBaselineThenAcceptedPushes() {
        multiplexer.start();
        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.INIT);

        adapter.baseline.complete("a");
        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.LIVE);

        adapter.push.onPush("b");
        adapter.push.onPush("b");
        adapter.push.onPush("c");

        assertThat(listener.values).containsExactly("a", "b", "c");
        assertThat(multiplexer.getLatestValue()).isEqualTo("c");
    }

    @Test
    void neverEmitsTheSameValueTwiceInARow() {
        adapter.acceptEverything = true;
        multiplexer.start();
        adapter.baseline.complete("a");

        adapter.push.onPush("a");
        adapter.push.onPush("b");
        adapter.push.onPush("b");
        adapter.push.onPush("a");

        assertThat(listener.values).containsExactly("a", "b", "a");
    }

    @Test
    void startRunsInitOnlyOnce() {
        multiplexer.start();
        multiplexer.start();

        assertThat(adapter.initCalls.get()).isEqualTo(1);
    }

    @Test
    void nullBaselineGoesLiveWithoutEmitting() {
        multiplexer.start();
        adapter.baseline.complete(null);

        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.LIVE);
        assertThat(listener.values).isEmpty();

        adapter.push.onPush("first");
        assertThat(listener.values).containsExactly("first");
    }

    @Test
    void failedBaselineFailsSubscription() {
        multiplexer.start();
        adapter.baseline.completeExceptionally(new RequestFailedError(500, "http://ledger/accounts/GABC"));

        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.FAILED);
        assertThat(multiplexer.getFailure()).isInstanceOf(RequestFailedError.class);
        assertThat(listener.errors).hasSize(1);
        assertThat(listener.errors.get(0)).isInstanceOf(RequestFailedError.class);
        assertThat(adapter.push).isNull();

        RecordingListener<String> late = new RecordingListener<>();
        multiplexer.subscribe(late);
        assertThat(late.errors).hasSize(1);
    }

    @Test
    void pushErrorFailsSubscriptionOnce() {
        multiplexer.start();
        adapter.baseline.complete("a");

        adapter.push.onError(new StreamError("stream rejected"));
        adapter.push.onError(new StreamError("stream rejected again"));
        adapter.push.onPush("b");

        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.FAILED);
        assertThat(listener.errors).hasSize(1);
        assertThat(listener.values).containsExactly("a");
        assertThat(adapter.pushClosed.get()).isTrue();
    }

    @Test
    void failedFetchIsDroppedAndSubscriptionStaysLive() {
        multiplexer.start();
        adapter.baseline.complete("a");

        adapter.push.onPush("boom");
        adapter.push.onPush("b");

        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.LIVE);
        assertThat(listener.values).containsExactly("a", "b");
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void terminalCandidateCompletesSubscription() {
        multiplexer.start();
        adapter.baseline.complete("a");

        adapter.push.onPush("end");
        adapter.push.onPush("after");

        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.TERMINAL);
        assertThat(listener.values).containsExactly("a", "end");
        assertThat(listener.completions.get()).isEqualTo(1);
        assertThat(adapter.pushClosed.get()).isTrue();
        assertThat(adapter.closeCalls.get()).isPositive();

        RecordingListener<String> late = new RecordingListener<>();
        multiplexer.subscribe(late);
        assertThat(late.values).containsExactly("end");
        assertThat(late.completions.get()).isEqualTo(1);
    }

    @Test
    void upstreamTerminationCompletesSubscription() {
        multiplexer.start();
        adapter.baseline.complete("a");

        adapter.push.onTerminal();

        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.TERMINAL);
        assertThat(listener.completions.get()).isEqualTo(1);
    }

    @Test
    void lateSubscriberReceivesLatestValue() {
        multiplexer.start();
        adapter.baseline.complete("a");
        adapter.push.onPush("b");

        RecordingListener<String> late = new RecordingListener<>();
        multiplexer.subscribe(late);
        RecordingListener<String> withoutReplay = new RecordingListener<>();
        multiplexer.subscribe(withoutReplay, false);
        adapter.push.onPush("c");

        assertThat(late.values).containsExactly("b", "c");
        assertThat(withoutReplay.values).containsExactly("c");
        assertThat(multiplexer.getConsumerCount()).isEqualTo(3);
    }

    @Test
    void detachedListenerReceivesNothing() {
        multiplexer.start();
        adapter.baseline.complete("a");

        RecordingListener<String> other = new RecordingListener<>();
        Registration registration = multiplexer.subscribe(other);
        registration.close();
        adapter.push.onPush("b");

        assertThat(other.values).containsExactly("a");
        assertThat(listener.values).containsExactly("a", "b");
    }

    @Test
    void failingListenerDoesNotAffectOthers() {
        multiplexer.subscribe(value -> {
            throw new IllegalStateException("listener broke");
        });
        multiplexer.start();
        adapter.baseline.complete("a");
        adapter.push.onPush("b");

        assertThat(listener.values).containsExactly("a", "b");
    }

    @Test
    void failingLateSubscriberIsStillAttached() {
        multiplexer.start();
        adapter.baseline.complete("a");
        RecordingListener<String> seen = new RecordingListener<>();

        multiplexer.subscribe(value -> {
            seen.onUpdate(value);
            throw new IllegalStateException("listener broke");
        });
        adapter.push.onPush("b");

        assertThat(seen.values).containsExactly("a", "b");
        assertThat(listener.values).containsExactly("a", "b");
        assertThat(multiplexer.getConsumerCount()).isEqualTo(2);
    }

    @Test
    void failingSubscriberOfEndedSubscriptionStillGetsCompletion() {
        UpdateMultiplexer<String> completed = UpdateMultiplexer.completed(KEY, "only");
        RecordingListener<String> late = new RecordingListener<>();

        completed.subscribe(new UpdateListener<>() {
            @Override
            public void onUpdate(String value) {
                throw new IllegalStateException("listener broke");
            }

            @Override
            public void onComplete() {
                late.onComplete();
            }
        });

        assertThat(late.completions.get()).isEqualTo(1);
    }

    @Test
    void pollsWhenIdle() throws Exception {
        ScriptedAdapter polling = new ScriptedAdapter();
        polling.pollResults.add("polled");
        UpdateMultiplexer<String> idle = new UpdateMultiplexer<>(KEY, polling, scheduler, Duration.ofMillis(50));
        RecordingListener<String> values = new RecordingListener<>();

        idle.start();
        polling.baseline.complete(null);
        idle.subscribe(values);

        assertThat(values.awaitValue(2000)).isTrue();
        assertThat(values.values).containsExactly("polled");
        assertThat(polling.polls.get()).isPositive();
        idle.close();
    }

    @Test
    void doesNotPollWhenDisabled() throws Exception {
        UpdateMultiplexer<String> quiet = new UpdateMultiplexer<>(KEY, adapter, scheduler, Duration.ofMillis(20));
        quiet.start();
        adapter.baseline.complete("a");

        Thread.sleep(200);

        assertThat(adapter.polls.get()).isZero();
        quiet.close();
    }

    @Test
    void closeReleasesPushSourceAndIgnoresLaterPushes() {
        multiplexer.start();
        adapter.baseline.complete("a");

        multiplexer.close();
        adapter.push.onPush("b");

        assertThat(adapter.pushClosed.get()).isTrue();
        assertThat(listener.values).containsExactly("a");
        assertThat(listener.completions.get()).isEqualTo(1);
        assertThat(multiplexer.getConsumerCount()).isZero();
    }

    @Test
    void closeSignalsCompletionOnlyOnce() {
        multiplexer.start();
        adapter.baseline.complete("a");
        adapter.push.onTerminal();

        multiplexer.close();

        assertThat(listener.completions.get()).isEqualTo(1);
    }

    @Test
    void closeBeforeBaselineSignalsCompletion() {
        multiplexer.start();

        multiplexer.close();
        adapter.baseline.complete("a");

        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.TERMINAL);
        assertThat(listener.values).isEmpty();
        assertThat(listener.completions.get()).isEqualTo(1);
    }

    @Test
    void refetchesRunOneAtATime() {
        adapter.holdRefetches = true;
        multiplexer.start();
        adapter.baseline.complete("a");

        adapter.push.onPush(null);
        adapter.push.onPush(null);
        adapter.push.onPush(null);

        // the triggers behind the running fetch merge into one follow-up
        assertThat(adapter.heldRefetches).hasSize(1);
        adapter.heldRefetches.poll().complete("b");
        assertThat(adapter.heldRefetches).hasSize(1);
        adapter.heldRefetches.poll().complete("c");

        assertThat(adapter.heldRefetches).isEmpty();
        assertThat(adapter.polls.get()).isEqualTo(2);
        assertThat(listener.values).containsExactly("a", "b", "c");
    }

    @Test
    void slowRefetchIsNotOvertakenByNewerOne() {
        adapter.holdRefetches = true;
        multiplexer.start();
        adapter.baseline.complete("a");

        adapter.push.onPush(null);
        CompletableFuture<String> slow = adapter.heldRefetches.poll();
        adapter.push.onPush(null);
        assertThat(adapter.heldRefetches).isEmpty();

        slow.complete("b");
        adapter.heldRefetches.poll().complete("c");

        assertThat(listener.values).containsExactly("a", "b", "c");
        assertThat(multiplexer.getLatestValue()).isEqualTo("c");
    }

    @Test
    void pushedValuesKeepTheirOrderBehindPendingRefetch() {
        adapter.holdRefetches = true;
        multiplexer.start();
        adapter.baseline.complete("a");

        adapter.push.onPush(null);
        adapter.push.onPush("c");
        assertThat(listener.values).containsExactly("a");

        adapter.heldRefetches.poll().complete("b");

        assertThat(listener.values).containsExactly("a", "b", "c");
    }

    @Test
    void failedRefetchDoesNotBlockLaterOnes() {
        adapter.holdRefetches = true;
        multiplexer.start();
        adapter.baseline.complete("a");

        adapter.push.onPush(null);
        adapter.push.onPush(null);
        adapter.heldRefetches.poll().completeExceptionally(new IllegalStateException("read failed"));
        adapter.heldRefetches.poll().complete("b");

        assertThat(multiplexer.getState()).isEqualTo(SubscriptionState.LIVE);
        assertThat(listener.values).containsExactly("a", "b");
    }

    @Test
    void completedSubscriptionReplaysValueAndCompletion() {
        UpdateMultiplexer<String> completed = UpdateMultiplexer.completed(KEY, "only");
        completed.start();

        RecordingListener<String> late = new RecordingListener<>();
        completed.subscribe(late);

        assertThat(completed.getState()).isEqualTo(SubscriptionState.TERMINAL);
        assertThat(late.values).containsExactly("only");
        assertThat(late.completions.get()).isEqualTo(1);
    }

    @Test
    void derivedSourceTriggersOnUpstreamUpdatesOnly() {
        multiplexer.start();
        adapter.baseline.complete("a");

        RecordingListener<String> pushes = new RecordingListener<>();
        DerivedPushSource<String> source = DerivedPushSource.from(multiplexer);
        Registration registration = source.open(new PushListener<String>() {
            @Override
            public void onPush(String payload) {
                pushes.onUpdate(String.valueOf(payload));
            }

            @Override
            public void onTerminal() {
                pushes.onComplete();
            }

            @Override
            public void onError(Throwable error) {
                pushes.onError(error);
            }
        });

        assertThat(source.getUpstream()).isSameAs(multiplexer);
        assertThat(pushes.values).isEmpty();

        adapter.push.onPush("b");
        adapter.push.onPush("b");
        assertThat(pushes.values).containsExactly("null");

        adapter.push.onPush("end");
        assertThat(pushes.completions.get()).isEqualTo(1);
        registration.close();
    }
}
