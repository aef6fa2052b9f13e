package io.github.ledgersync;

import io.github.ledgersync.errors.CancelledError;
import io.github.ledgersync.sync.BackoffPolicy;
import io.github.ledgersync.sync.ExistencePoller;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    void runsCallbacksOnceOnCancel() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(token.getCallbackCount()).isZero();
    }

    @Test
    void runsLateCallbackRightAway() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(token.getCallbackCount()).isZero();
    }

    @Test
    void closedRegistrationIsNotRun() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        Registration registration = token.onCancel(calls::incrementAndGet);

        registration.close();
        token.cancel();

        assertThat(calls.get()).isZero();
        assertThat(token.getCallbackCount()).isZero();
    }

    @Test
    void sharedNoneTokenIgnoresCancelAndKeepsNothing() {
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.none().onCancel(calls::incrementAndGet);

        CancellationToken.none().cancel();

        assertThat(CancellationToken.none().isCancelled()).isFalse();
        assertThat(CancellationToken.none().getCallbackCount()).isZero();
        assertThat(calls.get()).isZero();
    }

    @Test
    void longExistenceWaitDoesNotPileUpCallbacks() throws Exception {
        AtomicInteger reads = new AtomicInteger();
        ExistencePoller<String> poller = new ExistencePoller<>(
                key -> CompletableFuture.completedFuture(
                        new ApiResponse(reads.incrementAndGet() > 200 ? 200 : 404, "found", "http://ledger/" + key)),
                ApiResponse::getBody, BackoffPolicy.existenceDefault(), delay -> CompletableFuture.completedFuture(null));
        CancellationToken token = new CancellationToken();

        ExistenceResult<String> result = poller.awaitExistence("GABC", token).get(2, TimeUnit.SECONDS);

        assertThat(result.hadToWait()).isTrue();
        assertThat(reads.get()).isEqualTo(201);
        assertThat(token.getCallbackCount()).isZero();
    }

    @Test
    void cancelWakesPendingExistenceWait() {
        ExistencePoller<String> poller = new ExistencePoller<>(
                key -> CompletableFuture.completedFuture(new ApiResponse(404, "", "http://ledger/" + key)),
                ApiResponse::getBody, BackoffPolicy.existenceDefault(), delay -> new CompletableFuture<>());
        CancellationToken token = new CancellationToken();

        CompletableFuture<ExistenceResult<String>> wait = poller.awaitExistence("GABC", token);
        assertThat(token.getCallbackCount()).isEqualTo(1);

        token.cancel();

        assertThatThrownBy(() -> wait.get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CancelledError.class);
        assertThat(token.getCallbackCount()).isZero();
    }
}
