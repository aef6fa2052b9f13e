package io.github.ledgersync.stream;

import io.github.ledgersync.errors.StreamError;
import io.github.ledgersync.sync.BackoffPolicy;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ReconnectingStreamClientTest {

    private MockWebServer server;
    private ReconnectingStreamClient client;
    private final BlockingQueue<StreamMessage> messages = new LinkedBlockingQueue<>();
    private final BlockingQueue<Throwable> errors = new LinkedBlockingQueue<>();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new ReconnectingStreamClient(HttpClient.newHttpClient(),
                BackoffPolicy.of(Duration.ofMillis(20), 2.0, Duration.ofMillis(100)));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private StreamHandlers recording() {
        return new StreamHandlers() {
            @Override
            public void onMessage(StreamMessage message) {
                messages.add(message);
            }

            @Override
            public void onUnexpectedError(Throwable error) {
                errors.add(error);
            }
        };
    }

    private static MockResponse events(String body) {
        return new MockResponse()
                .setBody(body)
                .setHeader("Content-Type", "text/event-stream");
    }

    @Test
    void deliversMessagesInArrivalOrder() throws Exception {
        server.enqueue(events("event: open\ndata: \"hello\"\n\n" +
                ": keep-alive\n\n" +
                "id: 1\ndata: {\"n\":1}\n\n" +
                "id: 2\ndata: line one\ndata: line two\n\n" +
                "event: message\nid: 3\ndata: {\"n\":3}\n\n"));

        try (StreamHandle handle = client.open(() -> server.url("/stream").toString(), recording())) {
            StreamMessage first = messages.poll(2, TimeUnit.SECONDS);
            StreamMessage second = messages.poll(2, TimeUnit.SECONDS);
            StreamMessage third = messages.poll(2, TimeUnit.SECONDS);

            assertThat(first).isEqualTo(new StreamMessage("message", "{\"n\":1}", "1"));
            assertThat(second.getData()).isEqualTo("line one\nline two");
            assertThat(second.getId()).isEqualTo("2");
            assertThat(third.getId()).isEqualTo("3");
            assertThat(handle.isClosed()).isFalse();
        }

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("Accept")).isEqualTo("text/event-stream");
    }

    @Test
    void reconnectsWithFreshUrlAfterStreamEnds() throws Exception {
        AtomicReference<String> cursor = new AtomicReference<>("now");
        server.enqueue(events("id: 7\ndata: {\"n\":7}\n\n"));
        server.enqueue(events("id: 8\ndata: {\"n\":8}\n\n"));

        StreamHandlers handlers = new StreamHandlers() {
            @Override
            public void onMessage(StreamMessage message) {
                cursor.set(message.getId());
                messages.add(message);
            }

            @Override
            public void onUnexpectedError(Throwable error) {
                errors.add(error);
            }
        };

        try (StreamHandle ignored = client.open(() -> server.url("/effects?cursor=" + cursor.get()).toString(),
                handlers)) {
            assertThat(messages.poll(2, TimeUnit.SECONDS).getId()).isEqualTo("7");
            assertThat(messages.poll(2, TimeUnit.SECONDS).getId()).isEqualTo("8");
        }

        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/effects?cursor=now");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/effects?cursor=7");
        assertThat(errors).isEmpty();
    }

    @Test
    void recoversFromServerErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(events("data: {\"n\":1}\n\n"));

        try (StreamHandle ignored = client.open(() -> server.url("/stream").toString(), recording())) {
            StreamMessage message = messages.poll(3, TimeUnit.SECONDS);
            assertThat(message).isNotNull();
            assertThat(message.getData()).isEqualTo("{\"n\":1}");
        }

        assertThat(server.getRequestCount()).isGreaterThanOrEqualTo(3);
        assertThat(errors).isEmpty();
    }

    @Test
    void clientErrorStopsWithoutReconnecting() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(events("data: {\"n\":1}\n\n"));

        StreamHandle handle = client.open(() -> server.url("/stream").toString(), recording());

        Throwable error = errors.poll(2, TimeUnit.SECONDS);
        assertThat(error).isInstanceOf(StreamError.class).hasMessageContaining("404");
        Thread.sleep(200);
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(handle.isClosed()).isTrue();
        assertThat(messages).isEmpty();
        assertThat(errors).isEmpty();
    }

    @Test
    void failingUrlFactoryIsUnrecoverable() throws Exception {
        StreamHandle handle = client.open(() -> {
            throw new IllegalStateException("no cursor");
        }, recording());

        Throwable error = errors.poll(2, TimeUnit.SECONDS);
        assertThat(error).isInstanceOf(StreamError.class).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(handle.isClosed()).isTrue();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void failingHandlerIsUnrecoverable() throws Exception {
        server.enqueue(events("data: first\n\ndata: second\n\n"));
        AtomicInteger calls = new AtomicInteger();

        StreamHandle handle = client.open(() -> server.url("/stream").toString(), new StreamHandlers() {
            @Override
            public void onMessage(StreamMessage message) {
                calls.incrementAndGet();
                throw new IllegalArgumentException("cannot decode " + message.getData());
            }

            @Override
            public void onUnexpectedError(Throwable error) {
                errors.add(error);
            }
        });

        Throwable error = errors.poll(2, TimeUnit.SECONDS);
        assertThat(error).isInstanceOf(StreamError.class).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    void closeFromHandlerStopsReconnects() throws Exception {
        server.enqueue(events("data: only\n\n"));
        server.enqueue(events("data: never\n\n"));
        CompletableFuture<StreamHandle> handleRef = new CompletableFuture<>();

        StreamHandle handle = client.open(() -> server.url("/stream").toString(), new StreamHandlers() {
            @Override
            public void onMessage(StreamMessage message) {
                messages.add(message);
                handleRef.join().close();
            }

            @Override
            public void onUnexpectedError(Throwable error) {
                errors.add(error);
            }
        });
        handleRef.complete(handle);

        assertThat(messages.poll(2, TimeUnit.SECONDS).getData()).isEqualTo("only");
        Thread.sleep(300);

        assertThat(handle.isClosed()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(messages).isEmpty();
        assertThat(errors).isEmpty();
    }

    @Test
    void closeIsIdempotent() {
        server.enqueue(events(": nothing yet\n\n"));

        StreamHandle handle = client.open(() -> server.url("/stream").toString(), recording());
        handle.close();
        handle.close();
        handle.close();

        assertThat(handle.isClosed()).isTrue();
        assertThat(errors).isEmpty();
    }
}
