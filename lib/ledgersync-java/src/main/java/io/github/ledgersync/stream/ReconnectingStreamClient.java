package io.github.ledgersync.stream;

import io.github.ledgersync.errors.StreamError;
import io.github.ledgersync.sync.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Keeps server-sent-event connections alive.
 * <p>
 * Each {@link #open(Supplier, StreamHandlers)} call starts one logical
 * connection served by a daemon worker thread. When the connection ends or
 * fails transiently the worker waits a backoff delay, asks the URL factory
 * for a fresh URL (so the caller can resume from its latest cursor) and
 * reconnects. Client errors (4xx other than 408 and 429), a failing URL
 * factory or a failing message handler stop the connection and are reported
 * through {@link StreamHandlers#onUnexpectedError(Throwable)}.
 */
public final class ReconnectingStreamClient {

    private static final Logger log = LoggerFactory.getLogger(ReconnectingStreamClient.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final HttpClient httpClient;
    private final BackoffPolicy backoff;

    /**
     * Creates a new stream client.
     *
     * @param httpClient the HTTP client used for stream requests
     * @param backoff    delays between reconnect attempts
     */
    public ReconnectingStreamClient(HttpClient httpClient, BackoffPolicy backoff) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff cannot be null");
    }

    /**
     * Opens a push connection.
     *
     * @param urlFactory computes the stream URL, invoked again before every reconnect
     * @param handlers   receives messages and unrecoverable errors
     * @return handle that closes the connection
     */
    public StreamHandle open(Supplier<String> urlFactory, StreamHandlers handlers) {
        Objects.requireNonNull(urlFactory, "urlFactory cannot be null");
        Objects.requireNonNull(handlers, "handlers cannot be null");
        return new Connection(urlFactory, handlers);
    }

    /**
     * Returns the reconnect schedule.
     *
     * @return the backoff policy
     */
    public BackoffPolicy getBackoff() {
        return backoff;
    }

    private static boolean isRecoverableStatus(int status) {
        return status >= 500 || status == 408 || status == 429;
    }

    /**
     * SSE connection with auto-reconnection.
     */
    private final class Connection implements StreamHandle {
        private final Supplier<String> urlFactory;
        private final StreamHandlers handlers;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final Thread workerThread;
        private volatile InputStream currentBody;

        Connection(Supplier<String> urlFactory, StreamHandlers handlers) {
            this.urlFactory = urlFactory;
            this.handlers = handlers;

            // start background thread to read SSE events
            this.workerThread = new Thread(this::runWithReconnect,
                    "ledgersync-stream-" + THREAD_COUNTER.incrementAndGet());
            this.workerThread.setDaemon(true);
            this.workerThread.start();
        }

        private void runWithReconnect() {
            Duration delay = backoff.getInitial();

            while (!closed.get()) {
                try {
                    String url = nextUrl();
                    int received = streamEvents(url);
                    if (received > 0) {
                        delay = backoff.getInitial(); // reset after a connection that delivered events
                    }
                    if (!closed.get()) {
                        log.debug("stream {} ended after {} events, reconnecting in {} ms", url, received,
                                delay.toMillis());
                    }
                } catch (StreamError e) {
                    stopWithError(e);
                    return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    if (closed.get()) {
                        break;
                    }
                    log.warn("stream connection failed, reconnecting in {} ms: {}", delay.toMillis(), e.toString());
                }

                if (closed.get()) {
                    break;
                }
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                delay = backoff.next(delay);
            }
        }

        private String nextUrl() {
            try {
                return urlFactory.get();
            } catch (RuntimeException e) {
                throw new StreamError("cannot compute stream url", e);
            }
        }

        private int streamEvents(String url) throws IOException, InterruptedException {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Accept", "text/event-stream")
                    .header("Cache-Control", "no-cache")
                    .GET()
                    .build();

            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());

            int status = response.statusCode();
            if (status != 200) {
                response.body().close();
                if (isRecoverableStatus(status)) {
                    throw new IOException("HTTP " + status + " from " + url);
                }
                throw new StreamError("stream " + url + " rejected with status " + status);
            }

            currentBody = response.body();
            if (closed.get()) {
                currentBody.close();
                return 0;
            }

            int received = 0;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(currentBody, StandardCharsets.UTF_8))) {

                String eventType = "";
                String eventId = null;
                StringBuilder eventData = null;

                String line;
                while (!closed.get() && (line = reader.readLine()) != null) {
                    if (line.startsWith(":")) {
                        continue; // comment / keep-alive
                    }
                    if (line.startsWith("event:")) {
                        eventType = line.substring(6).trim();
                    } else if (line.startsWith("id:")) {
                        eventId = line.substring(3).trim();
                    } else if (line.startsWith("data:")) {
                        String data = line.substring(5).trim();
                        if (eventData == null) {
                            eventData = new StringBuilder(data);
                        } else {
                            eventData.append('\n').append(data);
                        }
                    } else if (line.isEmpty()) {
                        // end of event
                        if (eventData != null && isMessageEvent(eventType)) {
                            dispatch(new StreamMessage(StreamMessage.DEFAULT_EVENT, eventData.toString(), eventId));
                            received++;
                        }
                        eventType = "";
                        eventData = null;
                    }
                }
            } finally {
                currentBody = null;
            }
            return received;
        }

        private boolean isMessageEvent(String eventType) {
            return eventType.isEmpty() || StreamMessage.DEFAULT_EVENT.equals(eventType);
        }

        private void dispatch(StreamMessage message) {
            if (closed.get()) {
                return;
            }
            try {
                handlers.onMessage(message);
            } catch (RuntimeException e) {
                throw new StreamError("stream message handler failed", e);
            }
        }

        private void stopWithError(StreamError error) {
            if (closed.compareAndSet(false, true)) {
                log.warn("stream stopped: {}", error.getMessage());
                handlers.onUnexpectedError(error);
            }
        }

        @Override
        public boolean isClosed() {
            return closed.get();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            workerThread.interrupt();
            InputStream body = currentBody;
            if (body != null) {
                try {
                    body.close();
                } catch (IOException e) {
                    log.debug("closing stream body failed: {}", e.toString());
                }
            }
            if (Thread.currentThread() != workerThread) {
                try {
                    workerThread.join(1000); // wait up to 1 second for thread to terminate
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
