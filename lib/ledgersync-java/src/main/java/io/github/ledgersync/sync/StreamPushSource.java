package io.github.ledgersync.sync;

import io.github.ledgersync.Registration;
import io.github.ledgersync.stream.ReconnectingStreamClient;
import io.github.ledgersync.stream.StreamHandlers;
import io.github.ledgersync.stream.StreamMessage;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Push source backed by a reconnecting server-sent-event stream. Every
 * message is decoded into a payload and handed to the listener.
 *
 * @param <T> the payload type
 */
public final class StreamPushSource<T> implements PushSource<T> {

    private final ReconnectingStreamClient client;
    private final Supplier<String> urlFactory;
    private final Function<StreamMessage, T> decoder;

    /**
     * Creates a new stream push source.
     *
     * @param client     the stream client
     * @param urlFactory computes the stream URL on every (re)connect
     * @param decoder    decodes a message, may record the message cursor for the next URL
     */
    public StreamPushSource(ReconnectingStreamClient client, Supplier<String> urlFactory,
                            Function<StreamMessage, T> decoder) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
        this.urlFactory = Objects.requireNonNull(urlFactory, "urlFactory cannot be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
    }

    @Override
    public Registration open(PushListener<T> listener) {
        return client.open(urlFactory, new StreamHandlers() {
            @Override
            public void onMessage(StreamMessage message) {
                listener.onPush(decoder.apply(message));
            }

            @Override
            public void onUnexpectedError(Throwable error) {
                listener.onError(error);
            }
        });
    }
}
