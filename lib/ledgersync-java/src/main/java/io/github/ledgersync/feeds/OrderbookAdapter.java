package io.github.ledgersync.feeds;

import com.google.gson.JsonParseException;
import io.github.ledgersync.LedgerApi;
import io.github.ledgersync.errors.StreamError;
import io.github.ledgersync.model.Asset;
import io.github.ledgersync.model.OrderbookRecord;
import io.github.ledgersync.stream.ReconnectingStreamClient;
import io.github.ledgersync.stream.StreamMessage;
import io.github.ledgersync.sync.PushSource;
import io.github.ledgersync.sync.StreamPushSource;
import io.github.ledgersync.sync.UpdateAdapter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Order book feed of an ordered asset pair, pushed over the order book
 * stream. Pushed books are used as they are; an idle poll re-reads the
 * book. A book is accepted when its serialized form differs from the last
 * accepted one.
 */
public final class OrderbookAdapter implements UpdateAdapter<OrderbookRecord> {

    private final LedgerApi api;
    private final ReconnectingStreamClient streams;
    private final Asset selling;
    private final Asset buying;

    // guarded by the multiplexer lock
    private String latestSnapshot;

    /**
     * Creates the adapter.
     *
     * @param api     the API accessor
     * @param streams the stream client
     * @param selling the asset being sold
     * @param buying  the asset being bought
     */
    public OrderbookAdapter(LedgerApi api, ReconnectingStreamClient streams, Asset selling, Asset buying) {
        this.api = Objects.requireNonNull(api, "api cannot be null");
        this.streams = Objects.requireNonNull(streams, "streams cannot be null");
        this.selling = Objects.requireNonNull(selling, "selling cannot be null");
        this.buying = Objects.requireNonNull(buying, "buying cannot be null");
    }

    @Override
    public CompletableFuture<OrderbookRecord> init() {
        return api.fetchOrderbook(selling, buying)
                .thenApply(record -> {
                    latestSnapshot = snapshot(record);
                    return record;
                });
    }

    @Override
    public CompletableFuture<OrderbookRecord> fetchUpdate(OrderbookRecord pushed) {
        if (pushed != null) {
            return CompletableFuture.completedFuture(pushed);
        }
        return api.fetchOrderbook(selling, buying);
    }

    @Override
    public boolean shouldApplyUpdate(OrderbookRecord candidate) {
        return !snapshot(candidate).equals(latestSnapshot);
    }

    @Override
    public OrderbookRecord applyUpdate(OrderbookRecord candidate) {
        latestSnapshot = snapshot(candidate);
        return candidate;
    }

    @Override
    public PushSource<OrderbookRecord> pushSource() {
        return new StreamPushSource<>(streams, this::streamUrl, this::decode);
    }

    /**
     * Returns the URL every stream connection uses.
     *
     * @return the order book stream URL
     */
    String streamUrl() {
        Map<String, String> query = new LinkedHashMap<>(api.orderbookQuery(selling, buying));
        query.put("cursor", EffectsAdapter.CURSOR_NOW);
        return api.url("/order_book", query);
    }

    private OrderbookRecord decode(StreamMessage message) {
        OrderbookRecord record;
        try {
            record = api.gson().fromJson(message.getData(), OrderbookRecord.class);
        } catch (JsonParseException e) {
            throw new StreamError("malformed order book on stream: " + e.getMessage(), e);
        }
        if (record == null) {
            throw new StreamError("empty order book on stream");
        }
        return record;
    }

    private String snapshot(OrderbookRecord record) {
        return api.gson().toJson(record);
    }
}
