package io.github.ledgersync.feeds;

import com.google.gson.JsonParseException;
import io.github.ledgersync.CancellationToken;
import io.github.ledgersync.LedgerApi;
import io.github.ledgersync.errors.StreamError;
import io.github.ledgersync.model.EffectRecord;
import io.github.ledgersync.model.PagingTokens;
import io.github.ledgersync.stream.ReconnectingStreamClient;
import io.github.ledgersync.stream.StreamMessage;
import io.github.ledgersync.sync.PushSource;
import io.github.ledgersync.sync.StreamPushSource;
import io.github.ledgersync.sync.UpdateAdapter;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Activity feed of one account, pushed over the account's effects stream.
 * <p>
 * The baseline is the latest effect; an account without effects is awaited
 * to exist first. A candidate is accepted when it is not older than the last
 * accepted effect and carries a strictly newer paging token. The stream
 * reconnects after the last streamed cursor, which is tracked apart from the
 * accepted cursor. An {@code account_removed} effect for the account ends
 * the feed. The push channel delivers every effect, so there is no idle poll.
 */
public final class EffectsAdapter implements UpdateAdapter<EffectRecord> {

    static final String CURSOR_NOW = "now";

    private final LedgerApi api;
    private final ReconnectingStreamClient streams;
    private final String accountId;
    private final CancellationToken cancel = new CancellationToken();

    private volatile String streamCursor;

    // guarded by the multiplexer lock
    private String latestCursor;
    private String latestCreatedAt;

    /**
     * Creates the adapter.
     *
     * @param api       the API accessor
     * @param streams   the stream client
     * @param accountId the account id
     */
    public EffectsAdapter(LedgerApi api, ReconnectingStreamClient streams, String accountId) {
        this.api = Objects.requireNonNull(api, "api cannot be null");
        this.streams = Objects.requireNonNull(streams, "streams cannot be null");
        this.accountId = Objects.requireNonNull(accountId, "accountId cannot be null");
    }

    @Override
    public CompletableFuture<EffectRecord> init() {
        return api.fetchLatestAccountEffect(accountId)
                .thenCompose(effect -> {
                    if (effect != null) {
                        return CompletableFuture.completedFuture(effect);
                    }
                    return api.awaitAccount(accountId, cancel)
                            .thenCompose(ignored -> api.fetchLatestAccountEffect(accountId));
                })
                .thenApply(effect -> {
                    if (effect != null) {
                        latestCursor = effect.getPagingToken();
                        latestCreatedAt = effect.getCreatedAt();
                        streamCursor = effect.getPagingToken();
                    }
                    return effect;
                });
    }

    @Override
    public CompletableFuture<EffectRecord> fetchUpdate(EffectRecord pushed) {
        if (pushed != null) {
            return CompletableFuture.completedFuture(pushed);
        }
        return api.fetchLatestAccountEffect(accountId);
    }

    @Override
    public boolean shouldApplyUpdate(EffectRecord candidate) {
        if (latestCreatedAt == null) {
            return true;
        }
        return candidate.getCreatedAt() != null
                && candidate.getCreatedAt().compareTo(latestCreatedAt) >= 0
                && PagingTokens.isNewer(candidate.getPagingToken(), latestCursor);
    }

    @Override
    public EffectRecord applyUpdate(EffectRecord candidate) {
        latestCursor = candidate.getPagingToken();
        latestCreatedAt = candidate.getCreatedAt();
        return candidate;
    }

    @Override
    public boolean isTerminal(EffectRecord candidate) {
        return candidate.removesAccount(accountId);
    }

    @Override
    public boolean pollWhenIdle() {
        return false;
    }

    @Override
    public PushSource<EffectRecord> pushSource() {
        return new StreamPushSource<>(streams, this::streamUrl, this::decode);
    }

    @Override
    public void close() {
        cancel.cancel();
    }

    /**
     * Returns the URL the next stream connection uses.
     *
     * @return the effects stream URL
     */
    String streamUrl() {
        String cursor = streamCursor;
        return api.url(api.accountPath(accountId) + "/effects", Map.of("cursor", cursor != null ? cursor : CURSOR_NOW));
    }

    private EffectRecord decode(StreamMessage message) {
        EffectRecord effect;
        try {
            effect = api.gson().fromJson(message.getData(), EffectRecord.class);
        } catch (JsonParseException e) {
            throw new StreamError("malformed effect on stream: " + e.getMessage(), e);
        }
        if (effect == null) {
            throw new StreamError("empty effect on stream");
        }
        if (effect.getPagingToken() != null) {
            streamCursor = effect.getPagingToken();
        }
        return effect;
    }
}
