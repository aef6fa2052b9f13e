package io.github.ledgersync.feeds;

import io.github.ledgersync.CancellationToken;
import io.github.ledgersync.LedgerApi;
import io.github.ledgersync.PageRequest;
import io.github.ledgersync.Subscription;
import io.github.ledgersync.model.CollectionPage;
import io.github.ledgersync.model.OfferRecord;
import io.github.ledgersync.model.PagingTokens;
import io.github.ledgersync.sync.DerivedPushSource;
import io.github.ledgersync.sync.PushSource;
import io.github.ledgersync.sync.UpdateAdapter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Open order feed of one account, re-fetched whenever the account's effects
 * feed accepts an effect. Every value is the full set of open orders.
 * <p>
 * A fetched set is accepted when it became empty or non-empty, or when its
 * newest paging token or its size changed. Amount changes of an existing
 * order alone are not reported.
 */
public final class OpenOrdersAdapter implements UpdateAdapter<List<OfferRecord>> {

    /** upper bound of open orders read at once */
    static final int MAX_ORDERS = 200;

    private static final PageRequest ALL_ORDERS = PageRequest.defaults().limit(MAX_ORDERS);

    private final LedgerApi api;
    private final String accountId;
    private final Subscription<?> effects;
    private final CancellationToken cancel = new CancellationToken();

    // guarded by the multiplexer lock
    private boolean latestEmpty = true;
    private String latestCursor;
    private int latestCount;

    /**
     * Creates the adapter.
     *
     * @param api       the API accessor
     * @param accountId the account id
     * @param effects   the account's effects subscription
     */
    public OpenOrdersAdapter(LedgerApi api, String accountId, Subscription<?> effects) {
        this.api = Objects.requireNonNull(api, "api cannot be null");
        this.accountId = Objects.requireNonNull(accountId, "accountId cannot be null");
        this.effects = Objects.requireNonNull(effects, "effects cannot be null");
    }

    @Override
    public CompletableFuture<List<OfferRecord>> init() {
        return api.awaitAccount(accountId, cancel)
                .thenCompose(ignored -> fetchUpdate(null))
                .thenApply(this::applyUpdate);
    }

    @Override
    public CompletableFuture<List<OfferRecord>> fetchUpdate(List<OfferRecord> pushed) {
        return api.fetchAccountOpenOrders(accountId, ALL_ORDERS).thenApply(CollectionPage::getRecords);
    }

    @Override
    public boolean shouldApplyUpdate(List<OfferRecord> candidate) {
        boolean empty = candidate.isEmpty();
        if (empty != latestEmpty) {
            return true;
        }
        if (empty) {
            return false;
        }
        String newest = PagingTokens.newest(candidate, OfferRecord::getPagingToken);
        return !Objects.equals(newest, latestCursor) || candidate.size() != latestCount;
    }

    @Override
    public List<OfferRecord> applyUpdate(List<OfferRecord> candidate) {
        latestEmpty = candidate.isEmpty();
        latestCursor = PagingTokens.newest(candidate, OfferRecord::getPagingToken);
        latestCount = candidate.size();
        return List.copyOf(candidate);
    }

    @Override
    public PushSource<List<OfferRecord>> pushSource() {
        return DerivedPushSource.from(effects);
    }

    @Override
    public void close() {
        cancel.cancel();
    }
}
