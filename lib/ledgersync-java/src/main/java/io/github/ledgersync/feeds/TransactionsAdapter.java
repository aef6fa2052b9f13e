package io.github.ledgersync.feeds;

import io.github.ledgersync.CancellationToken;
import io.github.ledgersync.LedgerApi;
import io.github.ledgersync.PageRequest;
import io.github.ledgersync.Subscription;
import io.github.ledgersync.model.CollectionPage;
import io.github.ledgersync.model.PagingTokens;
import io.github.ledgersync.model.TransactionRecord;
import io.github.ledgersync.sync.DerivedPushSource;
import io.github.ledgersync.sync.PushSource;
import io.github.ledgersync.sync.UpdateAdapter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Transaction feed of one account, re-fetched whenever the account's
 * effects feed accepts an effect.
 * <p>
 * The baseline is the newest page of transactions once the account exists.
 * Re-fetches read the page following the last accepted cursor, so every
 * emitted value holds only transactions not emitted before, newest first.
 */
public final class TransactionsAdapter implements UpdateAdapter<List<TransactionRecord>> {

    /** transactions per page */
    static final int PAGE_SIZE = 15;

    private static final Comparator<TransactionRecord> NEWEST_FIRST =
            (a, b) -> PagingTokens.compare(b.getPagingToken(), a.getPagingToken());

    private final LedgerApi api;
    private final String accountId;
    private final Subscription<?> effects;
    private final CancellationToken cancel = new CancellationToken();

    // written under the multiplexer lock, read by re-fetches
    private volatile String latestCursor;

    /**
     * Creates the adapter.
     *
     * @param api       the API accessor
     * @param accountId the account id
     * @param effects   the account's effects subscription
     */
    public TransactionsAdapter(LedgerApi api, String accountId, Subscription<?> effects) {
        this.api = Objects.requireNonNull(api, "api cannot be null");
        this.accountId = Objects.requireNonNull(accountId, "accountId cannot be null");
        this.effects = Objects.requireNonNull(effects, "effects cannot be null");
    }

    @Override
    public CompletableFuture<List<TransactionRecord>> init() {
        PageRequest newest = PageRequest.defaults()
                .limit(PAGE_SIZE)
                .order(PageRequest.Order.DESC)
                .emptyOn404();
        return api.awaitAccount(accountId, cancel)
                .thenCompose(ignored -> api.fetchAccountTransactions(accountId, newest))
                .thenApply(page -> {
                    List<TransactionRecord> records = newestFirst(page.getRecords());
                    latestCursor = PagingTokens.newest(records, TransactionRecord::getPagingToken);
                    return records;
                });
    }

    @Override
    public CompletableFuture<List<TransactionRecord>> fetchUpdate(List<TransactionRecord> pushed) {
        PageRequest after = PageRequest.defaults()
                .cursor(latestCursor)
                .limit(PAGE_SIZE)
                .order(PageRequest.Order.ASC)
                .emptyOn404();
        return api.fetchAccountTransactions(accountId, after).thenApply(CollectionPage::getRecords);
    }

    @Override
    public boolean shouldApplyUpdate(List<TransactionRecord> candidate) {
        for (TransactionRecord tx : candidate) {
            if (PagingTokens.isNewer(tx.getPagingToken(), latestCursor)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<TransactionRecord> applyUpdate(List<TransactionRecord> candidate) {
        String previous = latestCursor;
        List<TransactionRecord> unseen = new ArrayList<>();
        for (TransactionRecord tx : candidate) {
            if (PagingTokens.isNewer(tx.getPagingToken(), previous)) {
                unseen.add(tx);
            }
        }
        List<TransactionRecord> sorted = newestFirst(unseen);
        latestCursor = sorted.get(0).getPagingToken();
        return sorted;
    }

    @Override
    public PushSource<List<TransactionRecord>> pushSource() {
        return DerivedPushSource.from(effects);
    }

    @Override
    public void close() {
        cancel.cancel();
    }

    private static List<TransactionRecord> newestFirst(List<TransactionRecord> records) {
        List<TransactionRecord> sorted = new ArrayList<>(records);
        sorted.sort(NEWEST_FIRST);
        return List.copyOf(sorted);
    }
}
