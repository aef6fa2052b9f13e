package io.github.ledgersync.feeds;

import io.github.ledgersync.CancellationToken;
import io.github.ledgersync.ExistenceResult;
import io.github.ledgersync.LedgerApi;
import io.github.ledgersync.Subscription;
import io.github.ledgersync.model.AccountRecord;
import io.github.ledgersync.sync.DerivedPushSource;
import io.github.ledgersync.sync.PushSource;
import io.github.ledgersync.sync.UpdateAdapter;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Account record feed, re-fetched whenever the account's effects feed
 * accepts an effect.
 * <p>
 * The baseline waits until the account exists. A candidate is accepted when
 * its sequence number or balances differ from the last accepted record;
 * changes to other fields alone are not reported.
 */
public final class AccountAdapter implements UpdateAdapter<AccountRecord> {

    private final LedgerApi api;
    private final String accountId;
    private final Subscription<?> effects;
    private final CancellationToken cancel = new CancellationToken();

    // guarded by the multiplexer lock
    private String latestSnapshot;

    /**
     * Creates the adapter.
     *
     * @param api       the API accessor
     * @param accountId the account id
     * @param effects   the account's effects subscription
     */
    public AccountAdapter(LedgerApi api, String accountId, Subscription<?> effects) {
        this.api = Objects.requireNonNull(api, "api cannot be null");
        this.accountId = Objects.requireNonNull(accountId, "accountId cannot be null");
        this.effects = Objects.requireNonNull(effects, "effects cannot be null");
    }

    @Override
    public CompletableFuture<AccountRecord> init() {
        return api.awaitAccount(accountId, cancel)
                .thenApply(ExistenceResult::getValue)
                .thenApply(account -> {
                    latestSnapshot = snapshot(account);
                    return account;
                });
    }

    @Override
    public CompletableFuture<AccountRecord> fetchUpdate(AccountRecord pushed) {
        return api.fetchAccount(accountId);
    }

    @Override
    public boolean shouldApplyUpdate(AccountRecord candidate) {
        return latestSnapshot == null || !snapshot(candidate).equals(latestSnapshot);
    }

    @Override
    public AccountRecord applyUpdate(AccountRecord candidate) {
        latestSnapshot = snapshot(candidate);
        return candidate;
    }

    @Override
    public PushSource<AccountRecord> pushSource() {
        return DerivedPushSource.from(effects);
    }

    @Override
    public void close() {
        cancel.cancel();
    }

    private String snapshot(AccountRecord account) {
        return api.gson().toJson(Arrays.asList(account.getSequence(), account.getBalances()));
    }
}
