package io.github.ledgersync.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Objects;

/**
 * Account record as returned by {@code GET /accounts/{id}}.
 */
public final class AccountRecord {

    private final String id;

    @SerializedName("account_id")
    private final String accountId;

    private final String sequence;

    @SerializedName("subentry_count")
    private final int subentryCount;

    @SerializedName("last_modified_ledger")
    private final long lastModifiedLedger;

    @SerializedName("paging_token")
    private final String pagingToken;

    private final List<Balance> balances;

    /**
     * Creates a new account record.
     *
     * @param accountId          the account id
     * @param sequence           the current sequence number
     * @param subentryCount      number of sub-entries (trust lines, offers, data)
     * @param lastModifiedLedger ledger that last changed the account
     * @param pagingToken        the paging token
     * @param balances           balance lines
     */
    public AccountRecord(String accountId, String sequence, int subentryCount, long lastModifiedLedger,
                         String pagingToken, List<Balance> balances) {
        this.id = accountId;
        this.accountId = accountId;
        this.sequence = sequence;
        this.subentryCount = subentryCount;
        this.lastModifiedLedger = lastModifiedLedger;
        this.pagingToken = pagingToken;
        this.balances = balances;
    }

    public String getId() {
        return id;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getSequence() {
        return sequence;
    }

    public int getSubentryCount() {
        return subentryCount;
    }

    /**
     * Returns the ledger that last changed the account. This moves on
     * changes that are irrelevant to balance observers.
     *
     * @return the ledger sequence
     */
    public long getLastModifiedLedger() {
        return lastModifiedLedger;
    }

    public String getPagingToken() {
        return pagingToken;
    }

    public List<Balance> getBalances() {
        return balances == null ? List.of() : balances;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AccountRecord that = (AccountRecord) o;
        return subentryCount == that.subentryCount &&
                lastModifiedLedger == that.lastModifiedLedger &&
                Objects.equals(id, that.id) &&
                Objects.equals(accountId, that.accountId) &&
                Objects.equals(sequence, that.sequence) &&
                Objects.equals(pagingToken, that.pagingToken) &&
                Objects.equals(getBalances(), that.getBalances());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, accountId, sequence, subentryCount, lastModifiedLedger, pagingToken, getBalances());
    }

    @Override
    public String toString() {
        return "AccountRecord{" +
                "accountId='" + accountId + '\'' +
                ", sequence='" + sequence + '\'' +
                ", balances=" + getBalances() +
                '}';
    }
}
