package io.github.ledgersync.model;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Transaction record from {@code GET /accounts/{id}/transactions}.
 */
public final class TransactionRecord {

    private final String id;
    private final String hash;
    private final long ledger;
    private final boolean successful;

    @SerializedName("paging_token")
    private final String pagingToken;

    @SerializedName("created_at")
    private final String createdAt;

    @SerializedName("source_account")
    private final String sourceAccount;

    @SerializedName("fee_charged")
    private final String feeCharged;

    @SerializedName("operation_count")
    private final int operationCount;

    @SerializedName("memo_type")
    private final String memoType;

    private final String memo;

    /**
     * Creates a new transaction record.
     *
     * @param id             the transaction id
     * @param pagingToken    the paging token
     * @param hash           the transaction hash
     * @param ledger         the ledger sequence the transaction was included in
     * @param createdAt      ISO-8601 timestamp of the ledger close
     * @param sourceAccount  the source account
     * @param successful     whether the transaction succeeded
     * @param feeCharged     fee charged in stroops
     * @param operationCount number of operations
     * @param memoType       the memo type
     * @param memo           the memo, may be null
     */
    public TransactionRecord(String id, String pagingToken, String hash, long ledger, String createdAt,
                             String sourceAccount, boolean successful, String feeCharged, int operationCount,
                             String memoType, String memo) {
        this.id = id;
        this.pagingToken = pagingToken;
        this.hash = hash;
        this.ledger = ledger;
        this.createdAt = createdAt;
        this.sourceAccount = sourceAccount;
        this.successful = successful;
        this.feeCharged = feeCharged;
        this.operationCount = operationCount;
        this.memoType = memoType;
        this.memo = memo;
    }

    public String getId() {
        return id;
    }

    public String getPagingToken() {
        return pagingToken;
    }

    public String getHash() {
        return hash;
    }

    public long getLedger() {
        return ledger;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public String getSourceAccount() {
        return sourceAccount;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFeeCharged() {
        return feeCharged;
    }

    public int getOperationCount() {
        return operationCount;
    }

    public String getMemoType() {
        return memoType;
    }

    public String getMemo() {
        return memo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransactionRecord that = (TransactionRecord) o;
        return ledger == that.ledger &&
                successful == that.successful &&
                operationCount == that.operationCount &&
                Objects.equals(id, that.id) &&
                Objects.equals(pagingToken, that.pagingToken) &&
                Objects.equals(hash, that.hash) &&
                Objects.equals(createdAt, that.createdAt) &&
                Objects.equals(sourceAccount, that.sourceAccount) &&
                Objects.equals(feeCharged, that.feeCharged) &&
                Objects.equals(memoType, that.memoType) &&
                Objects.equals(memo, that.memo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, pagingToken, hash, ledger, createdAt, sourceAccount, successful, feeCharged,
                operationCount, memoType, memo);
    }

    @Override
    public String toString() {
        return "TransactionRecord{" +
                "id='" + id + '\'' +
                ", pagingToken='" + pagingToken + '\'' +
                ", createdAt='" + createdAt + '\'' +
                '}';
    }
}
