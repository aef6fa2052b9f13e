package io.github.ledgersync.model;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Activity record describing one atomic change to an account.
 */
public final class EffectRecord {

    /** effect type emitted when an account is merged away */
    public static final String TYPE_ACCOUNT_REMOVED = "account_removed";

    private final String id;

    @SerializedName("paging_token")
    private final String pagingToken;

    private final String account;
    private final String type;

    @SerializedName("created_at")
    private final String createdAt;

    /**
     * Creates a new effect record.
     *
     * @param id          the effect id
     * @param pagingToken the paging token
     * @param account     the affected account
     * @param type        the effect type, e.g. account_credited
     * @param createdAt   ISO-8601 timestamp of the ledger close
     */
    public EffectRecord(String id, String pagingToken, String account, String type, String createdAt) {
        this.id = id;
        this.pagingToken = pagingToken;
        this.account = account;
        this.type = type;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getPagingToken() {
        return pagingToken;
    }

    public String getAccount() {
        return account;
    }

    public String getType() {
        return type;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    /**
     * Checks whether this effect removes the given account from the ledger.
     *
     * @param accountId the account id
     * @return true if the account ceased to exist
     */
    public boolean removesAccount(String accountId) {
        return TYPE_ACCOUNT_REMOVED.equals(type) && Objects.equals(account, accountId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EffectRecord that = (EffectRecord) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(pagingToken, that.pagingToken) &&
                Objects.equals(account, that.account) &&
                Objects.equals(type, that.type) &&
                Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, pagingToken, account, type, createdAt);
    }

    @Override
    public String toString() {
        return "EffectRecord{" +
                "id='" + id + '\'' +
                ", pagingToken='" + pagingToken + '\'' +
                ", account='" + account + '\'' +
                ", type='" + type + '\'' +
                ", createdAt='" + createdAt + '\'' +
                '}';
    }
}
