package io.github.ledgersync.model;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * One balance line of an account.
 */
public final class Balance {

    private final String balance;
    private final String limit;

    @SerializedName("asset_type")
    private final String assetType;

    @SerializedName("asset_code")
    private final String assetCode;

    @SerializedName("asset_issuer")
    private final String assetIssuer;

    @SerializedName("buying_liabilities")
    private final String buyingLiabilities;

    @SerializedName("selling_liabilities")
    private final String sellingLiabilities;

    /**
     * Creates a new balance line.
     *
     * @param balance            the amount held
     * @param limit              the trust line limit, null for the native asset
     * @param assetType          the asset type
     * @param assetCode          the asset code, null for the native asset
     * @param assetIssuer        the asset issuer, null for the native asset
     * @param buyingLiabilities  amount reserved by open buy orders
     * @param sellingLiabilities amount reserved by open sell orders
     */
    public Balance(String balance, String limit, String assetType, String assetCode, String assetIssuer,
                   String buyingLiabilities, String sellingLiabilities) {
        this.balance = balance;
        this.limit = limit;
        this.assetType = assetType;
        this.assetCode = assetCode;
        this.assetIssuer = assetIssuer;
        this.buyingLiabilities = buyingLiabilities;
        this.sellingLiabilities = sellingLiabilities;
    }

    public String getBalance() {
        return balance;
    }

    public String getLimit() {
        return limit;
    }

    public String getAssetType() {
        return assetType;
    }

    public String getAssetCode() {
        return assetCode;
    }

    public String getAssetIssuer() {
        return assetIssuer;
    }

    public String getBuyingLiabilities() {
        return buyingLiabilities;
    }

    public String getSellingLiabilities() {
        return sellingLiabilities;
    }

    /**
     * Returns the asset this balance is held in.
     *
     * @return the asset
     */
    public Asset getAsset() {
        return Asset.TYPE_NATIVE.equals(assetType) ? Asset.nativeAsset() : Asset.issued(assetCode, assetIssuer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Balance that = (Balance) o;
        return Objects.equals(balance, that.balance) &&
                Objects.equals(limit, that.limit) &&
                Objects.equals(assetType, that.assetType) &&
                Objects.equals(assetCode, that.assetCode) &&
                Objects.equals(assetIssuer, that.assetIssuer) &&
                Objects.equals(buyingLiabilities, that.buyingLiabilities) &&
                Objects.equals(sellingLiabilities, that.sellingLiabilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(balance, limit, assetType, assetCode, assetIssuer, buyingLiabilities, sellingLiabilities);
    }

    @Override
    public String toString() {
        return "Balance{" +
                "balance='" + balance + '\'' +
                ", assetType='" + assetType + '\'' +
                ", assetCode='" + assetCode + '\'' +
                ", assetIssuer='" + assetIssuer + '\'' +
                '}';
    }
}
