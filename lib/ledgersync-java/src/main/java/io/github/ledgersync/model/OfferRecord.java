package io.github.ledgersync.model;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Open order (offer) record from {@code GET /accounts/{id}/offers}.
 */
public final class OfferRecord {

    private final String id;
    private final String seller;
    private final Asset selling;
    private final Asset buying;
    private final String amount;
    private final String price;

    @SerializedName("paging_token")
    private final String pagingToken;

    @SerializedName("last_modified_ledger")
    private final long lastModifiedLedger;

    /**
     * Creates a new offer record.
     *
     * @param id                 the offer id
     * @param pagingToken        the paging token
     * @param seller             the account owning the offer
     * @param selling            the asset being sold
     * @param buying             the asset being bought
     * @param amount             amount of the selling asset still on offer
     * @param price              price of one unit of selling in terms of buying
     * @param lastModifiedLedger ledger that last changed the offer
     */
    public OfferRecord(String id, String pagingToken, String seller, Asset selling, Asset buying,
                       String amount, String price, long lastModifiedLedger) {
        this.id = id;
        this.pagingToken = pagingToken;
        this.seller = seller;
        this.selling = selling;
        this.buying = buying;
        this.amount = amount;
        this.price = price;
        this.lastModifiedLedger = lastModifiedLedger;
    }

    public String getId() {
        return id;
    }

    public String getPagingToken() {
        return pagingToken;
    }

    public String getSeller() {
        return seller;
    }

    public Asset getSelling() {
        return selling;
    }

    public Asset getBuying() {
        return buying;
    }

    public String getAmount() {
        return amount;
    }

    public String getPrice() {
        return price;
    }

    public long getLastModifiedLedger() {
        return lastModifiedLedger;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OfferRecord that = (OfferRecord) o;
        return lastModifiedLedger == that.lastModifiedLedger &&
                Objects.equals(id, that.id) &&
                Objects.equals(pagingToken, that.pagingToken) &&
                Objects.equals(seller, that.seller) &&
                Objects.equals(selling, that.selling) &&
                Objects.equals(buying, that.buying) &&
                Objects.equals(amount, that.amount) &&
                Objects.equals(price, that.price);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, pagingToken, seller, selling, buying, amount, price, lastModifiedLedger);
    }

    @Override
    public String toString() {
        return "OfferRecord{" +
                "id='" + id + '\'' +
                ", selling=" + selling +
                ", buying=" + buying +
                ", amount='" + amount + '\'' +
                ", price='" + price + '\'' +
                '}';
    }
}
