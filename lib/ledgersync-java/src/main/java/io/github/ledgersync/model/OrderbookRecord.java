package io.github.ledgersync.model;

import java.util.List;
import java.util.Objects;

/**
 * Order book snapshot for one asset pair.
 */
public final class OrderbookRecord {

    private final List<PriceLevel> bids;
    private final List<PriceLevel> asks;
    private final Asset base;
    private final Asset counter;

    /**
     * Creates a new order book snapshot.
     *
     * @param bids    bids, best first
     * @param asks    asks, best first
     * @param base    the asset being sold
     * @param counter the asset being bought
     */
    public OrderbookRecord(List<PriceLevel> bids, List<PriceLevel> asks, Asset base, Asset counter) {
        this.bids = bids;
        this.asks = asks;
        this.base = base;
        this.counter = counter;
    }

    /**
     * Creates an order book without any bids or asks.
     *
     * @param base    the asset being sold
     * @param counter the asset being bought
     * @return the empty snapshot
     */
    public static OrderbookRecord empty(Asset base, Asset counter) {
        return new OrderbookRecord(List.of(), List.of(), base, counter);
    }

    public List<PriceLevel> getBids() {
        return bids == null ? List.of() : bids;
    }

    public List<PriceLevel> getAsks() {
        return asks == null ? List.of() : asks;
    }

    public Asset getBase() {
        return base;
    }

    public Asset getCounter() {
        return counter;
    }

    /**
     * Checks whether the book has neither bids nor asks.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return getBids().isEmpty() && getAsks().isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderbookRecord that = (OrderbookRecord) o;
        return Objects.equals(getBids(), that.getBids()) &&
                Objects.equals(getAsks(), that.getAsks()) &&
                Objects.equals(base, that.base) &&
                Objects.equals(counter, that.counter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getBids(), getAsks(), base, counter);
    }

    @Override
    public String toString() {
        return "OrderbookRecord{" +
                "base=" + base +
                ", counter=" + counter +
                ", bids=" + getBids() +
                ", asks=" + getAsks() +
                '}';
    }
}
