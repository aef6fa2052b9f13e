package io.github.ledgersync.model;

import java.util.Objects;

/**
 * Aggregated amount offered at one price in an order book.
 */
public final class PriceLevel {

    private final String price;
    private final String amount;

    /**
     * Creates a new price level.
     *
     * @param price  the price
     * @param amount the total amount at that price
     */
    public PriceLevel(String price, String amount) {
        this.price = price;
        this.amount = amount;
    }

    public String getPrice() {
        return price;
    }

    public String getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PriceLevel that = (PriceLevel) o;
        return Objects.equals(price, that.price) && Objects.equals(amount, that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(price, amount);
    }

    @Override
    public String toString() {
        return amount + "@" + price;
    }
}
