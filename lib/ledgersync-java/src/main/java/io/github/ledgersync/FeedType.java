package io.github.ledgersync;

/**
 * Kinds of subscribable resources.
 */
public enum FeedType {
    /** account record with balances */
    ACCOUNT,
    /** account activity records; drives the derived account feeds */
    EFFECTS,
    /** transactions involving an account */
    TRANSACTIONS,
    /** open orders placed by an account */
    OPEN_ORDERS,
    /** order book of an asset pair */
    ORDERBOOK
}
