package io.github.ledgersync.sync;

/**
 * Priority classes of governed fetches. Constants declared later are
 * serviced first: small probe reads that gate polling decisions must not
 * starve behind large baseline reads.
 */
public enum FetchPriority {
    /** full resource baseline reads, e.g. the account record */
    BASELINE,
    /** collection reads: transactions, offers, order books */
    LIST,
    /** single most-recent-item lookups, e.g. the latest effect */
    PROBE;

    /**
     * Checks whether this priority is serviced before another.
     *
     * @param other the other priority
     * @return true if strictly higher
     */
    public boolean isHigherThan(FetchPriority other) {
        return ordinal() > other.ordinal();
    }
}
