package io.github.ledgersync;

/**
 * Lifecycle of a subscription: {@code INIT -> LIVE -> (TERMINAL | FAILED)}.
 */
public enum SubscriptionState {
    /** fetching the baseline value */
    INIT,
    /** baseline delivered, push and poll updates flowing */
    LIVE,
    /** the resource ended its own lifetime; no further updates */
    TERMINAL,
    /** baseline fetch or push stream failed; a new subscribe call starts over */
    FAILED
}
