package io.github.ledgersync.sync;

import java.time.Duration;
import java.util.Objects;

/**
 * Growing delay between retries: starts at {@code initial}, is multiplied by
 * {@code multiplier} after every retry and never exceeds {@code max}.
 * <p>
 * This class is immutable. The current interval lives in the loop using it.
 */
public final class BackoffPolicy {

    private final Duration initial;
    private final double multiplier;
    private final Duration max;

    private BackoffPolicy(Duration initial, double multiplier, Duration max) {
        this.initial = initial;
        this.multiplier = multiplier;
        this.max = max;
    }

    /**
     * Creates a backoff policy.
     *
     * @param initial    the first delay, positive
     * @param multiplier growth factor per retry, at least 1
     * @param max        ceiling, not smaller than initial
     * @return the policy
     * @throws IllegalArgumentException if the arguments are out of range
     */
    public static BackoffPolicy of(Duration initial, double multiplier, Duration max) {
        Objects.requireNonNull(initial, "initial cannot be null");
        Objects.requireNonNull(max, "max cannot be null");
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial must be positive");
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be at least 1, got: " + multiplier);
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max must not be smaller than initial");
        }
        return new BackoffPolicy(initial, multiplier, max);
    }

    /**
     * Schedule used while waiting for a resource to exist: 2500 ms growing by 5% up to 8000 ms.
     *
     * @return the policy
     */
    public static BackoffPolicy existenceDefault() {
        return new BackoffPolicy(Duration.ofMillis(2500), 1.05, Duration.ofMillis(8000));
    }

    /**
     * Schedule used between push stream reconnects: 1 s doubling up to 30 s.
     *
     * @return the policy
     */
    public static BackoffPolicy reconnectDefault() {
        return new BackoffPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
    }

    public Duration getInitial() {
        return initial;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMax() {
        return max;
    }

    /**
     * Computes the delay following {@code current}.
     *
     * @param current the delay just waited
     * @return {@code min(current * multiplier, max)}
     */
    public Duration next(Duration current) {
        double grown = current.toNanos() * multiplier;
        if (grown >= max.toNanos()) {
            return max;
        }
        return Duration.ofNanos(Math.round(grown));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BackoffPolicy that = (BackoffPolicy) o;
        return Double.compare(multiplier, that.multiplier) == 0 &&
                initial.equals(that.initial) &&
                max.equals(that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(initial, multiplier, max);
    }

    @Override
    public String toString() {
        return "BackoffPolicy{" +
                "initial=" + initial +
                ", multiplier=" + multiplier +
                ", max=" + max +
                '}';
    }
}
