package io.github.ledgersync;

import java.util.Objects;

/**
 * Outcome of waiting for a resource to exist.
 *
 * @param <T> the resource type
 */
public final class ExistenceResult<T> {

    private final T value;
    private final boolean hadToWait;

    /**
     * Creates a new result.
     *
     * @param value     the resource as first found
     * @param hadToWait whether at least one read reported "not found yet"
     */
    public ExistenceResult(T value, boolean hadToWait) {
        this.value = value;
        this.hadToWait = hadToWait;
    }

    public T getValue() {
        return value;
    }

    /**
     * Returns whether the resource was missing on the first read.
     *
     * @return true if the caller had to wait
     */
    public boolean hadToWait() {
        return hadToWait;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExistenceResult<?> that = (ExistenceResult<?>) o;
        return hadToWait == that.hadToWait && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, hadToWait);
    }

    @Override
    public String toString() {
        return "ExistenceResult{" +
                "value=" + value +
                ", hadToWait=" + hadToWait +
                '}';
    }
}
