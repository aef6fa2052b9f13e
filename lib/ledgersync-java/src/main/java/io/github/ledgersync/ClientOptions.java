package io.github.ledgersync;

import io.github.ledgersync.errors.LedgerException;
import io.github.ledgersync.sync.BackoffPolicy;
import io.github.ledgersync.sync.FetchGovernor;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration options for the ledger client.
 * Use {@link #builder()} to create instances.
 */
public final class ClientOptions {

    /** default client name sent with every request */
    public static final String DEFAULT_CLIENT_NAME = "ledgersync";

    /** default client version sent with every request */
    public static final String DEFAULT_CLIENT_VERSION = "1.0.0";

    /** default timeout for HTTP requests */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** default idle time after which a subscription re-fetches its resource */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

    private final String clientName;
    private final String clientVersion;
    private final Duration timeout;
    private final int maxConcurrentFetches;
    private final Duration pollInterval;
    private final BackoffPolicy existenceBackoff;
    private final BackoffPolicy reconnectBackoff;

    private ClientOptions(Builder builder) {
        this.clientName = builder.clientName;
        this.clientVersion = builder.clientVersion;
        this.timeout = builder.timeout;
        this.maxConcurrentFetches = builder.maxConcurrentFetches;
        this.pollInterval = builder.pollInterval;
        this.existenceBackoff = builder.existenceBackoff;
        this.reconnectBackoff = builder.reconnectBackoff;
    }

    /**
     * Creates a new builder for ClientOptions.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the client name sent as {@code X-Client-Name}.
     *
     * @return the client name
     */
    public String getClientName() {
        return clientName;
    }

    /**
     * Returns the client version sent as {@code X-Client-Version}.
     *
     * @return the client version
     */
    public String getClientVersion() {
        return clientVersion;
    }

    /**
     * Returns the request timeout.
     *
     * @return the timeout
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Returns the maximum number of reads in flight.
     *
     * @return the fetch concurrency
     */
    public int getMaxConcurrentFetches() {
        return maxConcurrentFetches;
    }

    /**
     * Returns the idle time after which subscriptions poll.
     *
     * @return the poll interval
     */
    public Duration getPollInterval() {
        return pollInterval;
    }

    /**
     * Returns the schedule used while waiting for an account to exist.
     *
     * @return the existence backoff
     */
    public BackoffPolicy getExistenceBackoff() {
        return existenceBackoff;
    }

    /**
     * Returns the schedule used between push stream reconnects.
     *
     * @return the reconnect backoff
     */
    public BackoffPolicy getReconnectBackoff() {
        return reconnectBackoff;
    }

    /**
     * Builder for ClientOptions.
     */
    public static final class Builder {
        private String clientName = DEFAULT_CLIENT_NAME;
        private String clientVersion = DEFAULT_CLIENT_VERSION;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int maxConcurrentFetches = FetchGovernor.DEFAULT_CONCURRENCY;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private BackoffPolicy existenceBackoff = BackoffPolicy.existenceDefault();
        private BackoffPolicy reconnectBackoff = BackoffPolicy.reconnectDefault();

        private Builder() {
        }

        /**
         * Sets the client identification sent with every request.
         *
         * @param name    the client name
         * @param version the client version
         * @return this builder
         * @throws LedgerException if name or version is empty
         */
        public Builder clientIdentification(String name, String version) {
            if (name == null || name.isEmpty()) {
                throw new LedgerException("client name cannot be empty");
            }
            if (version == null || version.isEmpty()) {
                throw new LedgerException("client version cannot be empty");
            }
            this.clientName = name;
            this.clientVersion = version;
            return this;
        }

        /**
         * Sets the request timeout.
         *
         * @param timeout the timeout duration
         * @return this builder
         * @throws LedgerException if timeout is not positive
         */
        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout cannot be null");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new LedgerException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets the maximum number of reads in flight.
         *
         * @param maxConcurrentFetches at least 1
         * @return this builder
         * @throws LedgerException if less than 1
         */
        public Builder maxConcurrentFetches(int maxConcurrentFetches) {
            if (maxConcurrentFetches < 1) {
                throw new LedgerException("maxConcurrentFetches must be at least 1");
            }
            this.maxConcurrentFetches = maxConcurrentFetches;
            return this;
        }

        /**
         * Sets the idle time after which subscriptions re-fetch their resource.
         *
         * @param pollInterval the poll interval
         * @return this builder
         * @throws LedgerException if pollInterval is not positive
         */
        public Builder pollInterval(Duration pollInterval) {
            Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new LedgerException("pollInterval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * Sets the schedule used while waiting for an account to exist.
         *
         * @param existenceBackoff the backoff policy
         * @return this builder
         */
        public Builder existenceBackoff(BackoffPolicy existenceBackoff) {
            this.existenceBackoff = Objects.requireNonNull(existenceBackoff, "existenceBackoff cannot be null");
            return this;
        }

        /**
         * Sets the schedule used between push stream reconnects.
         *
         * @param reconnectBackoff the backoff policy
         * @return this builder
         */
        public Builder reconnectBackoff(BackoffPolicy reconnectBackoff) {
            this.reconnectBackoff = Objects.requireNonNull(reconnectBackoff, "reconnectBackoff cannot be null");
            return this;
        }

        /**
         * Builds the ClientOptions instance.
         *
         * @return the configured options
         */
        public ClientOptions build() {
            return new ClientOptions(this);
        }
    }
}
