package io.github.ledgersync;

import io.github.ledgersync.errors.LedgerException;
import io.github.ledgersync.feeds.AccountAdapter;
import io.github.ledgersync.feeds.EffectsAdapter;
import io.github.ledgersync.feeds.OpenOrdersAdapter;
import io.github.ledgersync.feeds.OrderbookAdapter;
import io.github.ledgersync.feeds.TransactionsAdapter;
import io.github.ledgersync.model.AccountRecord;
import io.github.ledgersync.model.Asset;
import io.github.ledgersync.model.EffectRecord;
import io.github.ledgersync.model.OfferRecord;
import io.github.ledgersync.model.OrderbookRecord;
import io.github.ledgersync.model.TransactionRecord;
import io.github.ledgersync.stream.ReconnectingStreamClient;
import io.github.ledgersync.sync.BackoffPolicy;
import io.github.ledgersync.sync.Delayer;
import io.github.ledgersync.sync.FetchGovernor;
import io.github.ledgersync.sync.SubscriptionRegistry;
import io.github.ledgersync.sync.UpdateMultiplexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Client keeping live views of ledger resources.
 * <p>
 * Every {@code subscribeTo...} call returns the one shared subscription of
 * that resource; it emits the current state first and then every change,
 * with consecutive duplicates suppressed. All reads of one client share a
 * bounded, prioritized fetch queue.
 * <p>
 * Use {@link #builder(String)} to create instances.
 * <p>
 * Example usage:
 * <pre>{@code
 * try (LedgerClient client = LedgerClient.builder("https://ledger.example.org")
 *         .clientIdentification("my-wallet", "2.1.0")
 *         .build()) {
 *     try (UpdateStream<AccountRecord> updates = client.subscribeToAccount(accountId).stream()) {
 *         for (AccountRecord account : updates) {
 *             System.out.println(account.getBalances());
 *         }
 *     }
 * }
 * }</pre>
 */
public final class LedgerClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(LedgerClient.class);

    private final ClientOptions options;
    private final HttpClient httpClient;
    private final FetchGovernor governor;
    private final ScheduledExecutorService scheduler;
    private final ReconnectingStreamClient streams;
    private final LedgerApi api;
    private final SubscriptionRegistry registry;

    private LedgerClient(String baseUrl, ClientOptions options, SubscriptionRegistry registry) {
        this.options = options;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(options.getTimeout())
                .build();
        this.governor = new FetchGovernor(options.getMaxConcurrentFetches());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ledgersync-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        this.streams = new ReconnectingStreamClient(httpClient, options.getReconnectBackoff());
        this.api = new LedgerApi(baseUrl, options, httpClient, governor, Delayer.using(scheduler));
        this.registry = registry != null ? registry : new SubscriptionRegistry();
    }

    /**
     * Creates a new builder for the LedgerClient.
     *
     * @param baseUrl the base URL of the ledger API
     * @return a new builder
     */
    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /**
     * Subscribes to the activity of an account. The feed completes when the
     * account is removed from the ledger.
     *
     * @param accountId the account id
     * @return the shared effects subscription
     * @throws LedgerException if accountId is empty
     */
    public Subscription<EffectRecord> subscribeToAccountEffects(String accountId) {
        validateAccountId(accountId);
        EntityKey key = EntityKey.forAccount(FeedType.EFFECTS, api.getBaseUrl(), accountId);
        return registry.getOrCreate(key, () -> new UpdateMultiplexer<>(key,
                new EffectsAdapter(api, streams, accountId), scheduler, options.getPollInterval()));
    }

    /**
     * Subscribes to an account record. The first value arrives once the
     * account exists, which may be long after subscribing.
     *
     * @param accountId the account id
     * @return the shared account subscription
     * @throws LedgerException if accountId is empty
     */
    public Subscription<AccountRecord> subscribeToAccount(String accountId) {
        Subscription<EffectRecord> effects = subscribeToAccountEffects(accountId);
        EntityKey key = EntityKey.forAccount(FeedType.ACCOUNT, api.getBaseUrl(), accountId);
        return registry.getOrCreate(key, () -> new UpdateMultiplexer<>(key,
                new AccountAdapter(api, accountId, effects), scheduler, options.getPollInterval()));
    }

    /**
     * Subscribes to the transactions of an account. The first value holds the
     * most recent transactions, every later one the transactions not seen
     * before, newest first.
     *
     * @param accountId the account id
     * @return the shared transactions subscription
     * @throws LedgerException if accountId is empty
     */
    public Subscription<List<TransactionRecord>> subscribeToAccountTransactions(String accountId) {
        Subscription<EffectRecord> effects = subscribeToAccountEffects(accountId);
        EntityKey key = EntityKey.forAccount(FeedType.TRANSACTIONS, api.getBaseUrl(), accountId);
        return registry.getOrCreate(key, () -> new UpdateMultiplexer<>(key,
                new TransactionsAdapter(api, accountId, effects), scheduler, options.getPollInterval()));
    }

    /**
     * Subscribes to the open orders of an account. Every value is the full set.
     *
     * @param accountId the account id
     * @return the shared open orders subscription
     * @throws LedgerException if accountId is empty
     */
    public Subscription<List<OfferRecord>> subscribeToOpenOrders(String accountId) {
        Subscription<EffectRecord> effects = subscribeToAccountEffects(accountId);
        EntityKey key = EntityKey.forAccount(FeedType.OPEN_ORDERS, api.getBaseUrl(), accountId);
        return registry.getOrCreate(key, () -> new UpdateMultiplexer<>(key,
                new OpenOrdersAdapter(api, accountId, effects), scheduler, options.getPollInterval()));
    }

    /**
     * Subscribes to the order book of an asset pair. A pair of identical
     * assets yields a single empty book and completes without network access.
     *
     * @param selling the asset being sold
     * @param buying  the asset being bought
     * @return the shared order book subscription
     */
    public Subscription<OrderbookRecord> subscribeToOrderbook(Asset selling, Asset buying) {
        if (selling == null || buying == null) {
            throw new LedgerException("assets cannot be null");
        }
        EntityKey key = EntityKey.forOrderbook(api.getBaseUrl(), selling, buying);
        if (selling.equals(buying)) {
            return registry.getOrCreate(key, () -> UpdateMultiplexer.completed(key, OrderbookRecord.empty(buying, buying)));
        }
        return registry.getOrCreate(key, () -> new UpdateMultiplexer<>(key,
                new OrderbookAdapter(api, streams, selling, buying), scheduler, options.getPollInterval()));
    }

    /**
     * Subscribes to the order book of an asset pair given as asset identifiers.
     *
     * @param selling the asset being sold, {@code native} or {@code CODE:ISSUER}
     * @param buying  the asset being bought, {@code native} or {@code CODE:ISSUER}
     * @return the shared order book subscription
     * @throws LedgerException if an identifier is malformed
     */
    public Subscription<OrderbookRecord> subscribeToOrderbook(String selling, String buying) {
        return subscribeToOrderbook(Asset.parse(selling), Asset.parse(buying));
    }

    /**
     * Returns the governed read access of this client.
     *
     * @return the API accessor
     */
    public LedgerApi api() {
        return api;
    }

    /**
     * Returns the registry holding this client's subscriptions.
     *
     * @return the registry
     */
    public SubscriptionRegistry getRegistry() {
        return registry;
    }

    /**
     * Returns the fetch queue shared by all reads of this client.
     *
     * @return the governor
     */
    public FetchGovernor getGovernor() {
        return governor;
    }

    /**
     * Returns the options this client was built with.
     *
     * @return the options
     */
    public ClientOptions getOptions() {
        return options;
    }

    /**
     * Closes every subscription and stops the timers. The registry is closed with the client.
     */
    @Override
    public void close() {
        registry.close();
        scheduler.shutdownNow();
        log.debug("client for {} closed", api.getBaseUrl());
    }

    /**
     * Picks the API server to use: the primary when it answers with a
     * successful status, otherwise the secondary if that one does, otherwise
     * still the primary.
     *
     * @param primary   the preferred server URL
     * @param secondary the fallback server URL
     * @return the URL to use
     */
    public static String selectEndpoint(String primary, String secondary) {
        return selectEndpoint(primary, secondary, ClientOptions.DEFAULT_TIMEOUT);
    }

    /**
     * Picks the API server to use, see {@link #selectEndpoint(String, String)}.
     *
     * @param primary   the preferred server URL
     * @param secondary the fallback server URL
     * @param timeout   timeout of each probe
     * @return the URL to use
     */
    public static String selectEndpoint(String primary, String secondary, Duration timeout) {
        HttpClient probeClient = HttpClient.newBuilder().connectTimeout(timeout).build();
        try {
            if (isReachable(probeClient, primary, timeout)) {
                return primary;
            }
            if (isReachable(probeClient, secondary, timeout)) {
                log.info("{} is not available, failing over to {}", primary, secondary);
                return secondary;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return primary;
    }

    private static boolean isReachable(HttpClient probeClient, String url, Duration timeout)
            throws InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        try {
            int status = probeClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
            return status >= 200 && status < 300;
        } catch (IOException e) {
            log.warn("probing {} failed: {}", url, e.toString());
            return false;
        }
    }

    private static void validateAccountId(String accountId) {
        if (accountId == null || accountId.isEmpty()) {
            throw new LedgerException("account id cannot be empty");
        }
    }

    /**
     * Builder for creating LedgerClient instances.
     */
    public static final class Builder {
        private final String baseUrl;
        private final ClientOptions.Builder optionsBuilder = ClientOptions.builder();
        private SubscriptionRegistry registry;

        private Builder(String baseUrl) {
            if (baseUrl == null || baseUrl.isEmpty()) {
                throw new LedgerException("baseUrl cannot be empty");
            }
            this.baseUrl = baseUrl;
        }

        /**
         * Sets the client identification sent with every request.
         *
         * @param name    the client name
         * @param version the client version
         * @return this builder
         */
        public Builder clientIdentification(String name, String version) {
            optionsBuilder.clientIdentification(name, version);
            return this;
        }

        /**
         * Sets the request timeout.
         *
         * @param timeout the timeout duration
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            optionsBuilder.timeout(timeout);
            return this;
        }

        /**
         * Sets the maximum number of reads in flight.
         *
         * @param maxConcurrentFetches the fetch concurrency
         * @return this builder
         */
        public Builder maxConcurrentFetches(int maxConcurrentFetches) {
            optionsBuilder.maxConcurrentFetches(maxConcurrentFetches);
            return this;
        }

        /**
         * Sets the idle time after which subscriptions re-fetch their resource.
         *
         * @param pollInterval the poll interval
         * @return this builder
         */
        public Builder pollInterval(Duration pollInterval) {
            optionsBuilder.pollInterval(pollInterval);
            return this;
        }

        /**
         * Sets the schedule used while waiting for an account to exist.
         *
         * @param existenceBackoff the backoff policy
         * @return this builder
         */
        public Builder existenceBackoff(BackoffPolicy existenceBackoff) {
            optionsBuilder.existenceBackoff(existenceBackoff);
            return this;
        }

        /**
         * Sets the schedule used between push stream reconnects.
         *
         * @param reconnectBackoff the backoff policy
         * @return this builder
         */
        public Builder reconnectBackoff(BackoffPolicy reconnectBackoff) {
            optionsBuilder.reconnectBackoff(reconnectBackoff);
            return this;
        }

        /**
         * Sets the registry holding the subscriptions, a new one is used by default.
         *
         * @param registry the registry
         * @return this builder
         */
        public Builder registry(SubscriptionRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Builds the LedgerClient instance.
         *
         * @return the configured client
         */
        public LedgerClient build() {
            return new LedgerClient(baseUrl, optionsBuilder.build(), registry);
        }
    }
}
