package io.github.ledgersync;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.github.ledgersync.errors.ConnectionError;
import io.github.ledgersync.errors.LedgerException;
import io.github.ledgersync.errors.NotFoundError;
import io.github.ledgersync.errors.RequestFailedError;
import io.github.ledgersync.model.AccountRecord;
import io.github.ledgersync.model.Asset;
import io.github.ledgersync.model.CollectionPage;
import io.github.ledgersync.model.EffectRecord;
import io.github.ledgersync.model.OfferRecord;
import io.github.ledgersync.model.OrderbookRecord;
import io.github.ledgersync.model.TransactionRecord;
import io.github.ledgersync.sync.Delayer;
import io.github.ledgersync.sync.ExistencePoller;
import io.github.ledgersync.sync.FetchGovernor;
import io.github.ledgersync.sync.FetchPriority;

import java.lang.reflect.Type;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Governed read access to the ledger API.
 * <p>
 * Every read is admitted through the shared {@link FetchGovernor} with the
 * priority of its call class and carries the client identification as
 * query parameters. Non-2xx answers fail the returned future with
 * {@link NotFoundError} or {@link RequestFailedError}, transport failures
 * with {@link ConnectionError}; reads documented to tolerate a missing
 * resource complete with null instead.
 */
public final class LedgerApi {

    private static final String PARAM_CLIENT_NAME = "X-Client-Name";
    private static final String PARAM_CLIENT_VERSION = "X-Client-Version";

    /** number of price levels requested per order book side */
    static final int ORDERBOOK_LIMIT = 100;

    private static final Type EFFECT_PAGE = TypeToken.getParameterized(CollectionPage.class, EffectRecord.class).getType();
    private static final Type TRANSACTION_PAGE =
            TypeToken.getParameterized(CollectionPage.class, TransactionRecord.class).getType();
    private static final Type OFFER_PAGE = TypeToken.getParameterized(CollectionPage.class, OfferRecord.class).getType();

    private final String baseUrl;
    private final ClientOptions options;
    private final HttpClient httpClient;
    private final FetchGovernor governor;
    private final Gson gson;
    private final ExistencePoller<AccountRecord> accountPoller;

    /**
     * Creates a new API accessor.
     *
     * @param baseUrl    the API base URL
     * @param options    the client options
     * @param httpClient the HTTP client
     * @param governor   admits every read
     * @param delayer    timer for existence waits
     */
    public LedgerApi(String baseUrl, ClientOptions options, HttpClient httpClient, FetchGovernor governor,
                     Delayer delayer) {
        Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.governor = Objects.requireNonNull(governor, "governor cannot be null");
        this.gson = createGson();
        this.accountPoller = new ExistencePoller<>(
                accountId -> get(accountPath(accountId), Map.of(), FetchPriority.BASELINE),
                response -> decode(response, AccountRecord.class),
                options.getExistenceBackoff(),
                delayer);
    }

    /**
     * Reads an account.
     *
     * @param accountId the account id
     * @return future with the account, or null if it does not exist
     */
    public CompletableFuture<AccountRecord> fetchAccount(String accountId) {
        validateAccountId(accountId);
        return get(accountPath(accountId), Map.of(), FetchPriority.BASELINE)
                .thenApply(response -> response.isNotFound() ? null : decode(response, AccountRecord.class));
    }

    /**
     * Reads the most recent effect of an account.
     *
     * @param accountId the account id
     * @return future with the effect, or null if the account has none or does not exist
     */
    public CompletableFuture<EffectRecord> fetchLatestAccountEffect(String accountId) {
        validateAccountId(accountId);
        Map<String, String> query = PageRequest.defaults().limit(1).order(PageRequest.Order.DESC).toQuery();
        return get(accountPath(accountId) + "/effects", query, FetchPriority.PROBE)
                .thenApply(response -> {
                    if (response.isNotFound()) {
                        return null;
                    }
                    CollectionPage<EffectRecord> page = decode(response, EFFECT_PAGE);
                    List<EffectRecord> records = page.getRecords();
                    return records.isEmpty() ? null : records.get(0);
                });
    }

    /**
     * Reads a page of an account's transactions.
     *
     * @param accountId the account id
     * @param page      pagination, {@link PageRequest#emptyOn404()} turns a missing account into an empty page
     * @return future with the page
     */
    public CompletableFuture<CollectionPage<TransactionRecord>> fetchAccountTransactions(String accountId,
                                                                                        PageRequest page) {
        validateAccountId(accountId);
        String path = accountPath(accountId) + "/transactions";
        return get(path, page.toQuery(), FetchPriority.LIST)
                .thenApply(response -> {
                    if (response.isNotFound() && page.isEmptyOn404()) {
                        return CollectionPage.<TransactionRecord>empty(response.getUrl());
                    }
                    return decode(response, TRANSACTION_PAGE);
                });
    }

    /**
     * Reads a page of an account's open orders.
     *
     * @param accountId the account id
     * @param page      pagination
     * @return future with the page
     */
    public CompletableFuture<CollectionPage<OfferRecord>> fetchAccountOpenOrders(String accountId, PageRequest page) {
        validateAccountId(accountId);
        return get(accountPath(accountId) + "/offers", page.toQuery(), FetchPriority.LIST)
                .thenApply(response -> decode(response, OFFER_PAGE));
    }

    /**
     * Reads the order book of an asset pair. A pair of identical assets
     * yields an empty book without a request.
     *
     * @param selling the asset being sold
     * @param buying  the asset being bought
     * @return future with the order book
     */
    public CompletableFuture<OrderbookRecord> fetchOrderbook(Asset selling, Asset buying) {
        Objects.requireNonNull(selling, "selling cannot be null");
        Objects.requireNonNull(buying, "buying cannot be null");
        if (selling.equals(buying)) {
            return CompletableFuture.completedFuture(OrderbookRecord.empty(buying, buying));
        }
        return get("/order_book", orderbookQuery(selling, buying), FetchPriority.LIST)
                .thenApply(response -> decode(response, OrderbookRecord.class));
    }

    /**
     * Waits until an account exists on the ledger, polling with the
     * configured existence backoff. Concurrent waits for the same account
     * share one poll loop.
     *
     * @param accountId the account id
     * @param cancel    stops the wait, failing it with {@link io.github.ledgersync.errors.CancelledError}
     * @return future with the account and whether it was missing at first
     */
    public CompletableFuture<ExistenceResult<AccountRecord>> awaitAccount(String accountId, CancellationToken cancel) {
        validateAccountId(accountId);
        return accountPoller.awaitExistence(accountId, cancel);
    }

    /**
     * Issues a governed GET. Any HTTP status completes the future normally.
     *
     * @param path     the path below the base URL
     * @param params   query parameters, identification is added
     * @param priority the fetch priority
     * @return future with the raw response
     */
    public CompletableFuture<ApiResponse> get(String path, Map<String, String> params, FetchPriority priority) {
        String url = url(path, params);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(options.getTimeout())
                .header("Accept", "application/json")
                .GET()
                .build();

        return governor.submit(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                        .handle((response, error) -> {
                            if (error != null) {
                                throw new CompletionException(toConnectionError(url, error));
                            }
                            return new ApiResponse(response.statusCode(), response.body(), url);
                        }),
                priority);
    }

    /**
     * Builds an absolute URL with the client identification and the given parameters.
     *
     * @param path   the path below the base URL
     * @param params query parameters
     * @return the URL
     */
    public String url(String path, Map<String, String> params) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put(PARAM_CLIENT_NAME, options.getClientName());
        query.put(PARAM_CLIENT_VERSION, options.getClientVersion());
        query.putAll(params);

        StringBuilder url = new StringBuilder(baseUrl).append(path);
        char separator = '?';
        for (Map.Entry<String, String> param : query.entrySet()) {
            url.append(separator)
                    .append(encode(param.getKey()))
                    .append('=')
                    .append(encode(param.getValue()));
            separator = '&';
        }
        return url.toString();
    }

    /**
     * Returns the query selecting the order book of an asset pair.
     *
     * @param selling the asset being sold
     * @param buying  the asset being bought
     * @return the query parameters
     */
    public Map<String, String> orderbookQuery(Asset selling, Asset buying) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("selling_asset_type", selling.getType());
        if (!selling.isNative()) {
            query.put("selling_asset_code", selling.getCode());
            query.put("selling_asset_issuer", selling.getIssuer());
        }
        query.put("buying_asset_type", buying.getType());
        if (!buying.isNative()) {
            query.put("buying_asset_code", buying.getCode());
            query.put("buying_asset_issuer", buying.getIssuer());
        }
        query.put("limit", String.valueOf(ORDERBOOK_LIMIT));
        return query;
    }

    /**
     * Decodes a successful response.
     *
     * @param response the response
     * @param type     the target type
     * @param <T>      the result type
     * @return the decoded body
     * @throws NotFoundError       on 404
     * @throws RequestFailedError  on any other non-2xx status
     * @throws LedgerException     if the body is malformed
     */
    public <T> T decode(ApiResponse response, Type type) {
        if (response.isNotFound()) {
            throw new NotFoundError(response.getUrl());
        }
        if (!response.isSuccessful()) {
            throw new RequestFailedError(response.getStatus(), response.getUrl());
        }
        try {
            return gson.fromJson(response.getBody(), type);
        } catch (JsonParseException e) {
            throw new LedgerException("malformed response from " + response.getUrl(), e);
        }
    }

    /**
     * Returns the JSON codec, also used for snapshots.
     *
     * @return the gson instance
     */
    public Gson gson() {
        return gson;
    }

    /**
     * Returns the API base URL without trailing slash.
     *
     * @return the base URL
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Returns the account path below the base URL.
     *
     * @param accountId the account id
     * @return the path
     */
    public String accountPath(String accountId) {
        return "/accounts/" + encode(accountId).replace("+", "%20");
    }

    private static ConnectionError toConnectionError(String url, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof HttpTimeoutException) {
            return new ConnectionError("request timeout: " + url, cause);
        }
        if (cause instanceof ConnectException) {
            return new ConnectionError("connection failed: " + url, cause);
        }
        return new ConnectionError("request failed: " + url + ": " + cause.getMessage(), cause);
    }

    private static void validateAccountId(String accountId) {
        if (accountId == null || accountId.isEmpty()) {
            throw new LedgerException("account id cannot be empty");
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static Gson createGson() {
        return new GsonBuilder()
                .disableHtmlEscaping()
                .create();
    }
}
