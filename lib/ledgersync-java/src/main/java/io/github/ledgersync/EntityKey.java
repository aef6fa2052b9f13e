package io.github.ledgersync;

import io.github.ledgersync.model.Asset;

import java.util.List;
import java.util.Objects;

/**
 * Identifies one subscribable resource: the feed type, the API base URL and
 * the resource identity (an account id, or a selling/buying asset pair).
 * Two subscribe calls with equal keys share one subscription.
 */
public final class EntityKey {

    private final FeedType feed;
    private final String baseUrl;
    private final List<String> identity;

    private EntityKey(FeedType feed, String baseUrl, List<String> identity) {
        this.feed = Objects.requireNonNull(feed, "feed cannot be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
        this.identity = List.copyOf(identity);
    }

    /**
     * Creates a key for an account-scoped feed.
     *
     * @param feed      the feed type
     * @param baseUrl   the API base URL
     * @param accountId the account id
     * @return the key
     */
    public static EntityKey forAccount(FeedType feed, String baseUrl, String accountId) {
        Objects.requireNonNull(accountId, "accountId cannot be null");
        return new EntityKey(feed, baseUrl, List.of(accountId));
    }

    /**
     * Creates a key for the order book of an ordered asset pair.
     *
     * @param baseUrl the API base URL
     * @param selling the asset being sold
     * @param buying  the asset being bought
     * @return the key
     */
    public static EntityKey forOrderbook(String baseUrl, Asset selling, Asset buying) {
        return new EntityKey(FeedType.ORDERBOOK, baseUrl, List.of(selling.toString(), buying.toString()));
    }

    public FeedType getFeed() {
        return feed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public List<String> getIdentity() {
        return identity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityKey that = (EntityKey) o;
        return feed == that.feed && baseUrl.equals(that.baseUrl) && identity.equals(that.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feed, baseUrl, identity);
    }

    @Override
    public String toString() {
        return feed.name().toLowerCase() + "@" + baseUrl + ":" + String.join(":", identity);
    }
}
