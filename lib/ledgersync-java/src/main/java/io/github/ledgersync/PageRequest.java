package io.github.ledgersync;

import io.github.ledgersync.errors.LedgerException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pagination parameters of a collection read. Unset parameters are left to the server.
 */
public final class PageRequest {

    /**
     * Sort order of a collection page.
     */
    public enum Order {
        ASC("asc"),
        DESC("desc");

        private final String value;

        Order(String value) {
            this.value = value;
        }

        /**
         * Returns the query parameter value.
         *
         * @return asc or desc
         */
        public String getValue() {
            return value;
        }
    }

    private static final PageRequest DEFAULT = new PageRequest(null, null, null, false);

    private final String cursor;
    private final Integer limit;
    private final Order order;
    private final boolean emptyOn404;

    private PageRequest(String cursor, Integer limit, Order order, boolean emptyOn404) {
        this.cursor = cursor;
        this.limit = limit;
        this.order = order;
        this.emptyOn404 = emptyOn404;
    }

    /**
     * Returns a request without any parameters.
     *
     * @return the default request
     */
    public static PageRequest defaults() {
        return DEFAULT;
    }

    /**
     * Returns a copy starting after the given cursor.
     *
     * @param cursor the paging token, null to start at the beginning
     * @return the new request
     */
    public PageRequest cursor(String cursor) {
        return new PageRequest(cursor, limit, order, emptyOn404);
    }

    /**
     * Returns a copy with the given page size.
     *
     * @param limit records per page, 1 to 200
     * @return the new request
     * @throws LedgerException if limit is out of range
     */
    public PageRequest limit(int limit) {
        if (limit < 1 || limit > 200) {
            throw new LedgerException("limit must be between 1 and 200, got: " + limit);
        }
        return new PageRequest(cursor, limit, order, emptyOn404);
    }

    /**
     * Returns a copy with the given sort order.
     *
     * @param order the order
     * @return the new request
     */
    public PageRequest order(Order order) {
        return new PageRequest(cursor, limit, order, emptyOn404);
    }

    /**
     * Returns a copy that treats a missing account as an empty page instead of failing.
     *
     * @return the new request
     */
    public PageRequest emptyOn404() {
        return new PageRequest(cursor, limit, order, true);
    }

    public String getCursor() {
        return cursor;
    }

    public Integer getLimit() {
        return limit;
    }

    public Order getOrder() {
        return order;
    }

    public boolean isEmptyOn404() {
        return emptyOn404;
    }

    /**
     * Returns the set parameters as query parameters.
     *
     * @return cursor, limit and order, in that order
     */
    public Map<String, String> toQuery() {
        Map<String, String> query = new LinkedHashMap<>();
        if (cursor != null) {
            query.put("cursor", cursor);
        }
        if (limit != null) {
            query.put("limit", String.valueOf(limit));
        }
        if (order != null) {
            query.put("order", order.getValue());
        }
        return query;
    }

    @Override
    public String toString() {
        return "PageRequest" + toQuery() + (emptyOn404 ? "+emptyOn404" : "");
    }
}
