package io.github.ledgersync.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Pagination envelope: {@code {_embedded: {records}, _links: {self, next, prev}}}.
 *
 * @param <T> the record type
 */
public final class CollectionPage<T> {

    @SerializedName("_embedded")
    private final Embedded<T> embedded;

    @SerializedName("_links")
    private final Links links;

    private CollectionPage(Embedded<T> embedded, Links links) {
        this.embedded = embedded;
        this.links = links;
    }

    /**
     * Creates a page without records whose links all point at the given URL.
     *
     * @param url the request URL
     * @param <T> the record type
     * @return the empty page
     */
    public static <T> CollectionPage<T> empty(String url) {
        Link self = new Link(url);
        return new CollectionPage<>(new Embedded<>(List.of()), new Links(self, self, self));
    }

    /**
     * Returns the records of this page.
     *
     * @return the records, never null
     */
    public List<T> getRecords() {
        return embedded == null || embedded.records == null ? List.of() : embedded.records;
    }

    /**
     * Returns the link to this page, or null if absent.
     *
     * @return the self href
     */
    public String getSelfHref() {
        return links == null || links.self == null ? null : links.self.href;
    }

    /**
     * Returns the link to the next page, or null if absent.
     *
     * @return the next href
     */
    public String getNextHref() {
        return links == null || links.next == null ? null : links.next.href;
    }

    /**
     * Returns the link to the previous page, or null if absent.
     *
     * @return the prev href
     */
    public String getPrevHref() {
        return links == null || links.prev == null ? null : links.prev.href;
    }

    private static final class Embedded<T> {
        private final List<T> records;

        private Embedded(List<T> records) {
            this.records = records;
        }
    }

    private static final class Links {
        private final Link self;
        private final Link next;
        private final Link prev;

        private Links(Link self, Link next, Link prev) {
            this.self = self;
            this.next = next;
            this.prev = prev;
        }
    }

    private static final class Link {
        private final String href;

        private Link(String href) {
            this.href = href;
        }
    }
}
