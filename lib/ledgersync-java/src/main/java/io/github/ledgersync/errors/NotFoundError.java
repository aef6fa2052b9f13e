package io.github.ledgersync.errors;

/**
 * Thrown when a requested resource does not exist (HTTP 404).
 */
public class NotFoundError extends LedgerException {

    private final String url;

    /**
     * Creates a new NotFoundError.
     *
     * @param url the URL that was not found
     */
    public NotFoundError(String url) {
        super("resource not found: " + url);
        this.url = url;
    }

    /**
     * Returns the URL that was not found.
     *
     * @return the url
     */
    public String getUrl() {
        return url;
    }
}
