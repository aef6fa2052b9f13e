package io.github.ledgersync.errors;

/**
 * Thrown when the ledger API answers with a status that can never turn into
 * a successful read, i.e. anything that is neither 2xx nor an expected 404.
 */
public class RequestFailedError extends LedgerException {

    private final int status;
    private final String url;

    /**
     * Creates a new RequestFailedError.
     *
     * @param status the HTTP status code
     * @param url    the request URL
     */
    public RequestFailedError(int status, String url) {
        super("request to " + url + " failed with status " + status);
        this.status = status;
        this.url = url;
    }

    /**
     * Returns the HTTP status code.
     *
     * @return the status
     */
    public int getStatus() {
        return status;
    }

    /**
     * Returns the request URL.
     *
     * @return the url
     */
    public String getUrl() {
        return url;
    }
}
