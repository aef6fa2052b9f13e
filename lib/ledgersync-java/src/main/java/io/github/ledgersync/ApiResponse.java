package io.github.ledgersync;

/**
 * Raw response of a ledger API read: status, body and the requested URL.
 */
public final class ApiResponse {

    /** HTTP 200 OK status code */
    public static final int HTTP_OK = 200;

    /** HTTP 404 Not Found status code */
    public static final int HTTP_NOT_FOUND = 404;

    private final int status;
    private final String body;
    private final String url;

    /**
     * Creates a new response.
     *
     * @param status the HTTP status code
     * @param body   the response body, may be empty
     * @param url    the requested URL
     */
    public ApiResponse(int status, String body, String url) {
        this.status = status;
        this.body = body;
        this.url = url;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public String getUrl() {
        return url;
    }

    /**
     * Checks for a 2xx status.
     *
     * @return true if successful
     */
    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    /**
     * Checks for a 404 status.
     *
     * @return true if not found
     */
    public boolean isNotFound() {
        return status == HTTP_NOT_FOUND;
    }

    @Override
    public String toString() {
        return "ApiResponse{" +
                "status=" + status +
                ", url='" + url + '\'' +
                '}';
    }
}
