package biz.kryukov.dev.svcwatch;

/**
 * The remote side answered with a terminal non-2xx status.
 */
public class HttpStatusException extends CallException {

    private final int statusCode;
    private final String body;

    public HttpStatusException(int statusCode, String body) {
        super("HTTP error " + statusCode + ": " + body, FailureKind.HTTP_STATUS_FAILURE);
        this.statusCode = statusCode;
        this.body = body;
    }

    /** Returns the HTTP status code. */
    public int statusCode() {
        return statusCode;
    }

    /** Returns the (truncated) response body. */
    public String body() {
        return body;
    }
}
