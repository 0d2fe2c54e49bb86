package biz.kryukov.dev.svcwatch;

/**
 * Classification of a failed outbound call.
 */
public enum FailureKind {

    TIMEOUT("timeout"),
    CONNECTION_FAILURE("connection_failure"),
    TLS_FAILURE("tls_failure"),
    HTTP_STATUS_FAILURE("http_status_failure"),
    AUTHENTICATION_FAILURE("authentication_failure"),
    MALFORMED_RESPONSE("malformed_response"),
    ERROR("error");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    /** Returns the lower-case label used in logs and check records. */
    public String label() {
        return label;
    }
}
