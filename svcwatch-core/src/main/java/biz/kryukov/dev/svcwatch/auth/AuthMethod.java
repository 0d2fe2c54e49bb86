package biz.kryukov.dev.svcwatch.auth;

/**
 * How credentials are presented to a target.
 */
public enum AuthMethod {

    /** {@code X-API-Key} header, no login exchange. */
    API_KEY("api_key"),
    /** Login POST with a JSON body. */
    JSON("json"),
    /** Login POST with a form-encoded body. */
    FORM("form"),
    /** Login POST with HTTP Basic credentials. */
    BASIC("basic");

    private final String label;

    AuthMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
