package biz.kryukov.dev.svcwatch.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authentication established for one client: method, login endpoint, headers and cookies
 * to send with every request.
 */
public final class AuthState {

    private AuthMethod method;
    private String endpoint;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Map<String, String> cookies = new LinkedHashMap<>();

    /** Whether a working method has been established. */
    public synchronized boolean isEstablished() {
        return method != null;
    }

    /** Established method, or null. */
    public synchronized AuthMethod method() {
        return method;
    }

    /** Login path that worked, or null (API key needs none). */
    public synchronized String endpoint() {
        return endpoint;
    }

    synchronized void establish(AuthMethod method, String endpoint,
                                Map<String, String> headers, Map<String, String> cookies) {
        this.method = method;
        this.endpoint = endpoint;
        this.headers.clear();
        this.headers.putAll(headers);
        this.cookies.putAll(cookies);
    }

    synchronized void addCookies(Map<String, String> values) {
        cookies.putAll(values);
    }

    /** Forgets the established method, headers and cookies. */
    public synchronized void reset() {
        method = null;
        endpoint = null;
        headers.clear();
        cookies.clear();
    }

    /** Headers to attach, including {@code Cookie} when a session exists. */
    public synchronized Map<String, String> requestHeaders() {
        Map<String, String> result = new LinkedHashMap<>(headers);
        if (!cookies.isEmpty()) {
            result.put("Cookie", Cookies.header(cookies));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public synchronized String toString() {
        return "AuthState{method=" + (method == null ? "none" : method.label())
                + ", endpoint=" + endpoint + ", cookies=" + cookies.keySet() + "}";
    }
}
