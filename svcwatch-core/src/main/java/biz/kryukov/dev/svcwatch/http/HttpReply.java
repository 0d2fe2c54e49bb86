package biz.kryukov.dev.svcwatch.http;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A completed HTTP exchange: status, headers (case-insensitive) and body text. Immutable.
 */
public final class HttpReply {

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;

    public HttpReply(int statusCode, Map<String, List<String>> headers, String body) {
        this.statusCode = statusCode;
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (k != null) {
                    copy.put(k, List.copyOf(v));
                }
            });
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? "" : body;
    }

    /** Creates a reply with a single Content-Type header. */
    public static HttpReply of(int statusCode, String contentType, String body) {
        return new HttpReply(statusCode,
                contentType == null ? Map.of() : Map.of("Content-Type", List.of(contentType)),
                body);
    }

    public int statusCode() {
        return statusCode;
    }

    /** All header values, keyed case-insensitively. */
    public Map<String, List<String>> headers() {
        return headers;
    }

    /** First value of a header, or an empty string. */
    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? "" : values.get(0);
    }

    /** All values of a header. */
    public List<String> headerValues(String name) {
        return headers.getOrDefault(name, List.of());
    }

    /** Lower-cased Content-Type, or an empty string. */
    public String contentType() {
        return header("Content-Type").toLowerCase();
    }

    /** Body text, never null. */
    public String body() {
        return body;
    }

    /** Whether the status is 2xx. */
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
