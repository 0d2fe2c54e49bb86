package biz.kryukov.dev.svcwatch.http;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One outbound HTTP exchange: method, URI, headers, optional body and transport options. Immutable.
 */
public final class HttpCall {

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final String body;
    private final Duration timeout;
    private final boolean followRedirects;
    private final boolean verifyTls;

    private HttpCall(Builder b) {
        this.method = b.method;
        this.uri = b.uri;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
        this.timeout = b.timeout;
        this.followRedirects = b.followRedirects;
        this.verifyTls = b.verifyTls;
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, String> headers() {
        return headers;
    }

    /** Request body, or null for none. */
    public String body() {
        return body;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean followRedirects() {
        return followRedirects;
    }

    /** Whether server certificates are validated. */
    public boolean verifyTls() {
        return verifyTls;
    }

    /** Creates a GET call builder. */
    public static Builder get(String url) {
        return new Builder("GET", url);
    }

    /** Creates a POST call builder. */
    public static Builder post(String url) {
        return new Builder("POST", url);
    }

    /** Creates a builder for an arbitrary method. */
    public static Builder request(String method, String url) {
        return new Builder(method, url);
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    /** Builder for {@link HttpCall}. */
    public static final class Builder {
        private final String method;
        private final URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private Duration timeout = Duration.ofSeconds(5);
        private boolean followRedirects;
        private boolean verifyTls = true;

        private Builder(String method, String url) {
            this.method = Objects.requireNonNull(method, "method").toUpperCase();
            this.uri = URI.create(Objects.requireNonNull(url, "url"));
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> values) {
            headers.putAll(values);
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder verifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        public HttpCall build() {
            return new HttpCall(this);
        }
    }
}
