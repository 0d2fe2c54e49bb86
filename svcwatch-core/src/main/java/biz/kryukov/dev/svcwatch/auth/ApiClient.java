package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.AuthenticationException;
import biz.kryukov.dev.svcwatch.CallConnectionException;
import biz.kryukov.dev.svcwatch.CallException;
import biz.kryukov.dev.svcwatch.CallTimeoutException;
import biz.kryukov.dev.svcwatch.CallTlsException;
import biz.kryukov.dev.svcwatch.Credentials;
import biz.kryukov.dev.svcwatch.HttpStatusException;
import biz.kryukov.dev.svcwatch.ValidationException;
import biz.kryukov.dev.svcwatch.WatchConfig;
import biz.kryukov.dev.svcwatch.http.CallResult;
import biz.kryukov.dev.svcwatch.http.HttpCall;
import biz.kryukov.dev.svcwatch.http.HttpReply;
import biz.kryukov.dev.svcwatch.http.HttpTransport;
import biz.kryukov.dev.svcwatch.http.JdkHttpTransport;
import biz.kryukov.dev.svcwatch.http.Urls;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Authenticated request executor for one target API.
 *
 * <p>Authenticates lazily on the first request. A 401 triggers exactly one
 * re-authentication and one retry. Certificate verification is disabled and redirects
 * are followed.</p>
 *
 * <pre>{@code
 * ApiClient client = ApiClient.builder("https://nas.local")
 *     .credentials(Credentials.ofPassword("admin", secret))
 *     .build();
 * JsonNode info = client.get("/api/v2/app/version").json();
 * }</pre>
 */
public final class ApiClient {

    private static final Logger LOG = LoggerFactory.getLogger(ApiClient.class);

    static final int MAX_ERROR_BODY = 300;

    private final String baseUrl;
    private final Credentials credentials;
    private final String authEndpoint;
    private final HttpTransport transport;
    private final WatchConfig config;
    private final AuthenticationDiscoverer discoverer;
    private final AuthState authState = new AuthState();

    private ApiClient(Builder b) {
        this.baseUrl = b.normalizedBaseUrl;
        this.credentials = b.credentials;
        this.authEndpoint = b.authEndpoint;
        this.transport = b.transport;
        this.config = b.config;
        this.discoverer = b.discoverer != null
                ? b.discoverer : new AuthenticationDiscoverer(b.transport, b.config);
    }

    /** Normalized base URL. */
    public String baseUrl() {
        return baseUrl;
    }

    public Credentials credentials() {
        return credentials;
    }

    /** Login path override, or empty. */
    public String authEndpoint() {
        return authEndpoint;
    }

    /** Current authentication state. */
    public AuthState authState() {
        return authState;
    }

    /**
     * Runs authentication discovery now, replacing any established state.
     *
     * @return true when a method was established
     */
    public boolean authenticate() {
        authState.reset();
        return discoverer.authenticate(this);
    }

    public ApiResponse get(String path) throws CallException {
        return request("GET", path, null, null);
    }

    public ApiResponse get(String path, Map<String, String> query) throws CallException {
        return request("GET", path, null, query);
    }

    public ApiResponse post(String path, Object body) throws CallException {
        return request("POST", path, body, null);
    }

    public ApiResponse put(String path, Object body) throws CallException {
        return request("PUT", path, body, null);
    }

    public ApiResponse delete(String path) throws CallException {
        return request("DELETE", path, null, null);
    }

    /**
     * Executes an authenticated request.
     *
     * @param method HTTP method
     * @param path   path relative to the base URL; a leading slash is added when missing
     * @param body   request body: a String is sent as is, anything else is serialized to JSON; may be null
     * @param query  query parameters; may be null
     * @return the 2xx reply
     * @throws AuthenticationException if no method works or the target keeps answering 401
     * @throws HttpStatusException     on any other non-2xx status
     * @throws CallException           on transport failures
     */
    public ApiResponse request(String method, String path, Object body, Map<String, String> query)
            throws CallException {
        if (!authState.isEstablished() && !discoverer.authenticate(this)) {
            throw new AuthenticationException("no working authentication method for " + baseUrl);
        }
        String url = Urls.withQuery(Urls.join(baseUrl, path), query);
        String payload = encodeBody(body);

        LOG.debug("svcwatch: {} {}", method, url);
        HttpReply reply = send(method, url, payload, body);
        if (reply.statusCode() == 401) {
            LOG.warn("svcwatch: {} {} answered 401, re-authenticating", method, url);
            if (!authenticate()) {
                throw new AuthenticationException("re-authentication failed for " + baseUrl);
            }
            reply = send(method, url, payload, body);
            if (reply.statusCode() == 401) {
                throw new AuthenticationException(
                        "still unauthorized after re-authentication: " + method + " " + url);
            }
        }
        if (!reply.isSuccessful()) {
            String snippet = truncate(reply.body());
            LOG.error("svcwatch: HTTP error {} for {} {}: {}", reply.statusCode(), method, url, snippet);
            throw new HttpStatusException(reply.statusCode(), snippet);
        }
        return new ApiResponse(reply);
    }

    private HttpReply send(String method, String url, String payload, Object body) throws CallException {
        HttpCall.Builder b = HttpCall.request(method, url)
                .timeout(config.requestTimeout())
                .followRedirects(true)
                .verifyTls(false)
                .headers(authState.requestHeaders());
        if (payload != null) {
            b.body(payload);
            if (!(body instanceof String)) {
                b.header("Content-Type", "application/json");
            }
        }
        CallResult result = transport.execute(b.build());
        if (result.hasReply()) {
            return result.reply();
        }
        String message = result.describeFailure() + " (" + method + " " + url + ")";
        throw switch (result.failure()) {
            case TIMEOUT -> new CallTimeoutException(
                    "request timeout: " + url + " did not respond within "
                            + config.requestTimeout().toSeconds() + "s", result.cause());
            case CONNECTION_FAILURE -> new CallConnectionException(message, result.cause());
            case TLS_FAILURE -> new CallTlsException(message, result.cause());
            default -> new CallException(message, result.cause(), result.failure());
        };
    }

    private static String encodeBody(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof String s) {
            return s;
        }
        try {
            return Json.MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ValidationException("request body is not serializable: " + e.getOriginalMessage());
        }
    }

    static String truncate(String body) {
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY);
    }

    /**
     * Creates a builder.
     *
     * @param baseUrl target API base URL; a missing scheme defaults to https
     */
    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /** Builder for {@link ApiClient}. */
    public static final class Builder {
        private final String baseUrl;
        private String normalizedBaseUrl;
        private Credentials credentials = Credentials.NONE;
        private String authEndpoint = "";
        private HttpTransport transport;
        private WatchConfig config;
        private AuthenticationDiscoverer discoverer;

        private Builder(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Builder credentials(Credentials credentials) {
            this.credentials = Objects.requireNonNull(credentials, "credentials");
            return this;
        }

        /** Sets the login path override; null or blank means auto-discovery. */
        public Builder authEndpoint(String authEndpoint) {
            this.authEndpoint = authEndpoint == null ? "" : authEndpoint;
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder config(WatchConfig config) {
            this.config = config;
            return this;
        }

        public Builder discoverer(AuthenticationDiscoverer discoverer) {
            this.discoverer = discoverer;
            return this;
        }

        /**
         * Builds the client.
         *
         * @throws ValidationException if the base URL is blank
         */
        public ApiClient build() {
            if (baseUrl != null && !baseUrl.isBlank() && !Urls.hasScheme(baseUrl.trim())) {
                LOG.warn("svcwatch: url {} has no scheme, assuming https", baseUrl);
            }
            normalizedBaseUrl = Urls.normalizeBaseUrl(baseUrl);
            if (transport == null) {
                transport = new JdkHttpTransport();
            }
            if (config == null) {
                config = WatchConfig.defaults();
            }
            return new ApiClient(this);
        }
    }
}
