package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.Credentials;
import biz.kryukov.dev.svcwatch.WatchConfig;
import biz.kryukov.dev.svcwatch.http.CallResult;
import biz.kryukov.dev.svcwatch.http.HttpCall;
import biz.kryukov.dev.svcwatch.http.HttpReply;
import biz.kryukov.dev.svcwatch.http.HttpTransport;
import biz.kryukov.dev.svcwatch.http.Urls;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finds a working way to authenticate against a target.
 *
 * <p>An API key is used directly. Otherwise each login endpoint is tried with a JSON body,
 * then a form body, then HTTP Basic; the first 200 reply that an extractor accepts wins
 * and is recorded in the client's {@link AuthState}.</p>
 */
public final class AuthenticationDiscoverer {

    private static final Logger LOG = LoggerFactory.getLogger(AuthenticationDiscoverer.class);

    /** Login paths tried when no override is configured. */
    public static final List<String> DEFAULT_ENDPOINTS = List.of(
            "/api/v2/auth/login",
            "/api/auth",
            "/api/login",
            "/auth/login",
            "/login",
            "/api/v1/auth",
            "/api/v1/login",
            "/auth");

    static final String API_KEY_HEADER = "X-API-Key";

    private static final List<AuthMethod> LOGIN_ENCODINGS =
            List.of(AuthMethod.JSON, AuthMethod.FORM, AuthMethod.BASIC);

    private final HttpTransport transport;
    private final WatchConfig config;
    private final List<LoginResponseExtractor> extractors;

    public AuthenticationDiscoverer(HttpTransport transport, WatchConfig config) {
        this(transport, config, defaultExtractors());
    }

    public AuthenticationDiscoverer(HttpTransport transport, WatchConfig config,
                                    List<LoginResponseExtractor> extractors) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.extractors = List.copyOf(extractors);
    }

    /** Plain-text marker, JSON token, session cookies. */
    public static List<LoginResponseExtractor> defaultExtractors() {
        return List.of(new PlainTextMarkerExtractor(), new JsonTokenExtractor(),
                new SessionCookieExtractor());
    }

    /**
     * Authenticates the client, updating its {@link AuthState}.
     *
     * @param client client to authenticate
     * @return true when a method was established
     */
    public boolean authenticate(ApiClient client) {
        Credentials credentials = client.credentials();
        AuthState state = client.authState();

        if (credentials.hasApiKey()) {
            state.establish(AuthMethod.API_KEY, null,
                    Map.of(API_KEY_HEADER, credentials.apiKey()), Map.of());
            LOG.debug("svcwatch: using API key for {}", client.baseUrl());
            return true;
        }
        if (!credentials.hasUsernamePassword()) {
            LOG.error("svcwatch: no credentials configured for {}", client.baseUrl());
            return false;
        }

        for (String endpoint : loginEndpoints(client.authEndpoint())) {
            String url = Urls.join(client.baseUrl(), endpoint);
            LOG.debug("svcwatch: attempting authentication at {}", url);
            for (AuthMethod method : LOGIN_ENCODINGS) {
                if (tryLogin(url, endpoint, method, credentials, state)) {
                    LOG.info("svcwatch: authenticated at {} using {}", url, method.label());
                    return true;
                }
            }
        }
        LOG.error("svcwatch: all authentication attempts failed for {}", client.baseUrl());
        return false;
    }

    static List<String> loginEndpoints(String override) {
        if (override != null && !override.isBlank()) {
            return List.of(Urls.normalizePath(override.trim()));
        }
        return DEFAULT_ENDPOINTS;
    }

    private boolean tryLogin(String url, String endpoint, AuthMethod method,
                             Credentials credentials, AuthState state) {
        HttpCall call = loginCall(url, method, credentials);
        CallResult result = transport.execute(call);
        if (!result.hasReply()) {
            LOG.debug("svcwatch: {} login at {} failed: {}", method.label(), url, result.describeFailure());
            return false;
        }
        HttpReply reply = result.reply();
        Map<String, String> cookies = Cookies.parse(reply.headerValues("Set-Cookie"));
        if (reply.statusCode() != 200) {
            String hint = AuthHints.fromReply(reply).orElse("no hint");
            LOG.debug("svcwatch: {} login at {} answered {} ({})", method.label(), url,
                    reply.statusCode(), hint);
            state.addCookies(cookies);
            return false;
        }

        LoginOutcome outcome = extract(reply);
        if (!outcome.accepted()) {
            LOG.debug("svcwatch: {} login at {} answered 200 without token or session", method.label(), url);
            return false;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        if (outcome.kind() == LoginOutcome.Kind.TOKEN) {
            headers.put("Authorization", "Bearer " + outcome.token());
        } else if (method == AuthMethod.BASIC) {
            headers.put("Authorization", basicHeader(credentials));
        }
        state.establish(method, endpoint, headers, cookies);
        return true;
    }

    private LoginOutcome extract(HttpReply reply) {
        for (LoginResponseExtractor extractor : extractors) {
            LoginOutcome outcome = extractor.extract(reply);
            if (outcome.accepted()) {
                return outcome;
            }
        }
        return LoginOutcome.inconclusive();
    }

    private HttpCall loginCall(String url, AuthMethod method, Credentials credentials) {
        HttpCall.Builder b = HttpCall.post(url)
                .timeout(config.authTimeout())
                .followRedirects(false)
                .verifyTls(false);
        Map<String, String> form = new LinkedHashMap<>();
        form.put("username", credentials.username());
        form.put("password", credentials.password());
        switch (method) {
            case JSON -> b.header("Content-Type", "application/json").body(toJson(form));
            case FORM -> b.header("Content-Type", "application/x-www-form-urlencoded")
                    .body(Urls.formEncode(form));
            case BASIC -> b.header("Authorization", basicHeader(credentials));
            default -> throw new IllegalArgumentException("not a login encoding: " + method);
        }
        return b.build();
    }

    private static String toJson(Map<String, String> values) {
        try {
            return Json.MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode login body", e);
        }
    }

    private static String basicHeader(Credentials credentials) {
        String raw = credentials.username() + ":" + credentials.password();
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
}
