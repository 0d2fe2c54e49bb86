package biz.kryukov.dev.svcwatch.detect;

import biz.kryukov.dev.svcwatch.WatchConfig;
import biz.kryukov.dev.svcwatch.http.CallResult;
import biz.kryukov.dev.svcwatch.http.HttpCall;
import biz.kryukov.dev.svcwatch.http.HttpReply;
import biz.kryukov.dev.svcwatch.http.HttpTransport;
import biz.kryukov.dev.svcwatch.http.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Probes a fixed, ordered list of well-known API paths and reports the first one that
 * answers like an API.
 *
 * <p>A candidate matches on status 200, 401 or 403 when the content type is JSON, or on any
 * 401. Documentation paths also match HTML. Failing candidates are skipped.</p>
 */
public final class ApiEndpointScanner {

    private static final Logger LOG = LoggerFactory.getLogger(ApiEndpointScanner.class);

    /** Candidate paths in probe order. */
    public static final List<String> CANDIDATES = List.of(
            "/api",
            "/api/v1",
            "/api/v2",
            "/api/v3",
            "/api/v1/system/status",
            "/api/v2/app/version",
            "/api/v2/auth/login",
            "/api/v3/system/status",
            "/api/system/status",
            "/api/version",
            "/api/status",
            "/api/health",
            "/health",
            "/healthz",
            "/System/Info/Public",
            "/identity",
            "/docs",
            "/swagger",
            "/api-docs");

    /** Documentation candidates that may answer with HTML. */
    public static final Set<String> DOC_CANDIDATES = Set.of("/docs", "/swagger", "/api-docs");

    private static final Set<Integer> ACCEPTED_STATUSES = Set.of(200, 401, 403);

    private final HttpTransport transport;
    private final WatchConfig config;

    public ApiEndpointScanner(HttpTransport transport, WatchConfig config) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Scans the base URL.
     *
     * @param baseUrl target base URL
     * @return the first matching candidate, or not found
     */
    public ScanResult scan(String baseUrl) {
        String base = Urls.normalizeBaseUrl(baseUrl);
        for (String path : CANDIDATES) {
            HttpCall call = HttpCall.get(Urls.join(base, path))
                    .timeout(config.scanTimeout())
                    .followRedirects(false)
                    .verifyTls(false)
                    .build();
            CallResult result = transport.execute(call);
            if (!result.hasReply()) {
                LOG.debug("svcwatch: scan {}{} skipped: {}", base, path, result.describeFailure());
                continue;
            }
            HttpReply reply = result.reply();
            if (matches(path, reply)) {
                LOG.debug("svcwatch: scan {}{} matched (status {})", base, path, reply.statusCode());
                return ScanResult.found(path);
            }
            LOG.debug("svcwatch: scan {}{} answered {} {}", base, path,
                    reply.statusCode(), reply.contentType());
        }
        return ScanResult.notFound();
    }

    static boolean matches(String path, HttpReply reply) {
        int status = reply.statusCode();
        if (!ACCEPTED_STATUSES.contains(status)) {
            return false;
        }
        String contentType = reply.contentType();
        if (contentType.contains("application/json") || status == 401) {
            return true;
        }
        return DOC_CANDIDATES.contains(path) && contentType.contains("text/html");
    }
}
