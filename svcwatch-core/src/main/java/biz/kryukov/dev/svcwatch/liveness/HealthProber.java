package biz.kryukov.dev.svcwatch.liveness;

import biz.kryukov.dev.svcwatch.FailureKind;
import biz.kryukov.dev.svcwatch.LivenessStatus;
import biz.kryukov.dev.svcwatch.Target;
import biz.kryukov.dev.svcwatch.WatchConfig;
import biz.kryukov.dev.svcwatch.http.CallResult;
import biz.kryukov.dev.svcwatch.http.HttpCall;
import biz.kryukov.dev.svcwatch.http.HttpTransport;
import biz.kryukov.dev.svcwatch.http.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Liveness prober: a GET against the target URL with two fallbacks.
 *
 * <ol>
 *   <li>TLS failure: one retry with certificate verification disabled.</li>
 *   <li>Connection failure on an https URL: one retry over plain http, verification disabled.
 *       An up answer there rewrites the target URL.</li>
 * </ol>
 *
 * <p>A timeout is final. The prober never throws for network errors.</p>
 */
public final class HealthProber {

    private static final Logger LOG = LoggerFactory.getLogger(HealthProber.class);

    private final HttpTransport transport;
    private final WatchConfig config;

    public HealthProber(HttpTransport transport, WatchConfig config) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Probes the target's current URL.
     *
     * @param target target to probe
     * @return the verdict, never null
     */
    public ProbeResult probe(Target target) {
        try {
            return probeUrl(target);
        } catch (RuntimeException e) {
            LOG.warn("svcwatch: [{}] probe of {} failed unexpectedly: {}",
                    target.name(), target.url(), e.toString());
            return ProbeResult.down(target.url(), FailureKind.ERROR, e.toString());
        }
    }

    private ProbeResult probeUrl(Target target) {
        String url = target.url();
        CallResult result = get(url, true);
        if (result.hasReply()) {
            return fromReply(url, result);
        }

        if (result.failure() == FailureKind.TLS_FAILURE) {
            LOG.warn("svcwatch: [{}] TLS failure on {}, retrying without certificate verification",
                    target.name(), url);
            result = get(url, false);
            if (result.hasReply()) {
                return fromReply(url, result);
            }
        }

        FailureKind kind = result.failure();
        if (kind == FailureKind.CONNECTION_FAILURE && Urls.isSecure(url)) {
            return plaintextFallback(target, url);
        }

        LOG.debug("svcwatch: [{}] probe of {} failed: {}", target.name(), url, result.describeFailure());
        return ProbeResult.down(url, kind, result.describeFailure());
    }

    private ProbeResult plaintextFallback(Target target, String url) {
        String plaintext = Urls.toPlaintext(url);
        LOG.warn("svcwatch: [{}] connection to {} failed, trying {}", target.name(), url, plaintext);
        CallResult result = get(plaintext, false);
        if (!result.hasReply()) {
            return ProbeResult.down(url, result.failure(), result.describeFailure());
        }
        int statusCode = result.reply().statusCode();
        if (LivenessClassifier.classify(statusCode) != LivenessStatus.UP) {
            return ProbeResult.down(url, FailureKind.HTTP_STATUS_FAILURE,
                    "plaintext fallback answered status " + statusCode);
        }
        LOG.info("svcwatch: [{}] reachable over plaintext, url rewritten to {}", target.name(), plaintext);
        return ProbeResult.answered(LivenessStatus.UP, result.elapsed().toMillis(), plaintext, statusCode);
    }

    private ProbeResult fromReply(String url, CallResult result) {
        int statusCode = result.reply().statusCode();
        return ProbeResult.answered(LivenessClassifier.classify(statusCode),
                result.elapsed().toMillis(), url, statusCode);
    }

    private CallResult get(String url, boolean verifyTls) {
        HttpCall call;
        try {
            call = HttpCall.get(url)
                    .header("User-Agent", config.userAgent())
                    .timeout(config.probeTimeout())
                    .followRedirects(true)
                    .verifyTls(verifyTls)
                    .build();
        } catch (IllegalArgumentException e) {
            return CallResult.failed(FailureKind.ERROR, e);
        }
        return transport.execute(call);
    }
}
