package biz.kryukov.dev.svcwatch.liveness;

import biz.kryukov.dev.svcwatch.FailureKind;
import biz.kryukov.dev.svcwatch.LivenessStatus;

import java.util.Objects;

/**
 * Outcome of one liveness probe.
 *
 * @param status             verdict
 * @param responseTimeMillis round trip of the exchange that produced the verdict, or null
 * @param url                URL to persist on the target; differs from the probed one after a
 *                           successful plaintext fallback
 * @param failure            failure classification for a down verdict without a usable reply, or null
 * @param detail             short description of the failure, or empty
 */
public record ProbeResult(
        LivenessStatus status,
        Long responseTimeMillis,
        String url,
        FailureKind failure,
        String detail
) {

    public ProbeResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(url, "url");
        detail = detail == null ? "" : detail;
    }

    /** Verdict from a completed HTTP exchange. */
    public static ProbeResult answered(LivenessStatus status, long responseTimeMillis, String url,
                                       int statusCode) {
        return new ProbeResult(status, responseTimeMillis, url,
                status == LivenessStatus.UP ? null : FailureKind.HTTP_STATUS_FAILURE,
                status == LivenessStatus.UP ? "" : "status " + statusCode);
    }

    /** Down verdict without a response time. */
    public static ProbeResult down(String url, FailureKind failure, String detail) {
        return new ProbeResult(LivenessStatus.DOWN, null, url, failure, detail);
    }

    /** Whether the verdict is up. */
    public boolean isUp() {
        return status == LivenessStatus.UP;
    }
}
