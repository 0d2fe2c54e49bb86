package biz.kryukov.dev.svcwatch.liveness;

import biz.kryukov.dev.svcwatch.LivenessStatus;

/**
 * Maps an HTTP status code to a liveness verdict.
 *
 * <p>Any 2xx or 3xx is up. 401, 403 and 405 are also up: the service answered and
 * merely refused the anonymous GET. Everything else is down.</p>
 */
public final class LivenessClassifier {

    private LivenessClassifier() {}

    /**
     * Classifies a status code.
     *
     * @param statusCode HTTP status code
     * @return {@link LivenessStatus#UP} or {@link LivenessStatus#DOWN}
     */
    public static LivenessStatus classify(int statusCode) {
        if (statusCode >= 200 && statusCode < 400) {
            return LivenessStatus.UP;
        }
        return switch (statusCode) {
            case 401, 403, 405 -> LivenessStatus.UP;
            default -> LivenessStatus.DOWN;
        };
    }
}
