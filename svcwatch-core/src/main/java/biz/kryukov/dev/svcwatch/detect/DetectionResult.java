package biz.kryukov.dev.svcwatch.detect;

import biz.kryukov.dev.svcwatch.Target;

/**
 * Outcome of a detection request together with the resulting target snapshot.
 *
 * @param outcome what happened
 * @param target  the target after bookkeeping; unchanged for THROTTLED and SKIPPED
 */
public record DetectionResult(Outcome outcome, Target target) {

    /** What a detection request did. */
    public enum Outcome {
        /** A scan found an API endpoint. */
        DETECTED,
        /** Username and password are configured; the API is assumed without probing. */
        MANUAL,
        /** The scan found nothing, or failed. */
        NOT_FOUND,
        /** Not due: the retry window of a failing target is still open. */
        THROTTLED,
        /** Not due: already detected and within the re-verification window. */
        SKIPPED
    }

    /** Whether the target is considered API-capable after this request. */
    public boolean available() {
        return target.apiDetected();
    }
}
