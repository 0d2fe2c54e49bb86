package biz.kryukov.dev.svcwatch.detect;

import biz.kryukov.dev.svcwatch.Target;

import java.time.Duration;
import java.time.Instant;

/**
 * Backoff policy for API detection.
 *
 * <p>Detection runs until it succeeds. After {@value #MAX_ATTEMPTS} consecutive failures
 * further attempts wait for {@link #RETRY_DELAY}. A successful detection is re-verified
 * once it is older than {@link #REVERIFY_AFTER}.</p>
 */
public final class DetectionScheduler {

    /** Consecutive failures after which attempts are throttled. */
    public static final int MAX_ATTEMPTS = 5;
    /** Delay between throttled attempts. */
    public static final Duration RETRY_DELAY = Duration.ofMinutes(5);
    /** Age after which a successful detection is re-verified. */
    public static final Duration REVERIFY_AFTER = Duration.ofDays(7);

    private DetectionScheduler() {}

    /**
     * Decides whether detection should run now.
     *
     * @param target current snapshot
     * @param force  bypass every gate
     * @param now    current time
     * @return true when detection is due
     */
    public static boolean shouldDetect(Target target, boolean force, Instant now) {
        if (force) {
            return true;
        }
        Instant lastDetected = target.apiLastDetected();
        if (lastDetected != null && lastDetected.plus(REVERIFY_AFTER).isBefore(now)) {
            return true;
        }
        if (target.apiDetected()) {
            return false;
        }
        return !isThrottled(target, now);
    }

    /** Whether the target has exhausted its attempts and the retry time is not reached. */
    public static boolean isThrottled(Target target, Instant now) {
        return target.detectionAttempts() >= MAX_ATTEMPTS
                && target.nextCheck() != null
                && now.isBefore(target.nextCheck());
    }

    /** Books a failed or errored attempt. */
    public static Target recordFailure(Target target, Instant now) {
        int attempts = target.detectionAttempts() + 1;
        Target.Builder b = target.toBuilder().detectionAttempts(attempts);
        if (attempts >= MAX_ATTEMPTS) {
            b.nextCheck(now.plus(RETRY_DELAY));
        }
        return b.build();
    }

    /** Books a successful attempt. */
    public static Target recordSuccess(Target target, Instant now) {
        return target.toBuilder()
                .detectionAttempts(0)
                .nextCheck(null)
                .apiLastDetected(now)
                .build();
    }
}
