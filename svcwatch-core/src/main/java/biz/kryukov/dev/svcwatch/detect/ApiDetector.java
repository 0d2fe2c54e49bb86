package biz.kryukov.dev.svcwatch.detect;

import biz.kryukov.dev.svcwatch.Credentials;
import biz.kryukov.dev.svcwatch.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Runs API detection for one target: manual-credential short-circuit, backoff gate,
 * endpoint scan and bookkeeping.
 */
public final class ApiDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ApiDetector.class);

    static final String CUSTOM_TYPE = "custom";

    private final ApiEndpointScanner scanner;

    public ApiDetector(ApiEndpointScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    /**
     * Detects the API of a target.
     *
     * @param target      current snapshot
     * @param credentials configured credentials, never null
     * @param force       bypass the backoff gate
     * @param now         current time
     * @return outcome and the updated snapshot
     */
    public DetectionResult detect(Target target, Credentials credentials, boolean force, Instant now) {
        if (credentials.hasUsernamePassword()) {
            Target updated = DetectionScheduler.recordSuccess(target.toBuilder()
                    .apiDetected(true)
                    .apiType(resolveType(target))
                    .build(), now);
            LOG.debug("svcwatch: [{}] credentials configured, API assumed", target.name());
            return new DetectionResult(DetectionResult.Outcome.MANUAL, updated);
        }

        if (!DetectionScheduler.shouldDetect(target, force, now)) {
            if (target.apiDetected()) {
                return new DetectionResult(DetectionResult.Outcome.SKIPPED, target);
            }
            LOG.debug("svcwatch: [{}] detection throttled after {} attempts, next check at {}",
                    target.name(), target.detectionAttempts(), target.nextCheck());
            return new DetectionResult(DetectionResult.Outcome.THROTTLED, target);
        }

        ScanResult scan;
        try {
            scan = scanner.scan(target.url());
        } catch (RuntimeException e) {
            LOG.warn("svcwatch: [{}] API scan of {} failed: {}", target.name(), target.url(),
                    e.getMessage());
            scan = ScanResult.notFound();
        }

        if (scan.found()) {
            Target.Builder b = target.toBuilder()
                    .apiDetected(true)
                    .apiEndpoint(scan.endpoint())
                    .apiType(resolveType(target));
            if (target.apiUrl().isEmpty()) {
                b.apiUrl(target.url());
            }
            Target updated = DetectionScheduler.recordSuccess(b.build(), now);
            LOG.info("svcwatch: [{}] API detected at {}{} (type {})", target.name(), target.url(),
                    scan.endpoint(), updated.apiType());
            return new DetectionResult(DetectionResult.Outcome.DETECTED, updated);
        }

        Target updated = DetectionScheduler.recordFailure(
                target.toBuilder().apiDetected(false).build(), now);
        if (updated.detectionAttempts() >= DetectionScheduler.MAX_ATTEMPTS) {
            LOG.info("svcwatch: [{}] no API found after {} attempts, next check at {}",
                    target.name(), updated.detectionAttempts(), updated.nextCheck());
        } else {
            LOG.debug("svcwatch: [{}] no API found (attempt {})", target.name(),
                    updated.detectionAttempts());
        }
        return new DetectionResult(DetectionResult.Outcome.NOT_FOUND, updated);
    }

    /**
     * Declared type if set, else the name lower-cased without spaces when longer than
     * two characters, else {@code custom}.
     */
    static String resolveType(Target target) {
        if (!target.apiType().isEmpty()) {
            return target.apiType();
        }
        String derived = target.name().toLowerCase(Locale.ROOT).replace(" ", "");
        return derived.length() > 2 ? derived : CUSTOM_TYPE;
    }
}
