package biz.kryukov.dev.svcwatch;

import biz.kryukov.dev.svcwatch.liveness.ProbeResult;

import java.time.Instant;
import java.util.Objects;

/**
 * A monitored network endpoint: identity, liveness state and API detection state.
 *
 * <p>Immutable snapshot. State transitions produce a new instance, and the
 * {@link biz.kryukov.dev.svcwatch.store.TargetStore} swaps snapshots atomically per name.
 * Credentials are not part of the snapshot; they live in the secret store.</p>
 */
public final class Target {

    private final String name;
    private final String url;
    private final boolean manual;

    // Liveness
    private final LivenessStatus status;
    private final Instant lastChecked;
    private final Instant statusChangedAt;
    private final Long responseTimeMillis;

    // API settings
    private final String apiUrl;
    private final String apiType;
    private final String authEndpoint;

    // API detection
    private final boolean apiDetected;
    private final String apiEndpoint;
    private final Instant apiLastDetected;
    private final int detectionAttempts;
    private final Instant nextCheck;

    private Target(Builder b) {
        this.name = b.name;
        this.url = b.url;
        this.manual = b.manual;
        this.status = b.status;
        this.lastChecked = b.lastChecked;
        this.statusChangedAt = b.statusChangedAt;
        this.responseTimeMillis = b.responseTimeMillis;
        this.apiUrl = b.apiUrl;
        this.apiType = b.apiType;
        this.authEndpoint = b.authEndpoint;
        this.apiDetected = b.apiDetected;
        this.apiEndpoint = b.apiEndpoint;
        this.apiLastDetected = b.apiLastDetected;
        this.detectionAttempts = b.detectionAttempts;
        this.nextCheck = b.nextCheck;
    }

    /** Stable unique name. */
    public String name() {
        return name;
    }

    /** Base URL; the scheme may have been rewritten by the plaintext fallback. */
    public String url() {
        return url;
    }

    /** Whether the target was declared by an operator rather than a registry. */
    public boolean manual() {
        return manual;
    }

    public LivenessStatus status() {
        return status;
    }

    /** Time of the last probe, or null before the first one. */
    public Instant lastChecked() {
        return lastChecked;
    }

    /** Time of the last verdict transition, or null. */
    public Instant statusChangedAt() {
        return statusChangedAt;
    }

    /** Round trip of the last probe in milliseconds, or null when it failed outright. */
    public Long responseTimeMillis() {
        return responseTimeMillis;
    }

    /** Explicit API base URL, or empty. */
    public String apiUrl() {
        return apiUrl;
    }

    /** Declared or detected API type, or empty. */
    public String apiType() {
        return apiType;
    }

    /** Explicit login path override, or empty. */
    public String authEndpoint() {
        return authEndpoint;
    }

    public boolean apiDetected() {
        return apiDetected;
    }

    /** Candidate path that answered the last successful scan, or empty. */
    public String apiEndpoint() {
        return apiEndpoint;
    }

    public Instant apiLastDetected() {
        return apiLastDetected;
    }

    /** Consecutive failed detection attempts. */
    public int detectionAttempts() {
        return detectionAttempts;
    }

    /** Throttle gate for the next detection attempt, or null. */
    public Instant nextCheck() {
        return nextCheck;
    }

    /** Returns the URL API calls should be made against. */
    public String effectiveApiUrl() {
        return apiUrl.isEmpty() ? url : apiUrl;
    }

    /**
     * Applies a probe result: sets the verdict, response time and possibly rewritten URL,
     * always moves {@code lastChecked}, and moves {@code statusChangedAt} only on a transition.
     */
    public Target withProbe(ProbeResult result, Instant now) {
        Builder b = toBuilder()
                .status(result.status())
                .responseTimeMillis(result.responseTimeMillis())
                .url(result.url())
                .lastChecked(now);
        if (result.status() != status) {
            b.statusChangedAt(now);
        }
        return b.build();
    }

    /** Creates a builder pre-filled with this snapshot. */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Creates a new builder for a target.
     *
     * @param name unique target name
     * @param url  base URL
     * @return a new builder instance
     */
    public static Builder builder(String name, String url) {
        return new Builder(name, url);
    }

    @Override
    public String toString() {
        return name + " (" + status.label() + ")";
    }

    /** Builder for {@link Target}. */
    public static final class Builder {
        private final String name;
        private String url;
        private boolean manual;
        private LivenessStatus status = LivenessStatus.UNKNOWN;
        private Instant lastChecked;
        private Instant statusChangedAt;
        private Long responseTimeMillis;
        private String apiUrl = "";
        private String apiType = "";
        private String authEndpoint = "";
        private boolean apiDetected;
        private String apiEndpoint = "";
        private Instant apiLastDetected;
        private int detectionAttempts;
        private Instant nextCheck;

        private Builder(String name, String url) {
            this.name = Objects.requireNonNull(name, "name");
            this.url = Objects.requireNonNull(url, "url");
        }

        private Builder(Target t) {
            this.name = t.name;
            this.url = t.url;
            this.manual = t.manual;
            this.status = t.status;
            this.lastChecked = t.lastChecked;
            this.statusChangedAt = t.statusChangedAt;
            this.responseTimeMillis = t.responseTimeMillis;
            this.apiUrl = t.apiUrl;
            this.apiType = t.apiType;
            this.authEndpoint = t.authEndpoint;
            this.apiDetected = t.apiDetected;
            this.apiEndpoint = t.apiEndpoint;
            this.apiLastDetected = t.apiLastDetected;
            this.detectionAttempts = t.detectionAttempts;
            this.nextCheck = t.nextCheck;
        }

        public Builder url(String url) {
            this.url = Objects.requireNonNull(url, "url");
            return this;
        }

        public Builder manual(boolean manual) {
            this.manual = manual;
            return this;
        }

        public Builder status(LivenessStatus status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder lastChecked(Instant lastChecked) {
            this.lastChecked = lastChecked;
            return this;
        }

        public Builder statusChangedAt(Instant statusChangedAt) {
            this.statusChangedAt = statusChangedAt;
            return this;
        }

        public Builder responseTimeMillis(Long responseTimeMillis) {
            this.responseTimeMillis = responseTimeMillis;
            return this;
        }

        public Builder apiUrl(String apiUrl) {
            this.apiUrl = nullToEmpty(apiUrl);
            return this;
        }

        public Builder apiType(String apiType) {
            this.apiType = nullToEmpty(apiType);
            return this;
        }

        public Builder authEndpoint(String authEndpoint) {
            this.authEndpoint = nullToEmpty(authEndpoint);
            return this;
        }

        public Builder apiDetected(boolean apiDetected) {
            this.apiDetected = apiDetected;
            return this;
        }

        public Builder apiEndpoint(String apiEndpoint) {
            this.apiEndpoint = nullToEmpty(apiEndpoint);
            return this;
        }

        public Builder apiLastDetected(Instant apiLastDetected) {
            this.apiLastDetected = apiLastDetected;
            return this;
        }

        public Builder detectionAttempts(int detectionAttempts) {
            this.detectionAttempts = detectionAttempts;
            return this;
        }

        public Builder nextCheck(Instant nextCheck) {
            this.nextCheck = nextCheck;
            return this;
        }

        /** Builds and validates the target. */
        public Target build() {
            if (name.isBlank()) {
                throw new ValidationException("target name must not be blank");
            }
            if (url.isBlank()) {
                throw new ValidationException("target '" + name + "' must have a url");
            }
            if (detectionAttempts < 0) {
                throw new ValidationException(
                        "detectionAttempts must be >= 0, got " + detectionAttempts);
            }
            return new Target(this);
        }

        private static String nullToEmpty(String value) {
            return value == null ? "" : value;
        }
    }
}
