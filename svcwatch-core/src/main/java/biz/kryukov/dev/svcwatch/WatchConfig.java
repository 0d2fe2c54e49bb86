package biz.kryukov.dev.svcwatch;

import java.time.Duration;

/**
 * Engine configuration: tick interval, per-call timeouts and history size. Immutable, created via Builder.
 */
public final class WatchConfig {

    /** Default tick interval: 30 seconds. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    /** Default delay before the first tick: 2 seconds. */
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(2);
    /** Default liveness probe timeout: 5 seconds. */
    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);
    /** Default per-candidate API scan timeout: 3 seconds. */
    public static final Duration DEFAULT_SCAN_TIMEOUT = Duration.ofSeconds(3);
    /** Default login attempt timeout: 5 seconds. */
    public static final Duration DEFAULT_AUTH_TIMEOUT = Duration.ofSeconds(5);
    /** Default authenticated request timeout: 10 seconds. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    /** Default number of check records kept per target. */
    public static final int DEFAULT_HISTORY_SIZE = 100;
    /** Default User-Agent sent by the prober. */
    public static final String DEFAULT_USER_AGENT = "svcwatch/0.1.0";

    /** Minimum allowed tick interval. */
    public static final Duration MIN_INTERVAL = Duration.ofSeconds(1);
    /** Maximum allowed tick interval. */
    public static final Duration MAX_INTERVAL = Duration.ofHours(1);
    /** Maximum allowed initial delay. */
    public static final Duration MAX_INITIAL_DELAY = Duration.ofMinutes(5);
    /** Minimum allowed call timeout. */
    public static final Duration MIN_TIMEOUT = Duration.ofMillis(100);
    /** Maximum allowed call timeout. */
    public static final Duration MAX_TIMEOUT = Duration.ofSeconds(30);
    /** Maximum allowed scan timeout. */
    public static final Duration MAX_SCAN_TIMEOUT = Duration.ofSeconds(3);
    /** Maximum allowed history size. */
    public static final int MAX_HISTORY_SIZE = 10_000;

    private final Duration interval;
    private final Duration initialDelay;
    private final Duration probeTimeout;
    private final Duration scanTimeout;
    private final Duration authTimeout;
    private final Duration requestTimeout;
    private final int historySize;
    private final String userAgent;

    private WatchConfig(Builder builder) {
        this.interval = builder.interval;
        this.initialDelay = builder.initialDelay;
        this.probeTimeout = builder.probeTimeout;
        this.scanTimeout = builder.scanTimeout;
        this.authTimeout = builder.authTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.historySize = builder.historySize;
        this.userAgent = builder.userAgent;
    }

    /** Returns the tick interval. */
    public Duration interval() {
        return interval;
    }

    /** Returns the delay before the first tick. */
    public Duration initialDelay() {
        return initialDelay;
    }

    /** Returns the liveness probe timeout. */
    public Duration probeTimeout() {
        return probeTimeout;
    }

    /** Returns the per-candidate scan timeout. */
    public Duration scanTimeout() {
        return scanTimeout;
    }

    /** Returns the login attempt timeout. */
    public Duration authTimeout() {
        return authTimeout;
    }

    /** Returns the authenticated request timeout. */
    public Duration requestTimeout() {
        return requestTimeout;
    }

    /** Returns the number of check records kept per target. */
    public int historySize() {
        return historySize;
    }

    /** Returns the User-Agent header value. */
    public String userAgent() {
        return userAgent;
    }

    /** Creates a new builder with default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a configuration with all default values. */
    public static WatchConfig defaults() {
        return builder().build();
    }

    /** Builder for {@link WatchConfig}. */
    public static final class Builder {
        private Duration interval = DEFAULT_INTERVAL;
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private Duration probeTimeout = DEFAULT_PROBE_TIMEOUT;
        private Duration scanTimeout = DEFAULT_SCAN_TIMEOUT;
        private Duration authTimeout = DEFAULT_AUTH_TIMEOUT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private int historySize = DEFAULT_HISTORY_SIZE;
        private String userAgent = DEFAULT_USER_AGENT;

        private Builder() {}

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder scanTimeout(Duration scanTimeout) {
            this.scanTimeout = scanTimeout;
            return this;
        }

        public Builder authTimeout(Duration authTimeout) {
            this.authTimeout = authTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder historySize(int historySize) {
            this.historySize = historySize;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        /** Builds and validates the configuration. */
        public WatchConfig build() {
            validate();
            return new WatchConfig(this);
        }

        private void validate() {
            if (interval == null
                    || interval.compareTo(MIN_INTERVAL) < 0 || interval.compareTo(MAX_INTERVAL) > 0) {
                throw new ValidationException(
                        "interval must be between " + MIN_INTERVAL + " and " + MAX_INTERVAL
                                + ", got " + interval);
            }
            if (initialDelay == null || initialDelay.isNegative()
                    || initialDelay.compareTo(MAX_INITIAL_DELAY) > 0) {
                throw new ValidationException(
                        "initialDelay must be between " + Duration.ZERO + " and "
                                + MAX_INITIAL_DELAY + ", got " + initialDelay);
            }
            validateTimeout("probeTimeout", probeTimeout, MAX_TIMEOUT);
            validateTimeout("scanTimeout", scanTimeout, MAX_SCAN_TIMEOUT);
            validateTimeout("authTimeout", authTimeout, MAX_TIMEOUT);
            validateTimeout("requestTimeout", requestTimeout, MAX_TIMEOUT);
            if (historySize < 1 || historySize > MAX_HISTORY_SIZE) {
                throw new ValidationException(
                        "historySize must be between 1 and " + MAX_HISTORY_SIZE
                                + ", got " + historySize);
            }
            if (userAgent == null || userAgent.isBlank()) {
                throw new ValidationException("userAgent must not be blank");
            }
        }

        private void validateTimeout(String field, Duration value, Duration max) {
            if (value == null || value.compareTo(MIN_TIMEOUT) < 0 || value.compareTo(max) > 0) {
                throw new ValidationException(
                        field + " must be between " + MIN_TIMEOUT + " and " + max
                                + ", got " + value);
            }
            if (value.compareTo(interval) >= 0) {
                throw new ValidationException(
                        field + " (" + value + ") must be less than interval (" + interval + ")");
            }
        }
    }
}
