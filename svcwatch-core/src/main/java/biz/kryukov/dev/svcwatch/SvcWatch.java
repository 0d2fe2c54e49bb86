package biz.kryukov.dev.svcwatch;

import biz.kryukov.dev.svcwatch.auth.ApiClient;
import biz.kryukov.dev.svcwatch.detect.ApiDetector;
import biz.kryukov.dev.svcwatch.detect.ApiEndpointScanner;
import biz.kryukov.dev.svcwatch.detect.DetectionResult;
import biz.kryukov.dev.svcwatch.http.HttpTransport;
import biz.kryukov.dev.svcwatch.http.JdkHttpTransport;
import biz.kryukov.dev.svcwatch.liveness.HealthProber;
import biz.kryukov.dev.svcwatch.metrics.MetricsExporter;
import biz.kryukov.dev.svcwatch.registry.TargetDefinition;
import biz.kryukov.dev.svcwatch.registry.TargetRegistry;
import biz.kryukov.dev.svcwatch.scheduler.WatchScheduler;
import biz.kryukov.dev.svcwatch.store.CheckRecord;
import biz.kryukov.dev.svcwatch.store.CredentialVault;
import biz.kryukov.dev.svcwatch.store.InMemorySecretStore;
import biz.kryukov.dev.svcwatch.store.SecretStore;
import biz.kryukov.dev.svcwatch.store.TargetStore;

import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * svcwatch entry point.
 *
 * <p>Usage:
 * <pre>{@code
 * SvcWatch watch = SvcWatch.builder()
 *     .meterRegistry(meterRegistry)
 *     .config(WatchConfig.builder().interval(Duration.ofSeconds(15)).build())
 *     .target(new TargetDefinition("nas", "https://nas.local", "", "", "",
 *         Credentials.ofPassword("admin", secret)))
 *     .build();
 *
 * watch.start();
 * // ...
 * watch.stop();
 * }</pre>
 */
public final class SvcWatch {

    private final TargetMonitor monitor;
    private final TargetStore store;
    private final CredentialVault vault;
    private final WatchScheduler scheduler;

    private SvcWatch(TargetMonitor monitor, WatchScheduler scheduler) {
        this.monitor = monitor;
        this.store = monitor.store();
        this.vault = monitor.vault();
        this.scheduler = scheduler;
    }

    /** Starts periodic monitoring. */
    public void start() {
        scheduler.start();
    }

    /** Stops periodic monitoring. */
    public void stop() {
        scheduler.stop();
    }

    /** Whether periodic monitoring is running. */
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    /**
     * Probes a target now.
     *
     * @return the updated snapshot
     * @throws TargetNotFoundException if the target does not exist
     */
    public Target probe(String name) {
        return monitor.probe(name);
    }

    /**
     * Runs API detection for a target now.
     *
     * @param force bypass the backoff gate
     * @throws TargetNotFoundException if the target does not exist
     */
    public DetectionResult detect(String name, boolean force) {
        return monitor.detect(name, force);
    }

    /**
     * Whether API detection is due for a target.
     *
     * @throws TargetNotFoundException if the target does not exist
     */
    public boolean shouldDetect(String name, boolean force) {
        return monitor.shouldDetect(name, force);
    }

    /**
     * Creates an authenticated client for a target's API.
     *
     * @throws TargetNotFoundException if the target does not exist
     */
    public ApiClient client(String name) {
        return monitor.client(name);
    }

    /**
     * Declares a target (or updates its settings) and stores its credentials.
     *
     * @throws ValidationException if the name or URL is blank
     */
    public Target addTarget(TargetDefinition definition) {
        return monitor.register(definition, true);
    }

    /** Removes a target with its history, credentials and metrics. */
    public boolean removeTarget(String name) {
        return monitor.remove(name);
    }

    /**
     * Replaces the credentials of a target.
     *
     * @throws TargetNotFoundException if the target does not exist
     */
    public void updateCredentials(String name, Credentials credentials) {
        if (!store.contains(name)) {
            throw new TargetNotFoundException(name);
        }
        vault.store(name, Objects.requireNonNull(credentials, "credentials"));
    }

    public Optional<Target> target(String name) {
        return store.get(name);
    }

    /** All targets, sorted by name. */
    public List<Target> targets() {
        return store.all();
    }

    /** Current verdicts keyed by target name (true = up). Targets not yet probed are omitted. */
    public Map<String, Boolean> health() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (Target target : store.all()) {
            if (target.status() != LivenessStatus.UNKNOWN) {
                result.put(target.name(), target.status() == LivenessStatus.UP);
            }
        }
        return result;
    }

    /** Check history of a target, oldest first. */
    public List<CheckRecord> history(String name) {
        return store.history(name);
    }

    /** Percentage of up checks in the retained history, or null without history. */
    public Double uptime(String name) {
        return store.uptime(name);
    }

    /** Pulls declarations from the registries now. */
    public int sync() {
        return monitor.sync();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link SvcWatch}. */
    public static final class Builder {
        private WatchConfig config = WatchConfig.defaults();
        private MeterRegistry meterRegistry;
        private HttpTransport transport;
        private SecretStore secretStore;
        private Clock clock = Clock.systemUTC();
        private int workers = WatchScheduler.DEFAULT_WORKERS;
        private final List<TargetRegistry> registries = new ArrayList<>();
        private final List<TargetDefinition> targets = new ArrayList<>();

        private Builder() {}

        public Builder config(WatchConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /** Enables Micrometer metrics. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder secretStore(SecretStore secretStore) {
            this.secretStore = secretStore;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        /** Adds a registry polled on every tick. */
        public Builder registry(TargetRegistry registry) {
            registries.add(Objects.requireNonNull(registry, "registry"));
            return this;
        }

        /** Declares a target. */
        public Builder target(TargetDefinition definition) {
            targets.add(Objects.requireNonNull(definition, "definition"));
            return this;
        }

        public SvcWatch build() {
            HttpTransport http = transport != null ? transport : new JdkHttpTransport();
            SecretStore secrets = secretStore != null ? secretStore : new InMemorySecretStore();
            MetricsExporter metrics = meterRegistry != null ? new MetricsExporter(meterRegistry) : null;

            TargetStore store = new TargetStore(config.historySize());
            TargetMonitor monitor = new TargetMonitor(
                    store,
                    new CredentialVault(secrets),
                    new HealthProber(http, config),
                    new ApiDetector(new ApiEndpointScanner(http, config)),
                    metrics,
                    http,
                    config,
                    clock,
                    registries);
            for (TargetDefinition definition : targets) {
                monitor.register(definition, true);
            }
            WatchScheduler scheduler = new WatchScheduler(monitor, store::names, config, workers);
            return new SvcWatch(monitor, scheduler);
        }
    }
}
