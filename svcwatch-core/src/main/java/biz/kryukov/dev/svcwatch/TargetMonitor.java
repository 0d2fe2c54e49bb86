package biz.kryukov.dev.svcwatch;

import biz.kryukov.dev.svcwatch.auth.ApiClient;
import biz.kryukov.dev.svcwatch.detect.ApiDetector;
import biz.kryukov.dev.svcwatch.detect.DetectionResult;
import biz.kryukov.dev.svcwatch.detect.DetectionScheduler;
import biz.kryukov.dev.svcwatch.http.HttpTransport;
import biz.kryukov.dev.svcwatch.liveness.HealthProber;
import biz.kryukov.dev.svcwatch.liveness.ProbeResult;
import biz.kryukov.dev.svcwatch.metrics.MetricsExporter;
import biz.kryukov.dev.svcwatch.registry.TargetDefinition;
import biz.kryukov.dev.svcwatch.registry.TargetRegistry;
import biz.kryukov.dev.svcwatch.store.CheckRecord;
import biz.kryukov.dev.svcwatch.store.CredentialVault;
import biz.kryukov.dev.svcwatch.store.TargetStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Monitoring engine: runs probe and detection cycles against the store.
 *
 * <p>At most one cycle per target runs at a time. Scheduled cycles skip a target whose
 * previous cycle is still running; on-demand operations wait for it.</p>
 */
public final class TargetMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(TargetMonitor.class);

    private final TargetStore store;
    private final CredentialVault vault;
    private final HealthProber prober;
    private final ApiDetector detector;
    private final MetricsExporter metrics;
    private final HttpTransport transport;
    private final WatchConfig config;
    private final Clock clock;
    private final List<TargetRegistry> registries;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    TargetMonitor(TargetStore store, CredentialVault vault, HealthProber prober, ApiDetector detector,
                  MetricsExporter metrics, HttpTransport transport, WatchConfig config, Clock clock,
                  List<TargetRegistry> registries) {
        this.store = Objects.requireNonNull(store, "store");
        this.vault = Objects.requireNonNull(vault, "vault");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.metrics = metrics;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.registries = List.copyOf(registries);
    }

    TargetStore store() {
        return store;
    }

    CredentialVault vault() {
        return vault;
    }

    /**
     * Probes one target now, waiting for a running cycle to finish.
     *
     * @throws TargetNotFoundException if the target does not exist
     */
    public Target probe(String name) {
        require(name);
        ReentrantLock lock = lock(name);
        lock.lock();
        try {
            return runProbe(name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs API detection for one target now, waiting for a running cycle to finish.
     *
     * @throws TargetNotFoundException if the target does not exist
     */
    public DetectionResult detect(String name, boolean force) {
        require(name);
        ReentrantLock lock = lock(name);
        lock.lock();
        try {
            return runDetect(name, force);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether detection is due for the target.
     *
     * @throws TargetNotFoundException if the target does not exist
     */
    public boolean shouldDetect(String name, boolean force) {
        return DetectionScheduler.shouldDetect(require(name), force, clock.instant());
    }

    /**
     * Scheduled cycle for one target: probe, then detection when the target is up and
     * detection is due. Skipped when a cycle for the target is already running.
     *
     * @return false when skipped
     * @throws TargetNotFoundException if the target does not exist
     */
    public boolean cycle(String name) {
        require(name);
        ReentrantLock lock = lock(name);
        if (!lock.tryLock()) {
            LOG.debug("svcwatch: [{}] previous cycle still running, skipping", name);
            return false;
        }
        try {
            Target probed = runProbe(name);
            if (probed.status() == LivenessStatus.UP) {
                runDetect(name, false);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pulls target declarations from every available registry into the store.
     *
     * @return number of definitions applied
     */
    public int sync() {
        int applied = 0;
        for (TargetRegistry registry : registries) {
            if (!registry.available()) {
                LOG.debug("svcwatch: registry {} unavailable, skipping", registry.name());
                continue;
            }
            List<TargetDefinition> definitions;
            try {
                definitions = registry.targets();
            } catch (RuntimeException e) {
                LOG.warn("svcwatch: registry {} failed: {}", registry.name(), e.getMessage());
                continue;
            }
            for (TargetDefinition definition : definitions) {
                try {
                    register(definition, false);
                    applied++;
                } catch (ValidationException e) {
                    LOG.warn("svcwatch: registry {} supplied invalid target {}: {}",
                            registry.name(), definition.name(), e.getMessage());
                }
            }
        }
        return applied;
    }

    /**
     * Adds or updates a target and stores its credentials when given.
     */
    public Target register(TargetDefinition definition, boolean manual) {
        Target declared = definition.toTarget(manual);
        Target stored = store.upsert(declared);
        if (!definition.credentials().isEmpty()) {
            vault.store(definition.name(), definition.credentials());
        }
        return stored;
    }

    /**
     * Removes a target with its history, credentials and metric series.
     *
     * @return true if the target existed
     */
    public boolean remove(String name) {
        boolean removed = store.remove(name).isPresent();
        vault.remove(name);
        if (metrics != null) {
            metrics.deleteMetrics(name);
        }
        locks.remove(name);
        if (removed) {
            LOG.info("svcwatch: [{}] removed", name);
        }
        return removed;
    }

    /**
     * Creates an authenticated client for the target's API.
     *
     * @throws TargetNotFoundException if the target does not exist
     */
    public ApiClient client(String name) {
        Target target = require(name);
        return ApiClient.builder(target.effectiveApiUrl())
                .credentials(vault.load(name))
                .authEndpoint(target.authEndpoint())
                .transport(transport)
                .config(config)
                .build();
    }

    private Target runProbe(String name) {
        Target current = require(name);
        ProbeResult result = prober.probe(current);
        Instant now = clock.instant();
        CheckRecord record = new CheckRecord(result.status(), result.responseTimeMillis(), now,
                result.detail());
        Target updated = store.update(name, t -> t.withProbe(result, now), record);

        if (current.status() != updated.status()) {
            if (updated.status() == LivenessStatus.UP) {
                LOG.info("svcwatch: [{}] {} -> up ({} ms)", name, current.status().label(),
                        updated.responseTimeMillis());
            } else {
                LOG.warn("svcwatch: [{}] {} -> down: {}", name, current.status().label(),
                        result.detail());
            }
        }
        if (!current.url().equals(updated.url())) {
            LOG.info("svcwatch: [{}] url changed {} -> {}", name, current.url(), updated.url());
        }
        if (metrics != null) {
            metrics.recordProbe(updated);
        }
        return updated;
    }

    private DetectionResult runDetect(String name, boolean force) {
        Target current = require(name);
        DetectionResult result = detector.detect(current, vault.load(name), force, clock.instant());
        Target updated = current;
        if (result.target() != current) {
            updated = store.update(name, t -> mergeDetection(t, result.target()));
        }
        // a target removed meanwhile must not get its series back
        if (metrics != null && store.contains(name)) {
            metrics.recordDetection(updated);
        }
        return new DetectionResult(result.outcome(), updated);
    }

    // Detection owns only its own fields; liveness written meanwhile is kept.
    private static Target mergeDetection(Target stored, Target detected) {
        return stored.toBuilder()
                .apiDetected(detected.apiDetected())
                .apiType(detected.apiType())
                .apiEndpoint(detected.apiEndpoint())
                .apiUrl(detected.apiUrl())
                .apiLastDetected(detected.apiLastDetected())
                .detectionAttempts(detected.detectionAttempts())
                .nextCheck(detected.nextCheck())
                .build();
    }

    private Target require(String name) {
        return store.get(name).orElseThrow(() -> new TargetNotFoundException(name));
    }

    int lockCount() {
        return locks.size();
    }

    private ReentrantLock lock(String name) {
        return locks.computeIfAbsent(name, n -> new ReentrantLock());
    }
}
