package biz.kryukov.dev.svcwatch.metrics;

import biz.kryukov.dev.svcwatch.LivenessStatus;
import biz.kryukov.dev.svcwatch.Target;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.net.URI;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Exports target state to a Micrometer MeterRegistry.
 *
 * <p>Metrics exported:
 * <ul>
 *   <li>{@code svcwatch_target_up} - Gauge (1 = up, 0 = down; absent while unknown)</li>
 *   <li>{@code svcwatch_target_response_seconds} - DistributionSummary</li>
 *   <li>{@code svcwatch_target_api_detected} - Gauge (0/1)</li>
 *   <li>{@code svcwatch_target_detection_attempts} - Gauge</li>
 * </ul>
 * Tags: {@code target}, {@code host}.
 */
public final class MetricsExporter {

    static final String UP_METRIC = "svcwatch_target_up";
    static final String RESPONSE_METRIC = "svcwatch_target_response_seconds";
    static final String API_DETECTED_METRIC = "svcwatch_target_api_detected";
    static final String ATTEMPTS_METRIC = "svcwatch_target_detection_attempts";

    private static final double[] RESPONSE_SLOS = {0.01, 0.05, 0.1, 0.5, 1.0, 2.0, 5.0};

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Series> series = new ConcurrentHashMap<>();

    public MetricsExporter(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Publishes the liveness verdict and, when present, the response time of a probe.
     */
    public void recordProbe(Target target) {
        Series s = series(target);
        if (target.status() != LivenessStatus.UNKNOWN) {
            s.up.set(target.status() == LivenessStatus.UP ? 1.0 : 0.0);
            if (s.upGauge.compareAndSet(null, Boolean.TRUE)) {
                s.meters.add(Gauge.builder(UP_METRIC, s.up, AtomicReference::get)
                        .description("Liveness of a target (1 = up, 0 = down)")
                        .tags(s.tags)
                        .register(registry));
            }
        }
        if (target.responseTimeMillis() != null) {
            s.response.record(target.responseTimeMillis() / 1000.0);
        }
        recordDetection(target);
    }

    /**
     * Publishes the API detection state.
     */
    public void recordDetection(Target target) {
        Series s = series(target);
        s.apiDetected.set(target.apiDetected() ? 1.0 : 0.0);
        s.attempts.set((double) target.detectionAttempts());
    }

    /**
     * Deletes every series of a target.
     */
    public void deleteMetrics(String targetName) {
        Series s = series.remove(targetName);
        if (s == null) {
            return;
        }
        for (Meter meter : s.meters) {
            registry.remove(meter);
        }
    }

    private Series series(Target target) {
        return series.computeIfAbsent(target.name(), name -> {
            Tags tags = Tags.of("target", name, "host", host(target.url()));
            Series s = new Series(tags);
            s.response = DistributionSummary.builder(RESPONSE_METRIC)
                    .description("Response time of the liveness probe in seconds")
                    .baseUnit("seconds")
                    .tags(tags)
                    .serviceLevelObjectives(RESPONSE_SLOS)
                    .register(registry);
            s.meters.add(s.response);
            s.meters.add(Gauge.builder(API_DETECTED_METRIC, s.apiDetected, AtomicReference::get)
                    .description("Whether an API was detected on the target (1 = yes)")
                    .tags(tags)
                    .register(registry));
            s.meters.add(Gauge.builder(ATTEMPTS_METRIC, s.attempts, AtomicReference::get)
                    .description("Consecutive failed API detection attempts")
                    .tags(tags)
                    .register(registry));
            return s;
        });
    }

    static String host(String url) {
        try {
            String host = URI.create(url).getHost();
            return host == null ? "" : host;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static final class Series {
        private final Tags tags;
        private final AtomicReference<Double> up = new AtomicReference<>(0.0);
        private final AtomicReference<Boolean> upGauge = new AtomicReference<>();
        private final AtomicReference<Double> apiDetected = new AtomicReference<>(0.0);
        private final AtomicReference<Double> attempts = new AtomicReference<>(0.0);
        private final List<Meter> meters = new CopyOnWriteArrayList<>();
        private DistributionSummary response;

        private Series(Tags tags) {
            this.tags = tags;
        }
    }
}
