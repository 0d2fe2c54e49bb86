package biz.kryukov.dev.svcwatch;

import biz.kryukov.dev.svcwatch.detect.ApiDetector;
import biz.kryukov.dev.svcwatch.detect.ApiEndpointScanner;
import biz.kryukov.dev.svcwatch.http.HttpTransport;
import biz.kryukov.dev.svcwatch.liveness.HealthProber;
import biz.kryukov.dev.svcwatch.metrics.MetricsExporter;
import biz.kryukov.dev.svcwatch.store.CredentialVault;
import biz.kryukov.dev.svcwatch.store.SecretStore;
import biz.kryukov.dev.svcwatch.store.TargetStore;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Test factory for a {@link TargetMonitor} wired like the facade does it.
 */
public final class Monitors {

    private Monitors() {}

    public static TargetMonitor create(HttpTransport transport, WatchConfig config,
                                       SecretStore secrets, MeterRegistry meterRegistry) {
        return new TargetMonitor(
                new TargetStore(config.historySize()),
                new CredentialVault(secrets),
                new HealthProber(transport, config),
                new ApiDetector(new ApiEndpointScanner(transport, config)),
                meterRegistry == null ? null : new MetricsExporter(meterRegistry),
                transport,
                config,
                Clock.systemUTC(),
                List.of());
    }

    /** Blocks a transport script until the latch opens. */
    public static void await(CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
