package biz.kryukov.dev.svcwatch.scheduler;

import biz.kryukov.dev.svcwatch.TargetMonitor;
import biz.kryukov.dev.svcwatch.TargetNotFoundException;
import biz.kryukov.dev.svcwatch.WatchConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Periodic driver: every tick syncs registries, then submits one cycle per target to a
 * worker pool.
 *
 * <p>Owns its threads (daemon). Nothing a cycle throws stops the loop. A target whose cycle is
 * still queued or running is not submitted again, so slow targets never pile up.</p>
 */
public final class WatchScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(WatchScheduler.class);

    /** Default number of worker threads. */
    public static final int DEFAULT_WORKERS = 4;

    private final TargetMonitor monitor;
    private final Supplier<Collection<String>> targetNames;
    private final WatchConfig config;
    private final int workerCount;
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    private ScheduledThreadPoolExecutor ticker;
    private ExecutorService workers;
    private volatile boolean started;
    private volatile boolean stopped;

    public WatchScheduler(TargetMonitor monitor, Supplier<Collection<String>> targetNames,
                          WatchConfig config) {
        this(monitor, targetNames, config, DEFAULT_WORKERS);
    }

    public WatchScheduler(TargetMonitor monitor, Supplier<Collection<String>> targetNames,
                          WatchConfig config, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.targetNames = Objects.requireNonNull(targetNames, "targetNames");
        this.config = Objects.requireNonNull(config, "config");
        this.workerCount = workerCount;
    }

    /**
     * Starts periodic ticks.
     *
     * @throws IllegalStateException if already started or stopped
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Scheduler already started");
        }
        if (stopped) {
            throw new IllegalStateException("Scheduler already stopped");
        }
        started = true;

        ticker = new ScheduledThreadPoolExecutor(1, daemonThreads("svcwatch-ticker"));
        workers = new ThreadPoolExecutor(workerCount, workerCount, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), daemonThreads("svcwatch-worker"));
        ticker.scheduleAtFixedRate(this::tick,
                config.initialDelay().toMillis(),
                config.interval().toMillis(),
                TimeUnit.MILLISECONDS);

        LOG.info("svcwatch: scheduler started, interval {}s, {} workers",
                config.interval().toSeconds(), workerCount);
    }

    /**
     * Stops ticks and waits briefly for running cycles.
     */
    public synchronized void stop() {
        if (!started || stopped) {
            return;
        }
        stopped = true;
        shutdown(ticker);
        shutdown(workers);
        LOG.info("svcwatch: scheduler stopped");
    }

    public boolean isRunning() {
        return started && !stopped;
    }

    /**
     * One tick: registry sync, then a cycle per known target.
     */
    void tick() {
        try {
            monitor.sync();
        } catch (RuntimeException e) {
            LOG.error("svcwatch: registry sync failed", e);
        }
        for (String name : targetNames.get()) {
            if (!pending.add(name)) {
                LOG.debug("svcwatch: [{}] previous cycle still outstanding, skipping", name);
                continue;
            }
            try {
                workers.execute(() -> runCycle(name));
            } catch (RejectedExecutionException e) {
                pending.remove(name);
                LOG.debug("svcwatch: scheduler shutting down, cycle for {} not submitted", name);
                return;
            }
        }
    }

    /** Number of targets with a queued or running cycle. */
    int pendingCycles() {
        return pending.size();
    }

    private void runCycle(String name) {
        try {
            monitor.cycle(name);
        } catch (TargetNotFoundException e) {
            LOG.debug("svcwatch: [{}] removed during cycle", name);
        } catch (RuntimeException e) {
            LOG.error("svcwatch: [{}] cycle failed", name, e);
        } finally {
            pending.remove(name);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
