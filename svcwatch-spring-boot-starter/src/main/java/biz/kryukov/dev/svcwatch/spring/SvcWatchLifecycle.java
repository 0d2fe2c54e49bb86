package biz.kryukov.dev.svcwatch.spring;

import biz.kryukov.dev.svcwatch.SvcWatch;
import org.springframework.context.SmartLifecycle;

/**
 * SmartLifecycle: starts monitoring once the context is up and stops it on shutdown.
 */
public class SvcWatchLifecycle implements SmartLifecycle {

    private final SvcWatch svcWatch;
    private volatile boolean running;

    public SvcWatchLifecycle(SvcWatch svcWatch) {
        this.svcWatch = svcWatch;
    }

    @Override
    public void start() {
        svcWatch.start();
        running = true;
    }

    @Override
    public void stop() {
        svcWatch.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
