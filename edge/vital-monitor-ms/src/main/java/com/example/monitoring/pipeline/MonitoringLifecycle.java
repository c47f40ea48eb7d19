package com.example.monitoring.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running flag plus an epoch that changes on every start and stop. Work captures the epoch when
 * it begins and may only publish results while that epoch is still current.
 */
@ApplicationScoped
public class MonitoringLifecycle {

    private final AtomicLong epoch = new AtomicLong();
    private volatile boolean running;

    public synchronized long begin() {
        running = true;
        return epoch.incrementAndGet();
    }

    public synchronized void end() {
        running = false;
        epoch.incrementAndGet();
    }

    public long currentEpoch() {
        return epoch.get();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isCurrent(long capturedEpoch) {
        return running && epoch.get() == capturedEpoch;
    }
}
