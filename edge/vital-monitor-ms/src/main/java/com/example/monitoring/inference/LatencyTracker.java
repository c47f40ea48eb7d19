package com.example.monitoring.inference;

import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.jboss.logging.Logger;

/**
 * End-to-end pass latency: last, exponentially weighted mean, max, and budget overruns.
 * Overruns are logged at most once every ten seconds.
 */
@ApplicationScoped
public class LatencyTracker {

    private static final Logger LOG = Logger.getLogger(LatencyTracker.class);
    private static final long LOG_EVERY_NANOS = Duration.ofSeconds(10).toNanos();
    private static final double EWMA_WEIGHT = 0.1;

    private final AtomicLong lastMicros = new AtomicLong();
    private final AtomicLong maxMicros = new AtomicLong();
    private final AtomicLong ewmaBits = new AtomicLong(Double.doubleToLongBits(0.0));
    private final AtomicLong passes = new AtomicLong();
    private final AtomicLong overruns = new AtomicLong();
    private final AtomicLong lastOverrunLog = new AtomicLong(Long.MIN_VALUE);

    public void record(Duration latency, Duration budget) {
        long micros = latency.toNanos() / 1_000;
        lastMicros.set(micros);
        maxMicros.accumulateAndGet(micros, Math::max);
        long n = passes.incrementAndGet();
        ewmaBits.updateAndGet(bits -> {
            double prev = Double.longBitsToDouble(bits);
            double next = n == 1 ? micros : prev + EWMA_WEIGHT * (micros - prev);
            return Double.doubleToLongBits(next);
        });

        if (latency.compareTo(budget) > 0) {
            long total = overruns.incrementAndGet();
            long now = System.nanoTime();
            long previous = lastOverrunLog.get();
            if ((previous == Long.MIN_VALUE || now - previous >= LOG_EVERY_NANOS)
                && lastOverrunLog.compareAndSet(previous, now)) {
                LOG.warnf(
                    "Inference pass took %d ms, budget is %d ms (%d overruns in %d passes)",
                    latency.toMillis(),
                    budget.toMillis(),
                    total,
                    n
                );
            }
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(
            lastMicros.get() / 1000.0,
            Double.longBitsToDouble(ewmaBits.get()) / 1000.0,
            maxMicros.get() / 1000.0,
            passes.get(),
            overruns.get()
        );
    }

    public record Snapshot(double lastMs, double averageMs, double maxMs, long passes, long overruns) {}
}
