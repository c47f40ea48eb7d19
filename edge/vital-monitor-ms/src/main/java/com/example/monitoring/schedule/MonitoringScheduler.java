package com.example.monitoring.schedule;

import com.example.monitoring.config.WorkerPool;
import com.example.monitoring.model.RiskLevel;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Owns the periodic timers. The timer thread only dispatches onto the worker pool; a task whose
 * previous run is still in flight skips that tick. Whenever the cadence changes, every adaptive
 * timer is cancelled before its replacement is scheduled, so a task never has two live timers.
 */
@ApplicationScoped
public class MonitoringScheduler {

    private static final Logger LOG = Logger.getLogger(MonitoringScheduler.class);

    private final CadencePolicy policy;
    private final ScheduledExecutorService timer;
    private final Executor workers;
    private final Duration retentionSweepInterval;

    private final Object lock = new Object();
    private final Map<PeriodicTask, ScheduledFuture<?>> timers = new EnumMap<>(PeriodicTask.class);
    private final Map<PeriodicTask, Runnable> tasks = new EnumMap<>(PeriodicTask.class);
    private ScheduledFuture<?> sweepTimer;
    private double batteryPct = 100.0;
    private RiskLevel risk = RiskLevel.NORMAL;
    private Cadence cadence;
    private boolean running;

    @Inject
    public MonitoringScheduler(
        CadencePolicy policy,
        WorkerPool workers,
        @ConfigProperty(
            name = "monitoring.store.sweep-interval",
            defaultValue = "PT1H"
        ) Duration retentionSweepInterval
    ) {
        this(policy, newTimer(), workers, retentionSweepInterval);
    }

    public MonitoringScheduler(
        CadencePolicy policy,
        ScheduledExecutorService timer,
        Executor workers,
        Duration retentionSweepInterval
    ) {
        this.policy = policy;
        this.timer = timer;
        this.workers = workers;
        this.retentionSweepInterval = retentionSweepInterval;
        this.cadence = policy.cadenceFor(batteryPct, risk);
    }

    private static ScheduledExecutorService newTimer() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread t = new Thread(runnable, "monitoring-timer");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    public void start(Map<PeriodicTask, Runnable> periodicTasks, Runnable retentionSweep) {
        synchronized (lock) {
            if (running) {
                LOG.debug("Scheduler already running");
                return;
            }
            tasks.clear();
            for (Map.Entry<PeriodicTask, Runnable> e : periodicTasks.entrySet()) {
                tasks.put(e.getKey(), guarded(e.getKey().name(), e.getValue()));
            }
            running = true;
            cadence = policy.cadenceFor(batteryPct, risk);
            scheduleAdaptive();
            long sweepMillis = retentionSweepInterval.toMillis();
            Runnable sweep = guarded("RETENTION_SWEEP", retentionSweep);
            sweepTimer = timer.scheduleWithFixedDelay(
                () -> workers.execute(sweep),
                sweepMillis,
                sweepMillis,
                TimeUnit.MILLISECONDS
            );
            LOG.infof("Periodic tasks started with %s", cadence);
        }
    }

    public void updateBattery(double pct) {
        synchronized (lock) {
            BatteryBand before = policy.bandFor(batteryPct);
            batteryPct = pct;
            BatteryBand after = policy.bandFor(pct);
            if (before != after) {
                LOG.infof("Battery at %.0f%%, moving from %s to %s band", pct, before, after);
            }
            recompute();
        }
    }

    public void updateRisk(RiskLevel level) {
        synchronized (lock) {
            if (risk == level) return;
            LOG.infof("Risk level changed from %s to %s", risk, level);
            risk = level;
            recompute();
        }
    }

    private void recompute() {
        Cadence next = policy.cadenceFor(batteryPct, risk);
        if (next.equals(cadence)) return;
        cadence = next;
        if (running) {
            cancelAdaptive();
            scheduleAdaptive();
            LOG.infof("Timers replaced with %s", cadence);
        }
    }

    private void scheduleAdaptive() {
        for (Map.Entry<PeriodicTask, Runnable> e : tasks.entrySet()) {
            long millis = cadence.intervalFor(e.getKey()).toMillis();
            Runnable task = e.getValue();
            timers.put(
                e.getKey(),
                timer.scheduleWithFixedDelay(() -> workers.execute(task), millis, millis, TimeUnit.MILLISECONDS)
            );
        }
    }

    private void cancelAdaptive() {
        for (ScheduledFuture<?> f : timers.values()) {
            f.cancel(false);
        }
        timers.clear();
    }

    public void stop() {
        synchronized (lock) {
            if (!running) return;
            running = false;
            cancelAdaptive();
            if (sweepTimer != null) {
                sweepTimer.cancel(false);
                sweepTimer = null;
            }
            LOG.info("Periodic tasks stopped");
        }
    }

    /** Skips a tick while the previous run of the same task is still executing. */
    private static Runnable guarded(String name, Runnable task) {
        AtomicBoolean inFlight = new AtomicBoolean();
        return () -> {
            if (!inFlight.compareAndSet(false, true)) {
                LOG.debugf("Skipping %s tick, previous run still in flight", name);
                return;
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.errorf(e, "Periodic task %s failed", name);
            } finally {
                inFlight.set(false);
            }
        };
    }

    public Cadence currentCadence() {
        synchronized (lock) {
            return cadence;
        }
    }

    public double batteryPct() {
        synchronized (lock) {
            return batteryPct;
        }
    }

    public RiskLevel riskLevel() {
        synchronized (lock) {
            return risk;
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    /** Number of adaptive timers currently scheduled and not cancelled. */
    public int liveTimerCount() {
        synchronized (lock) {
            int live = 0;
            for (ScheduledFuture<?> f : timers.values()) {
                if (!f.isCancelled()) live++;
            }
            return live;
        }
    }

    @PreDestroy
    void shutdown() {
        stop();
        timer.shutdownNow();
    }
}
