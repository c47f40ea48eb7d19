package com.example.monitoring.pipeline;

import com.example.monitoring.schedule.MonitoringScheduler;
import com.example.monitoring.schedule.PeriodicTask;
import com.example.monitoring.sync.SyncService;
import com.example.monitoring.sync.SyncTrigger;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import java.util.EnumMap;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class MonitoringService {

    private static final Logger LOG = Logger.getLogger(MonitoringService.class);

    private final MonitoringLifecycle lifecycle;
    private final MetricsBoard board;
    private final MonitoringScheduler scheduler;
    private final MonitoringPipeline pipeline;
    private final SyncService syncService;
    private final boolean autostart;

    public MonitoringService(
        MonitoringLifecycle lifecycle,
        MetricsBoard board,
        MonitoringScheduler scheduler,
        MonitoringPipeline pipeline,
        SyncService syncService,
        @ConfigProperty(name = "monitoring.autostart", defaultValue = "true") boolean autostart
    ) {
        this.lifecycle = lifecycle;
        this.board = board;
        this.scheduler = scheduler;
        this.pipeline = pipeline;
        this.syncService = syncService;
        this.autostart = autostart;
    }

    void onStart(@Observes StartupEvent event) {
        if (autostart) {
            start();
        } else {
            LOG.info("Autostart disabled, monitoring waits for an explicit start");
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    /** @return false when monitoring was already running */
    public synchronized boolean start() {
        if (lifecycle.isRunning()) {
            return false;
        }
        long epoch = lifecycle.begin();
        board.open(epoch);
        pipeline.resetPatterns();

        Map<PeriodicTask, Runnable> tasks = new EnumMap<>(PeriodicTask.class);
        tasks.put(PeriodicTask.VITAL_SIGNS, pipeline::vitalSignsPass);
        tasks.put(PeriodicTask.BIOMARKERS, pipeline::biomarkerPass);
        tasks.put(PeriodicTask.PATTERN_DETECTION, pipeline::patternPass);
        tasks.put(PeriodicTask.CLOUD_SYNC, () -> syncService.syncNow(SyncTrigger.SCHEDULED));
        scheduler.start(tasks, pipeline::retentionSweep);

        LOG.infof("Monitoring started (epoch %d)", epoch);
        return true;
    }

    /**
     * Cancels every timer and closes the current epoch. Work already running finishes, but its
     * results are not published. Queued store writes still complete.
     *
     * @return false when monitoring was not running
     */
    public synchronized boolean stop() {
        if (!lifecycle.isRunning()) {
            return false;
        }
        scheduler.stop();
        lifecycle.end();
        board.close();
        LOG.info("Monitoring stopped");
        return true;
    }

    public boolean isRunning() {
        return lifecycle.isRunning();
    }
}
