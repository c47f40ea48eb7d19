package com.example.monitoring.web;

import com.example.monitoring.alerts.AlertEngine;
import com.example.monitoring.inference.LatencyTracker;
import com.example.monitoring.model.CriticalAlert;
import com.example.monitoring.model.HealthMetricsSnapshot;
import com.example.monitoring.pipeline.MetricsBoard;
import com.example.monitoring.pipeline.MonitoringPipeline;
import com.example.monitoring.pipeline.MonitoringService;
import com.example.monitoring.schedule.Cadence;
import com.example.monitoring.schedule.CadencePolicy;
import com.example.monitoring.schedule.MonitoringScheduler;
import com.example.monitoring.schedule.PeriodicTask;
import com.example.monitoring.store.OfflineStore;
import com.example.monitoring.store.StorageWriter;
import com.example.monitoring.sync.SyncOutcome;
import com.example.monitoring.sync.SyncService;
import com.example.monitoring.sync.SyncTrigger;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jboss.logging.Logger;

@Path("/monitoring")
@Produces(MediaType.APPLICATION_JSON)
public class MonitoringResource {

    private static final Logger LOG = Logger.getLogger(MonitoringResource.class);

    private final MetricsBoard board;
    private final AlertEngine alertEngine;
    private final MonitoringService monitoringService;
    private final MonitoringPipeline pipeline;
    private final MonitoringScheduler scheduler;
    private final CadencePolicy cadencePolicy;
    private final LatencyTracker latencyTracker;
    private final OfflineStore store;
    private final StorageWriter writer;
    private final SyncService syncService;

    public MonitoringResource(
        MetricsBoard board,
        AlertEngine alertEngine,
        MonitoringService monitoringService,
        MonitoringPipeline pipeline,
        MonitoringScheduler scheduler,
        CadencePolicy cadencePolicy,
        LatencyTracker latencyTracker,
        OfflineStore store,
        StorageWriter writer,
        SyncService syncService
    ) {
        this.board = board;
        this.alertEngine = alertEngine;
        this.monitoringService = monitoringService;
        this.pipeline = pipeline;
        this.scheduler = scheduler;
        this.cadencePolicy = cadencePolicy;
        this.latencyTracker = latencyTracker;
        this.store = store;
        this.writer = writer;
        this.syncService = syncService;
    }

    @GET
    @Path("/metrics")
    public HealthMetricsSnapshot metrics() {
        return board.current();
    }

    @GET
    @Path("/alerts")
    public List<CriticalAlert> alerts() {
        return alertEngine.activeAlerts();
    }

    @POST
    @Path("/alerts/{id}/ack")
    public void acknowledge(@PathParam("id") String id) {
        UUID alertId;
        try {
            alertId = UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Not an alert id: " + id);
        }
        if (!alertEngine.acknowledge(alertId)) {
            throw new NotFoundException("No active alert " + id);
        }
        pipeline.refreshRiskLevel();
    }

    @GET
    @Path("/status")
    public MonitoringStatus status() {
        Cadence cadence = scheduler.currentCadence();
        Map<PeriodicTask, Long> intervals = new EnumMap<>(PeriodicTask.class);
        for (PeriodicTask task : PeriodicTask.values()) {
            intervals.put(task, cadence.intervalFor(task).toSeconds());
        }
        double battery = scheduler.batteryPct();
        return new MonitoringStatus(
            monitoringService.isRunning(),
            battery,
            cadencePolicy.bandFor(battery),
            scheduler.riskLevel(),
            intervals,
            latencyTracker.snapshot(),
            pipeline.framesProcessed(),
            pipeline.framesRejected(),
            syncService.isOnline(),
            writer.isDegraded(),
            writer.queuedWrites(),
            store.countUnsynced(),
            store.countQuarantined(),
            store.totalSizeBytes()
        );
    }

    @POST
    @Path("/start")
    public MonitoringStatus start() {
        monitoringService.start();
        return status();
    }

    @POST
    @Path("/stop")
    public MonitoringStatus stop() {
        monitoringService.stop();
        return status();
    }

    @POST
    @Path("/battery/{pct}")
    public void battery(@PathParam("pct") double pct) {
        if (Double.isNaN(pct) || pct < 0 || pct > 100) {
            throw new BadRequestException("Battery level must be between 0 and 100");
        }
        LOG.debugf("Battery level reported: %.1f%%", pct);
        scheduler.updateBattery(pct);
    }

    @POST
    @Path("/connectivity/{online}")
    public void connectivity(@PathParam("online") boolean online) {
        syncService.connectivityChanged(online);
    }

    @POST
    @Path("/sync")
    public SyncOutcome sync() {
        return syncService.syncNow(SyncTrigger.MANUAL);
    }
}
