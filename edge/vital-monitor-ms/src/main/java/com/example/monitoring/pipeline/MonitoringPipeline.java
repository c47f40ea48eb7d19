package com.example.monitoring.pipeline;

import com.example.monitoring.alerts.AlertDispatcher;
import com.example.monitoring.alerts.AlertEngine;
import com.example.monitoring.alerts.PatternDetector;
import com.example.monitoring.codec.DecodeException;
import com.example.monitoring.codec.PacketCodec;
import com.example.monitoring.config.WorkerPool;
import com.example.monitoring.dsp.SignalConditioner;
import com.example.monitoring.features.FeatureExtractor;
import com.example.monitoring.inference.InferenceOrchestrator;
import com.example.monitoring.inference.InferenceResult;
import com.example.monitoring.inference.ModelId;
import com.example.monitoring.inference.ModelInput;
import com.example.monitoring.model.ConditionedSignals;
import com.example.monitoring.model.CriticalAlert;
import com.example.monitoring.model.FeatureSet;
import com.example.monitoring.model.HealthMetricsSnapshot;
import com.example.monitoring.model.RiskLevel;
import com.example.monitoring.model.SensorPacket;
import com.example.monitoring.schedule.MonitoringScheduler;
import com.example.monitoring.store.BiomarkerReading;
import com.example.monitoring.store.EcgWaveform;
import com.example.monitoring.store.EdgePrediction;
import com.example.monitoring.store.OfflineStore;
import com.example.monitoring.store.Priority;
import com.example.monitoring.store.RecordType;
import com.example.monitoring.store.StorageWriter;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Packet path and periodic passes. Every unit of work captures the lifecycle epoch when it starts
 * and re-checks it between stages; once monitoring stops, in-flight results are dropped instead of
 * reaching the snapshot, the alert list or the store.
 */
@ApplicationScoped
public class MonitoringPipeline {

    static final Set<ModelId> VITAL_SIGN_MODELS = EnumSet.of(
        ModelId.ARRHYTHMIA,
        ModelId.ST_ELEVATION,
        ModelId.BLOOD_PRESSURE,
        ModelId.SPO2
    );
    static final Set<ModelId> BIOMARKER_MODELS = EnumSet.of(ModelId.HYPOGLYCEMIA, ModelId.TROPONIN);

    private static final Logger LOG = Logger.getLogger(MonitoringPipeline.class);

    private final PacketCodec codec;
    private final SignalConditioner conditioner;
    private final FeatureExtractor extractor;
    private final InferenceOrchestrator orchestrator;
    private final AlertEngine alertEngine;
    private final AlertDispatcher dispatcher;
    private final PatternDetector patternDetector;
    private final MetricsBoard board;
    private final SignalHistory history;
    private final MonitoringLifecycle lifecycle;
    private final MonitoringScheduler scheduler;
    private final StorageWriter writer;
    private final OfflineStore store;
    private final WorkerPool pool;
    private final Clock clock;
    private final Duration retention;

    private final AtomicLong framesProcessed = new AtomicLong();
    private final AtomicLong framesRejected = new AtomicLong();
    private final AtomicLong framesDiscarded = new AtomicLong();

    public MonitoringPipeline(
        PacketCodec codec,
        SignalConditioner conditioner,
        FeatureExtractor extractor,
        InferenceOrchestrator orchestrator,
        AlertEngine alertEngine,
        AlertDispatcher dispatcher,
        PatternDetector patternDetector,
        MetricsBoard board,
        SignalHistory history,
        MonitoringLifecycle lifecycle,
        MonitoringScheduler scheduler,
        StorageWriter writer,
        OfflineStore store,
        WorkerPool pool,
        Clock clock,
        @ConfigProperty(name = "monitoring.store.retention-hours", defaultValue = "72") int retentionHours
    ) {
        this.codec = codec;
        this.conditioner = conditioner;
        this.extractor = extractor;
        this.orchestrator = orchestrator;
        this.alertEngine = alertEngine;
        this.dispatcher = dispatcher;
        this.patternDetector = patternDetector;
        this.board = board;
        this.history = history;
        this.lifecycle = lifecycle;
        this.scheduler = scheduler;
        this.writer = writer;
        this.store = store;
        this.pool = pool;
        this.clock = clock;
        this.retention = Duration.ofHours(retentionHours);
    }

    /** Stamps arrival and hands the frame to the worker pool. Never throws. */
    public void submit(byte[] frame) {
        Instant arrivedAt = clock.instant();
        long epoch = lifecycle.currentEpoch();
        if (!lifecycle.isCurrent(epoch)) {
            framesDiscarded.incrementAndGet();
            LOG.debug("Monitoring stopped, frame dropped");
            return;
        }
        long seq = board.nextSequence(MetricStream.PACKET);
        pool.execute(() -> {
            try {
                processFrame(frame, arrivedAt, seq, epoch);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Processing frame %d failed", seq);
            }
        });
    }

    void processFrame(byte[] frame, Instant arrivedAt, long seq, long epoch) {
        SensorPacket packet;
        try {
            packet = codec.decode(frame);
        } catch (DecodeException e) {
            framesRejected.incrementAndGet();
            return;
        }
        scheduler.updateBattery(packet.batteryPct());
        history.append(packet);
        if (!lifecycle.isCurrent(epoch)) {
            framesDiscarded.incrementAndGet();
            return;
        }

        ConditionedSignals signals = conditioner.condition(packet.ecg(), packet.ppg());
        FeatureSet features = extractor.extract(signals);
        if (!lifecycle.isCurrent(epoch)) {
            framesDiscarded.incrementAndGet();
            return;
        }

        // glucose and SpO2 models score the rolling windows this packet was just appended to
        ModelInput input = new ModelInput(features, packet, history.glucose(), history.spo2());
        InferenceResult result = orchestrator.infer(
            input,
            arrivedAt,
            InferenceOrchestrator.PACKET_MODELS,
            (id, value, latency) -> onLateResult(MetricStream.PACKET, seq, epoch, id, value, latency)
        );
        publish(MetricStream.PACKET, seq, epoch, features, result, packet);
        if (!lifecycle.isCurrent(epoch)) {
            framesDiscarded.incrementAndGet();
            return;
        }
        framesProcessed.incrementAndGet();
        writer.write(RecordType.EDGE_PREDICTION, prediction(result), Priority.LOW);

        result.arrhythmia().filter(a -> a.detected()).ifPresent(a ->
            writer.write(
                RecordType.ECG_WAVEFORM,
                new EcgWaveform(packet.capturedAt(), conditioner.ecgSampleRate(), packet.ecg(), a.confidence()),
                Priority.HIGH
            )
        );
    }

    public void vitalSignsPass() {
        long epoch = lifecycle.currentEpoch();
        if (!lifecycle.isCurrent(epoch)) return;
        Instant startedAt = clock.instant();
        float[] ecg = history.ecgWindow();
        if (ecg.length == 0) {
            LOG.debug("Vital-signs pass skipped, no waveform yet");
            return;
        }
        long seq = board.nextSequence(MetricStream.VITAL_SIGNS);
        FeatureSet features = extractor.extract(conditioner.condition(ecg, history.ppgWindow()));
        ModelInput input = new ModelInput(features, null, history.glucose(), history.spo2());
        InferenceResult result = orchestrator.infer(
            input,
            startedAt,
            VITAL_SIGN_MODELS,
            (id, value, latency) -> onLateResult(MetricStream.VITAL_SIGNS, seq, epoch, id, value, latency)
        );
        if (publish(MetricStream.VITAL_SIGNS, seq, epoch, features, result, null)) {
            writer.write(RecordType.VITAL_SIGNS, board.current(), Priority.NORMAL);
        }
    }

    public void biomarkerPass() {
        long epoch = lifecycle.currentEpoch();
        if (!lifecycle.isCurrent(epoch)) return;
        Instant startedAt = clock.instant();
        long seq = board.nextSequence(MetricStream.BIOMARKERS);
        float[] ecg = history.ecgWindow();
        FeatureSet features = ecg.length == 0
            ? FeatureSet.EMPTY
            : extractor.extract(conditioner.condition(ecg, history.ppgWindow()));
        ModelInput input = new ModelInput(features, null, history.glucose(), history.spo2());
        InferenceResult result = orchestrator.infer(
            input,
            startedAt,
            BIOMARKER_MODELS,
            (id, value, latency) -> onLateResult(MetricStream.BIOMARKERS, seq, epoch, id, value, latency)
        );
        // heart rate and HRV belong to the vital-signs pass
        if (publish(MetricStream.BIOMARKERS, seq, epoch, null, result, null)) {
            HealthMetricsSnapshot s = board.current();
            writer.write(
                RecordType.BIOMARKERS,
                new BiomarkerReading(
                    result.completedAt(),
                    s.glucoseMgDl,
                    s.glucoseTrend,
                    s.hypoglycemiaRisk,
                    s.troponinLevel,
                    s.cardiacRiskScore
                ),
                Priority.NORMAL
            );
        }
    }

    public void patternPass() {
        long epoch = lifecycle.currentEpoch();
        if (!lifecycle.isCurrent(epoch)) return;
        patternDetector.observe(board.current(), clock.instant())
            .filter(alert -> lifecycle.isCurrent(epoch))
            .flatMap(alertEngine::raise)
            .ifPresent(alert -> dispatcher.dispatch(List.of(alert)));
        refreshRiskLevel();
    }

    /** A sustained run never spans a stop and restart. */
    public void resetPatterns() {
        patternDetector.reset();
    }

    /** Retention, size cap and expiry of alerts that have aged out with their records. */
    public void retentionSweep() {
        Instant now = clock.instant();
        store.sweepExpired(now);
        store.enforceSizeCap();
        int expired = alertEngine.expireBefore(now.minus(retention));
        if (expired > 0) {
            LOG.infof("Expired %d alerts older than %d hours", expired, retention.toHours());
            refreshRiskLevel();
        }
    }

    /**
     * Commits the pass to the snapshot, then raises and dispatches its alerts. Alerts are raised
     * even when a newer pass of the same stream already committed, since a detection in older
     * data is still a detection.
     *
     * @return whether the snapshot took this pass
     */
    private boolean publish(
        MetricStream stream,
        long seq,
        long epoch,
        FeatureSet features,
        InferenceResult result,
        SensorPacket packet
    ) {
        if (!lifecycle.isCurrent(epoch)) {
            LOG.debugf("Dropping %s result %d from a stopped run", stream, seq);
            return false;
        }
        boolean committed = board.commit(
            stream,
            seq,
            epoch,
            previous -> SnapshotUpdates.apply(previous, features, result, packet)
        );
        if (!committed) {
            LOG.debugf("%s result %d superseded by a newer one", stream, seq);
        }
        raiseAlerts(result, epoch);
        return committed;
    }

    private void onLateResult(
        MetricStream stream,
        long seq,
        long epoch,
        ModelId id,
        Object value,
        Duration latency
    ) {
        try {
            boolean merged = board.commitLate(
                stream,
                seq,
                epoch,
                previous -> SnapshotUpdates.applyLate(previous, id, value)
            );
            if (!merged) {
                LOG.debugf("Late %s value from %s pass %d dropped", id, stream, seq);
                return;
            }
            InferenceResult late = InferenceResult.late(id, value, clock.instant(), latency);
            raiseAlerts(late, epoch);
            writer.write(RecordType.EDGE_PREDICTION, prediction(late, true), Priority.LOW);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Handling late %s value failed", id);
        }
    }

    void raiseAlerts(InferenceResult result, long epoch) {
        if (!lifecycle.isCurrent(epoch)) {
            return;
        }
        List<CriticalAlert> raised = alertEngine.evaluate(result);
        if (!raised.isEmpty()) {
            dispatcher.dispatch(raised);
        }
        refreshRiskLevel();
    }

    /** Re-derives the risk level from the active alerts and pushes it to the snapshot and scheduler. */
    public void refreshRiskLevel() {
        RiskLevel level = alertEngine.currentRiskLevel();
        board.updateRiskLevel(level);
        scheduler.updateRisk(level);
    }

    private static EdgePrediction prediction(InferenceResult result) {
        return prediction(result, false);
    }

    private static EdgePrediction prediction(InferenceResult result, boolean late) {
        return new EdgePrediction(
            result.completedAt(),
            result.values(),
            Set.copyOf(result.unavailable()),
            result.latency().toMillis(),
            late
        );
    }

    public long framesProcessed() {
        return framesProcessed.get();
    }

    public long framesRejected() {
        return framesRejected.get();
    }

    public long framesDiscarded() {
        return framesDiscarded.get();
    }
}
