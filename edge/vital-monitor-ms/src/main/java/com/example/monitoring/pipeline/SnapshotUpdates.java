package com.example.monitoring.pipeline;

import com.example.monitoring.inference.ArrhythmiaAssessment;
import com.example.monitoring.inference.BloodPressureEstimate;
import com.example.monitoring.inference.HypoglycemiaAssessment;
import com.example.monitoring.inference.InferenceResult;
import com.example.monitoring.inference.ModelId;
import com.example.monitoring.inference.Spo2Assessment;
import com.example.monitoring.inference.StElevationAssessment;
import com.example.monitoring.inference.TroponinEstimate;
import com.example.monitoring.model.FeatureSet;
import com.example.monitoring.model.HealthMetricsSnapshot;
import com.example.monitoring.model.SensorPacket;

/**
 * Folds pass output into a snapshot. Fields for models that were unavailable keep their previous value.
 */
final class SnapshotUpdates {

    private SnapshotUpdates() {}

    static HealthMetricsSnapshot apply(
        HealthMetricsSnapshot previous,
        FeatureSet features,
        InferenceResult result,
        SensorPacket packet
    ) {
        HealthMetricsSnapshot.Builder b = previous.toBuilder();
        if (features != null && features.hasRhythm()) {
            b.heartRate((int) Math.round(features.heartRate()));
            b.hrvMs((int) Math.round(features.rmssd() * 1000));
            if (features.respiratoryRate() > 0) {
                b.respiratoryRate((int) Math.round(features.respiratoryRate()));
            }
        }
        if (packet != null) {
            b.temperature(packet.temperature());
            b.batteryPct(packet.batteryPct());
        }
        for (ModelId id : result.available()) {
            applyModel(b, id, result);
        }
        return b.lastLatencyMs(result.latency().toMillis()).updatedAt(result.completedAt()).build();
    }

    /** A single late value; latency and timestamp stay with the pass that published them. */
    static HealthMetricsSnapshot applyLate(HealthMetricsSnapshot previous, ModelId id, Object value) {
        HealthMetricsSnapshot.Builder b = previous.toBuilder();
        applyModel(b, id, InferenceResult.builder().put(id, value).build());
        return b.build();
    }

    private static void applyModel(HealthMetricsSnapshot.Builder b, ModelId id, InferenceResult r) {
        switch (id) {
            case ARRHYTHMIA -> {
                ArrhythmiaAssessment a = r.arrhythmia().orElseThrow();
                b.arrhythmia(a.detected(), a.confidence());
            }
            case ST_ELEVATION -> {
                StElevationAssessment s = r.stElevation().orElseThrow();
                b.stElevationDetected(s.detected());
            }
            case BLOOD_PRESSURE -> {
                BloodPressureEstimate bp = r.bloodPressure().orElseThrow();
                b.bloodPressure(bp.systolic(), bp.diastolic(), bp.meanArterialPressure(), bp.stage());
            }
            case HYPOGLYCEMIA -> {
                HypoglycemiaAssessment h = r.hypoglycemia().orElseThrow();
                if (!Double.isNaN(h.currentMgDl())) {
                    b.glucose(h.currentMgDl(), h.trend(), h.risk());
                }
            }
            case SPO2 -> {
                Spo2Assessment s = r.spo2().orElseThrow();
                if (!Double.isNaN(s.mean())) {
                    b.spo2(s.mean(), s.level());
                }
            }
            case TROPONIN -> {
                TroponinEstimate t = r.troponin().orElseThrow();
                b.troponin(t.level(), t.miRisk());
            }
            case FALL -> {
                // alert only; nothing tracked on the snapshot
            }
        }
    }
}
