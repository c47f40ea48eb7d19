package com.example.monitoring.alerts;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.monitoring.MutableClock;
import com.example.monitoring.inference.ArrhythmiaAssessment;
import com.example.monitoring.inference.BloodPressureEstimate;
import com.example.monitoring.inference.FallAssessment;
import com.example.monitoring.inference.HypertensionStage;
import com.example.monitoring.inference.HypoglycemiaAssessment;
import com.example.monitoring.inference.HypoglycemiaRisk;
import com.example.monitoring.inference.InferenceResult;
import com.example.monitoring.inference.ModelId;
import com.example.monitoring.inference.Spo2AlertLevel;
import com.example.monitoring.inference.Spo2Assessment;
import com.example.monitoring.inference.StElevationAssessment;
import com.example.monitoring.inference.TroponinEstimate;
import com.example.monitoring.model.AlertSeverity;
import com.example.monitoring.model.AlertType;
import com.example.monitoring.model.CriticalAlert;
import com.example.monitoring.model.RiskLevel;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AlertEngineTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private final AlertEngine engine = new AlertEngine(clock, Duration.ofMinutes(2));

    @Test
    void confidentArrhythmiaIsAnEscalatedEmergency() {
        List<CriticalAlert> raised = engine.evaluate(result(ModelId.ARRHYTHMIA, new ArrhythmiaAssessment(true, 0.95, 0.3)));

        assertEquals(1, raised.size());
        CriticalAlert alert = raised.get(0);
        assertEquals(AlertType.CARDIAC, alert.type());
        assertEquals(AlertSeverity.EMERGENCY, alert.severity());
        assertTrue(alert.autoEscalate());
        assertTrue(alert.actionRequired());
    }

    @Test
    void lessConfidentArrhythmiaIsUrgentWithoutEscalation() {
        CriticalAlert alert = engine.evaluate(result(ModelId.ARRHYTHMIA, new ArrhythmiaAssessment(true, 0.7, 0.2))).get(0);

        assertEquals(AlertSeverity.URGENT, alert.severity());
        assertFalse(alert.autoEscalate());
    }

    @Test
    void repeatWithinCooldownIsSuppressed() {
        InferenceResult r = result(ModelId.ARRHYTHMIA, new ArrhythmiaAssessment(true, 0.95, 0.3));

        assertEquals(1, engine.evaluate(r).size());
        clock.advance(Duration.ofSeconds(30));
        assertEquals(0, engine.evaluate(r).size());

        assertEquals(1, engine.activeAlerts().size());
    }

    @Test
    void repeatAfterCooldownIsRaisedAgain() {
        InferenceResult r = result(ModelId.ARRHYTHMIA, new ArrhythmiaAssessment(true, 0.95, 0.3));

        engine.evaluate(r);
        clock.advance(Duration.ofMinutes(3));

        assertEquals(1, engine.evaluate(r).size());
        assertEquals(2, engine.activeAlerts().size());
    }

    @Test
    void acknowledgedAlertNoLongerSuppresses() {
        InferenceResult r = result(ModelId.ARRHYTHMIA, new ArrhythmiaAssessment(true, 0.95, 0.3));
        CriticalAlert first = engine.evaluate(r).get(0);

        assertTrue(engine.acknowledge(first.id()));
        assertFalse(engine.acknowledge(first.id()));
        assertFalse(engine.acknowledge(UUID.randomUUID()));

        assertEquals(1, engine.evaluate(r).size());
    }

    @Test
    void differentSeverityIsNotADuplicate() {
        engine.evaluate(result(ModelId.ARRHYTHMIA, new ArrhythmiaAssessment(true, 0.95, 0.3)));

        List<CriticalAlert> raised = engine.evaluate(result(ModelId.ARRHYTHMIA, new ArrhythmiaAssessment(true, 0.6, 0.18)));

        assertEquals(1, raised.size());
        assertEquals(AlertSeverity.URGENT, raised.get(0).severity());
    }

    @Test
    void stElevationIsCritical() {
        CriticalAlert alert = engine.evaluate(result(ModelId.ST_ELEVATION, new StElevationAssessment(true, 0.2))).get(0);

        assertEquals(AlertSeverity.CRITICAL, alert.severity());
        assertTrue(alert.autoEscalate());
    }

    @Test
    void bloodPressureStages() {
        assertEquals(
            AlertSeverity.CRITICAL,
            engine.evaluate(result(ModelId.BLOOD_PRESSURE, new BloodPressureEstimate(185, 125, HypertensionStage.CRISIS)))
                .get(0)
                .severity()
        );
        assertEquals(
            AlertSeverity.WARNING,
            engine.evaluate(result(ModelId.BLOOD_PRESSURE, new BloodPressureEstimate(145, 92, HypertensionStage.STAGE_2)))
                .get(0)
                .severity()
        );
        assertTrue(
            engine.evaluate(result(ModelId.BLOOD_PRESSURE, new BloodPressureEstimate(132, 84, HypertensionStage.STAGE_1)))
                .isEmpty()
        );
    }

    @Test
    void hypoglycemiaGrades() {
        assertEquals(AlertSeverity.EMERGENCY, glucoseAlert(HypoglycemiaRisk.CRITICAL).severity());
        assertEquals(AlertSeverity.URGENT, glucoseAlert(HypoglycemiaRisk.HIGH).severity());
        assertEquals(AlertSeverity.WARNING, glucoseAlert(HypoglycemiaRisk.MODERATE).severity());
        assertTrue(engine.evaluate(result(ModelId.HYPOGLYCEMIA, hypo(HypoglycemiaRisk.LOW))).isEmpty());
    }

    @Test
    void spo2Grades() {
        CriticalAlert critical = engine.evaluate(
            result(ModelId.SPO2, new Spo2Assessment(Spo2AlertLevel.CRITICAL, 90, 83))
        ).get(0);
        CriticalAlert warning = engine.evaluate(
            result(ModelId.SPO2, new Spo2Assessment(Spo2AlertLevel.WARNING, 91, 89))
        ).get(0);

        assertEquals(AlertType.RESPIRATORY, critical.type());
        assertEquals(AlertSeverity.CRITICAL, critical.severity());
        assertTrue(critical.autoEscalate());
        assertEquals(AlertSeverity.WARNING, warning.severity());
        assertFalse(warning.autoEscalate());
    }

    @Test
    void fallAndMyocardialRisk() {
        CriticalAlert fall = engine.evaluate(result(ModelId.FALL, new FallAssessment(true, 3.1))).get(0);
        CriticalAlert mi = engine.evaluate(result(ModelId.TROPONIN, new TroponinEstimate(80, 0.8))).get(0);

        assertEquals(AlertType.FALL, fall.type());
        assertEquals(AlertSeverity.URGENT, fall.severity());
        assertTrue(fall.autoEscalate());
        assertEquals(AlertSeverity.EMERGENCY, mi.severity());
        assertTrue(engine.evaluate(result(ModelId.TROPONIN, new TroponinEstimate(20, 0.2))).isEmpty());
    }

    @Test
    void unavailableModelsRaiseNothing() {
        InferenceResult r = InferenceResult.builder().unavailable(ModelId.ARRHYTHMIA).completedAt(clock.instant()).build();

        assertTrue(engine.evaluate(r).isEmpty());
    }

    @Test
    void riskLevelFollowsWorstActiveAlert() {
        assertEquals(RiskLevel.NORMAL, engine.currentRiskLevel());

        glucoseAlert(HypoglycemiaRisk.MODERATE);
        assertEquals(RiskLevel.ELEVATED, engine.currentRiskLevel());

        CriticalAlert st = engine.evaluate(result(ModelId.ST_ELEVATION, new StElevationAssessment(true, 0.2))).get(0);
        assertEquals(RiskLevel.CRITICAL, engine.currentRiskLevel());

        engine.acknowledge(st.id());
        assertEquals(RiskLevel.ELEVATED, engine.currentRiskLevel());
    }

    @Test
    void expireDropsOldAlerts() {
        glucoseAlert(HypoglycemiaRisk.MODERATE);
        clock.advance(Duration.ofHours(1));
        glucoseAlert(HypoglycemiaRisk.HIGH);

        assertEquals(1, engine.expireBefore(clock.instant().minusSeconds(60)));
        assertEquals(AlertSeverity.URGENT, engine.activeAlerts().get(0).severity());
    }

    private CriticalAlert glucoseAlert(HypoglycemiaRisk risk) {
        return engine.evaluate(result(ModelId.HYPOGLYCEMIA, hypo(risk))).get(0);
    }

    private static HypoglycemiaAssessment hypo(HypoglycemiaRisk risk) {
        return new HypoglycemiaAssessment(risk, 85, -8, -4);
    }

    private InferenceResult result(ModelId id, Object value) {
        return InferenceResult.builder().put(id, value).completedAt(clock.instant()).build();
    }
}
