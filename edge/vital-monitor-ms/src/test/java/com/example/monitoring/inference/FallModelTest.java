package com.example.monitoring.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.monitoring.SyntheticSignals;
import com.example.monitoring.model.FeatureSet;
import com.example.monitoring.model.SensorPacket;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class FallModelTest {

    private final FallModel model = new FallModel(50);

    @Test
    void freeFallThenImpactIsAFall() {
        float[] accel = SyntheticSignals.restingAccel(100);
        setMagnitude(accel, 40, 0.1f);
        setMagnitude(accel, 41, 0.1f);
        setMagnitude(accel, 60, 3.2f);

        FallAssessment fall = score(accel);

        assertTrue(fall.detected());
        assertEquals(3.2, fall.peakG(), 1e-6);
    }

    @Test
    void impactTooLateIsNotAFall() {
        float[] accel = SyntheticSignals.restingAccel(200);
        setMagnitude(accel, 10, 0.1f);
        setMagnitude(accel, 150, 3.2f);

        assertFalse(score(accel).detected());
    }

    @Test
    void impactWithoutFreeFallIsNotAFall() {
        float[] accel = SyntheticSignals.restingAccel(100);
        setMagnitude(accel, 50, 4.0f);

        assertFalse(score(accel).detected());
    }

    @Test
    void restingIsNotAFall() {
        FallAssessment fall = score(SyntheticSignals.restingAccel(100));

        assertFalse(fall.detected());
        assertEquals(1.0, fall.peakG(), 1e-6);
    }

    private FallAssessment score(float[] accel) {
        SensorPacket packet = new SensorPacket(Instant.EPOCH, null, null, accel, null, null, 36.5f, 80f);
        return model.score(new ModelInput(FeatureSet.EMPTY, packet, List.of(), List.of()));
    }

    private static void setMagnitude(float[] accel, int sample, float g) {
        accel[3 * sample] = 0f;
        accel[3 * sample + 1] = 0f;
        accel[3 * sample + 2] = g;
    }
}
