package com.example.monitoring.inference;

import com.example.monitoring.model.SensorPacket;

/**
 * Free-fall followed by an impact within one second. Accelerometer samples are xyz triples in g.
 */
public class FallModel implements ScoringModel<FallAssessment> {

    static final double FREE_FALL_G = 0.35;
    static final double IMPACT_G = 2.5;

    private final int impactWindowSamples;

    public FallModel() {
        this(50);
    }

    /** @param accelSampleRate triples per second */
    public FallModel(int accelSampleRate) {
        this.impactWindowSamples = accelSampleRate;
    }

    @Override
    public ModelId id() {
        return ModelId.FALL;
    }

    @Override
    public FallAssessment score(ModelInput input) {
        float[] accel = input.packet().map(SensorPacket::accel).orElse(new float[0]);
        int samples = accel.length / 3;
        double peak = 0;
        int freeFallAt = -1;
        boolean detected = false;
        for (int i = 0; i < samples; i++) {
            double g = Math.sqrt(
                accel[3 * i] * accel[3 * i] + accel[3 * i + 1] * accel[3 * i + 1] + accel[3 * i + 2] * accel[3 * i + 2]
            );
            peak = Math.max(peak, g);
            if (g < FREE_FALL_G) {
                freeFallAt = i;
            } else if (g > IMPACT_G && freeFallAt >= 0 && i - freeFallAt <= impactWindowSamples) {
                detected = true;
            }
        }
        return new FallAssessment(detected, peak);
    }
}
