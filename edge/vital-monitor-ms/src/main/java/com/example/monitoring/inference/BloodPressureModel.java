package com.example.monitoring.inference;

/**
 * Cuffless estimate from pulse transit time with a per-population linear calibration.
 * Shorter transit means stiffer, more pressurised arteries.
 */
public class BloodPressureModel implements ScoringModel<BloodPressureEstimate> {

    private static final double SYSTOLIC_INTERCEPT = 196.0;
    private static final double SYSTOLIC_SLOPE = 0.32;
    private static final double DIASTOLIC_INTERCEPT = 124.0;
    private static final double DIASTOLIC_SLOPE = 0.20;

    @Override
    public ModelId id() {
        return ModelId.BLOOD_PRESSURE;
    }

    @Override
    public BloodPressureEstimate score(ModelInput input) {
        double ptt = input.features().pulseTransitTimeMs();
        if (ptt <= 0) {
            throw new InsufficientSignalException("no R-peak to PPG pairing in window");
        }
        int systolic = (int) Math.round(SYSTOLIC_INTERCEPT - SYSTOLIC_SLOPE * ptt);
        int diastolic = (int) Math.round(DIASTOLIC_INTERCEPT - DIASTOLIC_SLOPE * ptt);
        return new BloodPressureEstimate(systolic, diastolic, HypertensionStage.classify(systolic, diastolic));
    }
}
