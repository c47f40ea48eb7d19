package com.example.monitoring.inference;

import com.example.monitoring.model.FeatureSet;

/**
 * Flags an irregular rhythm when the RR coefficient of variation exceeds a calibrated threshold.
 * Confidence is 0.5 at the threshold and reaches 1.0 at twice the threshold.
 */
public class ArrhythmiaModel implements ScoringModel<ArrhythmiaAssessment> {

    public static final double DEFAULT_THRESHOLD = 0.15;
    static final int MIN_INTERVALS = 4;

    private final double threshold;

    public ArrhythmiaModel() {
        this(DEFAULT_THRESHOLD);
    }

    public ArrhythmiaModel(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public ModelId id() {
        return ModelId.ARRHYTHMIA;
    }

    @Override
    public ArrhythmiaAssessment score(ModelInput input) {
        FeatureSet f = input.features();
        if (f.rrIntervalCount() < MIN_INTERVALS) {
            return ArrhythmiaAssessment.none();
        }
        double irregularity = f.irregularity();
        if (irregularity <= threshold) {
            return new ArrhythmiaAssessment(false, 0.5 * irregularity / threshold, irregularity);
        }
        double confidence = Math.min(1.0, 0.5 + 0.5 * (irregularity - threshold) / threshold);
        return new ArrhythmiaAssessment(true, confidence, irregularity);
    }
}
