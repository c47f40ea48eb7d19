package com.example.monitoring.inference;

import com.example.monitoring.model.FeatureSet;

/**
 * Logistic myocardial-injury score from ST deviation, heart rate and rhythm irregularity, with
 * the level mapped onto a high-sensitivity troponin scale (ng/L). Used by the biomarker pass only.
 */
public class TroponinProxyModel implements ScoringModel<TroponinEstimate> {

    private static final double INTERCEPT = -4.0;
    private static final double ST_WEIGHT = 25.0;
    private static final double TACHY_WEIGHT = 0.04;
    private static final double IRREGULARITY_WEIGHT = 4.0;
    private static final double MAX_LEVEL = 100.0;

    @Override
    public ModelId id() {
        return ModelId.TROPONIN;
    }

    @Override
    public TroponinEstimate score(ModelInput input) {
        FeatureSet f = input.features();
        if (!f.hasRhythm()) {
            throw new InsufficientSignalException("no beats in biomarker window");
        }
        double z = INTERCEPT
            + ST_WEIGHT * Math.max(0, f.stDeviation())
            + TACHY_WEIGHT * Math.max(0, f.heartRate() - 100)
            + IRREGULARITY_WEIGHT * f.irregularity();
        double risk = 1.0 / (1.0 + Math.exp(-z));
        return new TroponinEstimate(risk * MAX_LEVEL, risk);
    }
}
