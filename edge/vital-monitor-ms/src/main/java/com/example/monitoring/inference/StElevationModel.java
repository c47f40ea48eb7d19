package com.example.monitoring.inference;

public class StElevationModel implements ScoringModel<StElevationAssessment> {

    /** 1 mm on a standard 10 mm/mV trace. */
    public static final double DEFAULT_THRESHOLD_MV = 0.1;

    private final double thresholdMv;

    public StElevationModel() {
        this(DEFAULT_THRESHOLD_MV);
    }

    public StElevationModel(double thresholdMv) {
        this.thresholdMv = thresholdMv;
    }

    @Override
    public ModelId id() {
        return ModelId.ST_ELEVATION;
    }

    @Override
    public StElevationAssessment score(ModelInput input) {
        if (!input.features().hasRhythm()) {
            return new StElevationAssessment(false, 0.0);
        }
        double deviation = input.features().stDeviation();
        return new StElevationAssessment(deviation > thresholdMv, deviation);
    }
}
