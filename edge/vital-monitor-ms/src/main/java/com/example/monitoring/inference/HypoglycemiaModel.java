package com.example.monitoring.inference;

import java.util.List;

/**
 * Risk from the latest value and the short-term trend of the last three readings (mg/dL).
 */
public class HypoglycemiaModel implements ScoringModel<HypoglycemiaAssessment> {

    static final int WINDOW = 3;

    @Override
    public ModelId id() {
        return ModelId.HYPOGLYCEMIA;
    }

    @Override
    public HypoglycemiaAssessment score(ModelInput input) {
        return assess(input.glucoseHistory());
    }

    public HypoglycemiaAssessment assess(List<Double> readings) {
        if (readings.isEmpty()) {
            return new HypoglycemiaAssessment(HypoglycemiaRisk.LOW, Double.NaN, 0, 0);
        }
        double current = readings.get(readings.size() - 1);
        if (readings.size() < WINDOW) {
            HypoglycemiaRisk risk = current < 70 ? HypoglycemiaRisk.CRITICAL : HypoglycemiaRisk.LOW;
            return new HypoglycemiaAssessment(risk, current, 0, 0);
        }

        List<Double> recent = readings.subList(readings.size() - WINDOW, readings.size());
        double trend = recent.get(WINDOW - 1) - recent.get(0);
        double rate = 0;
        for (int i = 1; i < WINDOW; i++) {
            rate += recent.get(i) - recent.get(i - 1);
        }
        rate /= WINDOW - 1;

        return new HypoglycemiaAssessment(classify(current, trend, rate), current, trend, rate);
    }

    static HypoglycemiaRisk classify(double current, double trend, double rate) {
        if (current < 70 || (trend <= -10 && rate <= -5)) return HypoglycemiaRisk.CRITICAL;
        if (current < 90 || (trend <= -5 && rate <= -2)) return HypoglycemiaRisk.HIGH;
        if (trend <= -2) return HypoglycemiaRisk.MODERATE;
        return HypoglycemiaRisk.LOW;
    }
}
