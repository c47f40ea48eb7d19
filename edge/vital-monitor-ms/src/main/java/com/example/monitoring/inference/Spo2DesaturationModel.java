package com.example.monitoring.inference;

import java.util.List;

public class Spo2DesaturationModel implements ScoringModel<Spo2Assessment> {

    static final int WINDOW = 5;

    @Override
    public ModelId id() {
        return ModelId.SPO2;
    }

    @Override
    public Spo2Assessment score(ModelInput input) {
        return assess(input.spo2Window());
    }

    public Spo2Assessment assess(List<Double> samples) {
        if (samples.size() < WINDOW) {
            double last = samples.isEmpty() ? Double.NaN : samples.get(samples.size() - 1);
            return new Spo2Assessment(Spo2AlertLevel.NONE, last, last);
        }
        List<Double> recent = samples.subList(samples.size() - WINDOW, samples.size());
        double sum = 0;
        double min = Double.MAX_VALUE;
        for (double v : recent) {
            sum += v;
            min = Math.min(min, v);
        }
        double mean = sum / WINDOW;

        Spo2AlertLevel level;
        if (min < 85) {
            level = Spo2AlertLevel.CRITICAL;
        } else if (mean < 92) {
            level = Spo2AlertLevel.WARNING;
        } else {
            level = Spo2AlertLevel.NONE;
        }
        return new Spo2Assessment(level, mean, min);
    }
}
