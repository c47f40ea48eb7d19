package com.example.monitoring.inference;

import com.example.monitoring.model.FeatureSet;

final class Features {

    private Features() {}

    static FeatureSet rhythm(double heartRate, double irregularity, int beats) {
        return of(heartRate, irregularity, beats, 0.0, 0.0);
    }

    static FeatureSet of(double heartRate, double irregularity, int beats, double stMv, double pttMs) {
        double meanRr = 60.0 / heartRate;
        return new FeatureSet(
            meanRr,
            irregularity * meanRr,
            0.05,
            0,
            0,
            0,
            0,
            0,
            heartRate,
            irregularity,
            stMv,
            pttMs,
            0,
            beats
        );
    }
}
