package com.example.monitoring.model;

/**
 * Time and frequency domain descriptors of one conditioned window.
 *
 * <p>RR statistics are in seconds, ST deviation in mV, pulse transit time in ms.
 * {@link #EMPTY} stands for "not enough beats", which is a normal low-confidence outcome.
 */
public record FeatureSet(
    double meanRr,
    double sdnn,
    double rmssd,
    double lfPower,
    double hfPower,
    double lfHfRatio,
    double sampleEntropy,
    double complexity,
    double heartRate,
    double irregularity,
    double stDeviation,
    double pulseTransitTimeMs,
    double respiratoryRate,
    int beatCount
) {

    public static final FeatureSet EMPTY = new FeatureSet(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public boolean hasRhythm() {
        return beatCount >= 2 && meanRr > 0;
    }

    public int rrIntervalCount() {
        return Math.max(0, beatCount - 1);
    }
}
