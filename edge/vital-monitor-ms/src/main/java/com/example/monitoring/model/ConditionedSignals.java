package com.example.monitoring.model;

/**
 * Filtered waveforms for a single processing task. Not shared, so the arrays are held as-is.
 */
public record ConditionedSignals(float[] ecg, double ecgSampleRate, float[] ppg, double ppgSampleRate) {

    public static ConditionedSignals empty(double ecgSampleRate, double ppgSampleRate) {
        return new ConditionedSignals(new float[0], ecgSampleRate, new float[0], ppgSampleRate);
    }
}
