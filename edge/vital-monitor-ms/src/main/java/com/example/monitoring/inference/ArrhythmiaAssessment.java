package com.example.monitoring.inference;

public record ArrhythmiaAssessment(boolean detected, double confidence, double irregularity) {

    public static ArrhythmiaAssessment none() {
        return new ArrhythmiaAssessment(false, 0.0, 0.0);
    }
}
