package com.example.monitoring.inference;

public record BloodPressureEstimate(int systolic, int diastolic, HypertensionStage stage) {

    public int meanArterialPressure() {
        return (systolic + 2 * diastolic) / 3;
    }
}
