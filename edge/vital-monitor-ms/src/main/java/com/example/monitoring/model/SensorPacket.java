package com.example.monitoring.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One decoded transport frame. Arrays are copied on the way in and on the way out,
 * so a packet can be handed across threads without further care.
 */
public final class SensorPacket {

    private final Instant capturedAt;
    private final float[] ecg;
    private final float[] ppg;
    private final float[] accel;
    private final float[] spo2;
    private final float[] glucose;
    private final float temperature;
    private final float batteryPct;

    public SensorPacket(
        Instant capturedAt,
        float[] ecg,
        float[] ppg,
        float[] accel,
        float[] spo2,
        float[] glucose,
        float temperature,
        float batteryPct
    ) {
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt");
        this.ecg = copy(ecg);
        this.ppg = copy(ppg);
        this.accel = copy(accel);
        this.spo2 = copy(spo2);
        this.glucose = copy(glucose);
        this.temperature = temperature;
        this.batteryPct = batteryPct;
    }

    private static float[] copy(float[] in) {
        return in == null ? new float[0] : in.clone();
    }

    public Instant capturedAt() {
        return capturedAt;
    }

    public float[] ecg() {
        return ecg.clone();
    }

    public float[] ppg() {
        return ppg.clone();
    }

    /** Interleaved x, y, z samples in g. */
    public float[] accel() {
        return accel.clone();
    }

    public float[] spo2() {
        return spo2.clone();
    }

    /** Glucose readings in mg/dL, oldest first. */
    public float[] glucose() {
        return glucose.clone();
    }

    public float temperature() {
        return temperature;
    }

    public float batteryPct() {
        return batteryPct;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SensorPacket)) return false;
        SensorPacket that = (SensorPacket) o;
        return Float.compare(temperature, that.temperature) == 0
            && Float.compare(batteryPct, that.batteryPct) == 0
            && capturedAt.equals(that.capturedAt)
            && Arrays.equals(ecg, that.ecg)
            && Arrays.equals(ppg, that.ppg)
            && Arrays.equals(accel, that.accel)
            && Arrays.equals(spo2, that.spo2)
            && Arrays.equals(glucose, that.glucose);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(capturedAt, temperature, batteryPct);
        result = 31 * result + Arrays.hashCode(ecg);
        result = 31 * result + Arrays.hashCode(ppg);
        result = 31 * result + Arrays.hashCode(accel);
        result = 31 * result + Arrays.hashCode(spo2);
        result = 31 * result + Arrays.hashCode(glucose);
        return result;
    }

    @Override
    public String toString() {
        return "SensorPacket{capturedAt=%s, ecg=%d, ppg=%d, accel=%d, spo2=%d, glucose=%d, battery=%.1f}"
            .formatted(capturedAt, ecg.length, ppg.length, accel.length, spo2.length, glucose.length, batteryPct);
    }
}
