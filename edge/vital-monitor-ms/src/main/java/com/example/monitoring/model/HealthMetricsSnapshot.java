package com.example.monitoring.model;

import com.example.monitoring.inference.HypertensionStage;
import com.example.monitoring.inference.HypoglycemiaRisk;
import com.example.monitoring.inference.Spo2AlertLevel;
import java.time.Instant;

/**
 * Best-known value of every tracked vital and biomarker. Immutable; a new instance replaces
 * the previous one as a whole after each committed pass.
 */
public final class HealthMetricsSnapshot {

    public static final HealthMetricsSnapshot INITIAL = new Builder().build();

    // Cardiac
    public final int heartRate;
    public final int hrvMs;
    public final boolean arrhythmiaDetected;
    public final double arrhythmiaConfidence;
    public final boolean stElevationDetected;
    public final double troponinLevel;
    public final double cardiacRiskScore;

    // Blood pressure
    public final int systolicBp;
    public final int diastolicBp;
    public final int meanArterialPressure;
    public final HypertensionStage hypertensionStage;

    // Glucose
    public final double glucoseMgDl;
    public final double glucoseTrend;
    public final HypoglycemiaRisk hypoglycemiaRisk;

    // Respiratory
    public final double spo2;
    public final Spo2AlertLevel spo2Alert;
    public final int respiratoryRate;

    public final double temperature;
    public final double batteryPct;
    public final RiskLevel riskLevel;
    public final long lastLatencyMs;
    public final Instant updatedAt;

    private HealthMetricsSnapshot(Builder b) {
        this.heartRate = b.heartRate;
        this.hrvMs = b.hrvMs;
        this.arrhythmiaDetected = b.arrhythmiaDetected;
        this.arrhythmiaConfidence = b.arrhythmiaConfidence;
        this.stElevationDetected = b.stElevationDetected;
        this.troponinLevel = b.troponinLevel;
        this.cardiacRiskScore = b.cardiacRiskScore;
        this.systolicBp = b.systolicBp;
        this.diastolicBp = b.diastolicBp;
        this.meanArterialPressure = b.meanArterialPressure;
        this.hypertensionStage = b.hypertensionStage;
        this.glucoseMgDl = b.glucoseMgDl;
        this.glucoseTrend = b.glucoseTrend;
        this.hypoglycemiaRisk = b.hypoglycemiaRisk;
        this.spo2 = b.spo2;
        this.spo2Alert = b.spo2Alert;
        this.respiratoryRate = b.respiratoryRate;
        this.temperature = b.temperature;
        this.batteryPct = b.batteryPct;
        this.riskLevel = b.riskLevel;
        this.lastLatencyMs = b.lastLatencyMs;
        this.updatedAt = b.updatedAt;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.heartRate = heartRate;
        b.hrvMs = hrvMs;
        b.arrhythmiaDetected = arrhythmiaDetected;
        b.arrhythmiaConfidence = arrhythmiaConfidence;
        b.stElevationDetected = stElevationDetected;
        b.troponinLevel = troponinLevel;
        b.cardiacRiskScore = cardiacRiskScore;
        b.systolicBp = systolicBp;
        b.diastolicBp = diastolicBp;
        b.meanArterialPressure = meanArterialPressure;
        b.hypertensionStage = hypertensionStage;
        b.glucoseMgDl = glucoseMgDl;
        b.glucoseTrend = glucoseTrend;
        b.hypoglycemiaRisk = hypoglycemiaRisk;
        b.spo2 = spo2;
        b.spo2Alert = spo2Alert;
        b.respiratoryRate = respiratoryRate;
        b.temperature = temperature;
        b.batteryPct = batteryPct;
        b.riskLevel = riskLevel;
        b.lastLatencyMs = lastLatencyMs;
        b.updatedAt = updatedAt;
        return b;
    }

    public static final class Builder {

        private int heartRate;
        private int hrvMs;
        private boolean arrhythmiaDetected;
        private double arrhythmiaConfidence;
        private boolean stElevationDetected;
        private double troponinLevel;
        private double cardiacRiskScore;
        private int systolicBp;
        private int diastolicBp;
        private int meanArterialPressure;
        private HypertensionStage hypertensionStage = HypertensionStage.NORMAL;
        private double glucoseMgDl;
        private double glucoseTrend;
        private HypoglycemiaRisk hypoglycemiaRisk = HypoglycemiaRisk.LOW;
        private double spo2;
        private Spo2AlertLevel spo2Alert = Spo2AlertLevel.NONE;
        private int respiratoryRate;
        private double temperature;
        private double batteryPct = 100.0;
        private RiskLevel riskLevel = RiskLevel.NORMAL;
        private long lastLatencyMs;
        private Instant updatedAt = Instant.EPOCH;

        public Builder heartRate(int heartRate) {
            this.heartRate = heartRate;
            return this;
        }

        public Builder hrvMs(int hrvMs) {
            this.hrvMs = hrvMs;
            return this;
        }

        public Builder arrhythmia(boolean detected, double confidence) {
            this.arrhythmiaDetected = detected;
            this.arrhythmiaConfidence = confidence;
            return this;
        }

        public Builder stElevationDetected(boolean stElevationDetected) {
            this.stElevationDetected = stElevationDetected;
            return this;
        }

        public Builder troponin(double level, double cardiacRiskScore) {
            this.troponinLevel = level;
            this.cardiacRiskScore = cardiacRiskScore;
            return this;
        }

        public Builder bloodPressure(int systolic, int diastolic, int meanArterial, HypertensionStage stage) {
            this.systolicBp = systolic;
            this.diastolicBp = diastolic;
            this.meanArterialPressure = meanArterial;
            this.hypertensionStage = stage;
            return this;
        }

        public Builder glucose(double mgDl, double trend, HypoglycemiaRisk risk) {
            this.glucoseMgDl = mgDl;
            this.glucoseTrend = trend;
            this.hypoglycemiaRisk = risk;
            return this;
        }

        public Builder spo2(double spo2, Spo2AlertLevel level) {
            this.spo2 = spo2;
            this.spo2Alert = level;
            return this;
        }

        public Builder respiratoryRate(int respiratoryRate) {
            this.respiratoryRate = respiratoryRate;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder batteryPct(double batteryPct) {
            this.batteryPct = batteryPct;
            return this;
        }

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder lastLatencyMs(long lastLatencyMs) {
            this.lastLatencyMs = lastLatencyMs;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public HealthMetricsSnapshot build() {
            return new HealthMetricsSnapshot(this);
        }
    }
}
