package com.example.monitoring.schedule;

import java.time.Duration;

public record Cadence(Duration vitalSigns, Duration biomarkers, Duration patternDetection, Duration cloudSync) {

    public Duration intervalFor(PeriodicTask task) {
        return switch (task) {
            case VITAL_SIGNS -> vitalSigns;
            case BIOMARKERS -> biomarkers;
            case PATTERN_DETECTION -> patternDetection;
            case CLOUD_SYNC -> cloudSync;
        };
    }
}
