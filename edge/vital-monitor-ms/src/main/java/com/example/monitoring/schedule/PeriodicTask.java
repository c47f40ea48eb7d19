package com.example.monitoring.schedule;

/** Tasks whose interval follows the cadence policy. */
public enum PeriodicTask {
    VITAL_SIGNS,
    BIOMARKERS,
    PATTERN_DETECTION,
    CLOUD_SYNC
}
