package com.example.monitoring.model;

/** Ordered from least to most severe. */
public enum AlertSeverity {
    WARNING,
    URGENT,
    CRITICAL,
    EMERGENCY;

    public boolean atLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }
}
