package com.example.monitoring.inference;

public enum HypoglycemiaRisk {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL
}
