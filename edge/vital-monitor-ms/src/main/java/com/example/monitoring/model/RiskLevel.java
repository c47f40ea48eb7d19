package com.example.monitoring.model;

public enum RiskLevel {
    NORMAL,
    ELEVATED,
    HIGH,
    CRITICAL
}
