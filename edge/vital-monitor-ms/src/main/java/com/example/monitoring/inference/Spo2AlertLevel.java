package com.example.monitoring.inference;

public enum Spo2AlertLevel {
    NONE,
    WARNING,
    CRITICAL
}
