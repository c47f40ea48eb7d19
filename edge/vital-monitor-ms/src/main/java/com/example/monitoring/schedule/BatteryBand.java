package com.example.monitoring.schedule;

public enum BatteryBand {
    NORMAL,
    LOW,
    CRITICAL
}
