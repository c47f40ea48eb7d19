package com.example.monitoring.web;

import com.example.monitoring.inference.LatencyTracker;
import com.example.monitoring.model.RiskLevel;
import com.example.monitoring.schedule.BatteryBand;
import com.example.monitoring.schedule.PeriodicTask;
import java.util.Map;

public record MonitoringStatus(
    boolean running,
    double batteryPct,
    BatteryBand batteryBand,
    RiskLevel riskLevel,
    Map<PeriodicTask, Long> intervalSeconds,
    LatencyTracker.Snapshot latency,
    long framesProcessed,
    long framesRejected,
    boolean online,
    boolean storageDegraded,
    int queuedWrites,
    long unsyncedRecords,
    long quarantinedRecords,
    long storeBytes
) {}
