package com.example.monitoring.pipeline;

/** Independent producers of snapshot updates; ordering is enforced per stream. */
public enum MetricStream {
    PACKET,
    VITAL_SIGNS,
    BIOMARKERS
}
