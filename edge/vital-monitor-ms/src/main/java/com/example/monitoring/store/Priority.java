package com.example.monitoring.store;

/** Persisted by ordinal; keep the declaration order ascending. */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
