package com.example.monitoring.sync;

public enum SyncTrigger {
    SCHEDULED,
    CONNECTIVITY_RESTORED,
    PRIORITY,
    MANUAL
}
