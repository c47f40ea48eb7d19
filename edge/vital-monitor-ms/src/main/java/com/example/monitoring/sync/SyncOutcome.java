package com.example.monitoring.sync;

public record SyncOutcome(Status status, int records) {

    public enum Status {
        UPLOADED,
        NOTHING_PENDING,
        FAILED,
        SKIPPED_OFFLINE,
        SKIPPED_BUSY
    }

    static SyncOutcome of(Status status) {
        return new SyncOutcome(status, 0);
    }
}
