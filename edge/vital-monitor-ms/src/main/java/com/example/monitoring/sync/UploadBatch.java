package com.example.monitoring.sync;

import java.time.Instant;
import java.util.List;

public record UploadBatch(Instant sentAt, List<RecordEnvelope> records) {

    public UploadBatch {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
