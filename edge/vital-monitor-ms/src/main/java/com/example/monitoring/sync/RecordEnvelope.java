package com.example.monitoring.sync;

import com.example.monitoring.store.Priority;
import com.fasterxml.jackson.annotation.JsonRawValue;
import java.time.Instant;

/**
 * One stored record on its way to the cloud. {@code payload} is the decrypted JSON document and is
 * embedded as-is.
 */
public record RecordEnvelope(
    long id,
    String category,
    Instant createdAt,
    Priority priority,
    @JsonRawValue String payload
) {}
