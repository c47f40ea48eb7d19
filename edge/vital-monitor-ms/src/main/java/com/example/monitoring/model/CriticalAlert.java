package com.example.monitoring.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record CriticalAlert(
    UUID id,
    Instant createdAt,
    AlertType type,
    AlertSeverity severity,
    String message,
    boolean actionRequired,
    boolean autoEscalate
) {

    public CriticalAlert {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
    }

    public static CriticalAlert create(
        Instant now,
        AlertType type,
        AlertSeverity severity,
        String message,
        boolean actionRequired,
        boolean autoEscalate
    ) {
        return new CriticalAlert(UUID.randomUUID(), now, type, severity, message, actionRequired, autoEscalate);
    }
}
