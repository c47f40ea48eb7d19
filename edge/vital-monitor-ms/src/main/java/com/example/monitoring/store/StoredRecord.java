package com.example.monitoring.store;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(
    name = "stored_records",
    indexes = {
        @Index(name = "idx_records_synced_created", columnList = "synced, created_at"),
        @Index(name = "idx_records_priority", columnList = "priority")
    }
)
public class StoredRecord extends PanacheEntity {

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "data_type", nullable = false, length = 32)
    public RecordType dataType;

    @Column(name = "encrypted_payload", nullable = false, length = 16_777_216)
    public byte[] encryptedPayload;

    @Enumerated(EnumType.ORDINAL)
    @Column(name = "priority", nullable = false)
    public Priority priority;

    @Column(name = "synced", nullable = false)
    public boolean synced;

    // failed to decrypt; kept out of uploads but never treated as synced
    @Column(name = "quarantined", nullable = false)
    public boolean quarantined;

    // payload plus fixed row overhead; what the size cap counts
    @Column(name = "size_bytes", nullable = false)
    public int sizeBytes;
}
