package com.example.monitoring.store;

import com.example.monitoring.codec.AeadCipher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Encrypted record store backing offline operation. Payloads are sealed before they reach the
 * database, with the record category as associated data, so a payload moved to another
 * category fails to open.
 */
@ApplicationScoped
public class OfflineStore {

    static final int ROW_OVERHEAD_BYTES = 64;

    private static final Logger LOG = Logger.getLogger(OfflineStore.class);

    private final StoredRecordRepository repository;
    private final Clock clock;
    private final AeadCipher cipher;
    private final Duration retention;
    private final long maxSizeBytes;
    private final int evictionBatch;

    @Inject
    public OfflineStore(
        StoredRecordRepository repository,
        Clock clock,
        @ConfigProperty(name = "monitoring.store.payload-key") String payloadKey,
        @ConfigProperty(name = "monitoring.store.retention-hours", defaultValue = "72") int retentionHours,
        @ConfigProperty(name = "monitoring.store.max-size-bytes", defaultValue = "524288000") long maxSizeBytes,
        @ConfigProperty(name = "monitoring.store.eviction-batch", defaultValue = "1000") int evictionBatch
    ) {
        this.repository = repository;
        this.clock = clock;
        this.cipher = AeadCipher.fromBase64(payloadKey);
        this.retention = Duration.ofHours(retentionHours);
        this.maxSizeBytes = maxSizeBytes;
        this.evictionBatch = evictionBatch;
    }

    @Transactional
    public long persist(RecordType type, byte[] plaintext, Priority priority) {
        StoredRecord record = new StoredRecord();
        record.createdAt = clock.instant();
        record.dataType = type;
        record.encryptedPayload = cipher.seal(plaintext, associatedData(type));
        record.priority = priority;
        record.synced = false;
        record.quarantined = false;
        record.sizeBytes = record.encryptedPayload.length + ROW_OVERHEAD_BYTES;
        try {
            repository.persistAndFlush(record);
        } catch (PersistenceException e) {
            throw new StorageException("Could not persist %s record".formatted(type), e);
        }
        LOG.debugf("Stored %s record %d (%d bytes, %s)", type, record.id, record.sizeBytes, priority);
        return record.id;
    }

    /** Unsynced, unquarantined records, highest priority first, then oldest first. */
    @Transactional
    public List<StoredRecord> pending(int limit) {
        return repository.findPending(limit);
    }

    /** Safe to repeat: records already synced are left untouched and not counted. */
    @Transactional
    public int markSynced(Collection<Long> ids) {
        if (ids.isEmpty()) return 0;
        return repository.markSynced(ids);
    }

    /**
     * Takes records that can no longer be opened out of the upload queue. They stay unsynced, so
     * retention and the size cap keep them.
     */
    @Transactional
    public int quarantine(Collection<Long> ids) {
        if (ids.isEmpty()) return 0;
        int marked = repository.markQuarantined(ids);
        LOG.errorf("Quarantined %d unreadable records %s", marked, ids);
        return marked;
    }

    @Transactional
    public long countQuarantined() {
        return repository.countQuarantined();
    }

    @Transactional
    public int sweepExpired() {
        return sweepExpired(clock.instant());
    }

    /** Deletes synced records older than the retention window measured back from {@code now}. */
    @Transactional
    public int sweepExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        int deleted = (int) repository.deleteSyncedBefore(cutoff);
        if (deleted > 0) {
            LOG.infof("Retention sweep removed %d synced records older than %s", deleted, cutoff);
        }
        return deleted;
    }

    @Transactional
    public int enforceSizeCap() {
        return enforceSizeCap(maxSizeBytes);
    }

    /**
     * Evicts the oldest synced records until the total size is at or below {@code ceiling}.
     * Unsynced records are never evicted, so the store may stay above the ceiling.
     */
    @Transactional
    public int enforceSizeCap(long ceiling) {
        long total = repository.totalSizeBytes();
        int evicted = 0;
        while (total > ceiling) {
            List<Object[]> candidates = repository.oldestSynced(evictionBatch);
            if (candidates.isEmpty()) {
                LOG.warnf(
                    "Store holds %d bytes, above the %d byte cap, but nothing left is synced",
                    total,
                    ceiling
                );
                break;
            }
            List<Long> victims = new ArrayList<>();
            for (Object[] row : candidates) {
                if (total <= ceiling) break;
                victims.add((Long) row[0]);
                total -= ((Number) row[1]).longValue();
            }
            evicted += (int) repository.deleteByIds(victims);
        }
        if (evicted > 0) {
            LOG.infof("Size cap evicted %d synced records, store now at %d bytes", evicted, total);
        }
        return evicted;
    }

    @Transactional
    public long totalSizeBytes() {
        return repository.totalSizeBytes();
    }

    @Transactional
    public long countUnsynced() {
        return repository.countUnsynced();
    }

    public byte[] decryptPayload(StoredRecord record) throws GeneralSecurityException {
        return cipher.open(record.encryptedPayload, associatedData(record.dataType));
    }

    private static byte[] associatedData(RecordType type) {
        return type.category().getBytes(StandardCharsets.UTF_8);
    }
}
