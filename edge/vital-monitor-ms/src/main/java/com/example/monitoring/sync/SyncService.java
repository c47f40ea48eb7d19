package com.example.monitoring.sync;

import com.example.monitoring.config.WorkerPool;
import com.example.monitoring.store.OfflineStore;
import com.example.monitoring.store.StorageWriter;
import com.example.monitoring.store.StoredRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Uploads pending records in batches. A batch is marked synced only after the upload client
 * confirms it; on any failure the whole batch stays pending for the next attempt. At most one
 * sync runs at a time; a priority request arriving during a sync runs right after it.
 */
@ApplicationScoped
public class SyncService {

    private static final Logger LOG = Logger.getLogger(SyncService.class);

    private final OfflineStore store;
    private final UploadClient uploadClient;
    private final StorageWriter writer;
    private final WorkerPool pool;
    private final Clock clock;
    private final int batchSize;

    private final AtomicBoolean inProgress = new AtomicBoolean();
    private final AtomicBoolean priorityPending = new AtomicBoolean();
    private volatile boolean online;

    @Inject
    public SyncService(
        OfflineStore store,
        UploadClient uploadClient,
        StorageWriter writer,
        WorkerPool pool,
        Clock clock,
        @ConfigProperty(name = "monitoring.sync.batch-size", defaultValue = "100") int batchSize,
        @ConfigProperty(name = "monitoring.sync.start-online", defaultValue = "true") boolean online
    ) {
        this.store = store;
        this.uploadClient = uploadClient;
        this.writer = writer;
        this.pool = pool;
        this.clock = clock;
        this.batchSize = batchSize;
        this.online = online;
    }

    public SyncOutcome syncNow(SyncTrigger trigger) {
        if (!online) {
            LOG.debugf("Sync (%s) skipped, device offline", trigger);
            return SyncOutcome.of(SyncOutcome.Status.SKIPPED_OFFLINE);
        }
        if (!inProgress.compareAndSet(false, true)) {
            if (trigger == SyncTrigger.PRIORITY) {
                priorityPending.set(true);
            }
            LOG.debugf("Sync (%s) skipped, another sync is running", trigger);
            return SyncOutcome.of(SyncOutcome.Status.SKIPPED_BUSY);
        }
        try {
            return uploadPending(trigger);
        } finally {
            inProgress.set(false);
            if (priorityPending.getAndSet(false)) {
                pool.execute(() -> syncNow(SyncTrigger.PRIORITY));
            }
        }
    }

    private SyncOutcome uploadPending(SyncTrigger trigger) {
        writer.retryPending();

        List<StoredRecord> pending;
        try {
            pending = store.pending(batchSize);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Sync (%s) could not read pending records", trigger);
            return SyncOutcome.of(SyncOutcome.Status.FAILED);
        }
        if (pending.isEmpty()) {
            return SyncOutcome.of(SyncOutcome.Status.NOTHING_PENDING);
        }

        List<RecordEnvelope> envelopes = new ArrayList<>(pending.size());
        List<Long> ids = new ArrayList<>(pending.size());
        List<Long> unreadable = new ArrayList<>();
        for (StoredRecord record : pending) {
            try {
                String json = new String(store.decryptPayload(record), StandardCharsets.UTF_8);
                envelopes.add(new RecordEnvelope(
                    record.id,
                    record.dataType.category(),
                    record.createdAt,
                    record.priority,
                    json
                ));
                ids.add(record.id);
            } catch (GeneralSecurityException e) {
                LOG.errorf(e, "Record %d (%s) failed to decrypt and will not be uploaded", record.id, record.dataType);
                unreadable.add(record.id);
            }
        }
        quarantine(unreadable);
        if (envelopes.isEmpty()) {
            return SyncOutcome.of(SyncOutcome.Status.NOTHING_PENDING);
        }

        try {
            uploadClient.batchUpload(new UploadBatch(clock.instant(), envelopes));
        } catch (UploadException e) {
            LOG.warnf("Sync (%s) of %d records failed, will retry: %s", trigger, envelopes.size(), e.getMessage());
            return new SyncOutcome(SyncOutcome.Status.FAILED, envelopes.size());
        }

        int marked;
        try {
            marked = store.markSynced(ids);
        } catch (RuntimeException e) {
            // the batch will be uploaded again; the cloud side de-duplicates by record id
            LOG.warnf(e, "Uploaded %d records but could not mark them synced", ids.size());
            return new SyncOutcome(SyncOutcome.Status.FAILED, ids.size());
        }
        LOG.infof("Sync (%s) uploaded %d records", trigger, marked);
        return new SyncOutcome(SyncOutcome.Status.UPLOADED, marked);
    }

    // unreadable rows would otherwise head every later batch
    private void quarantine(List<Long> unreadable) {
        if (unreadable.isEmpty()) return;
        try {
            store.quarantine(unreadable);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not quarantine records %s, they will be retried", unreadable);
        }
    }

    public void connectivityChanged(boolean nowOnline) {
        boolean wasOnline = online;
        online = nowOnline;
        if (nowOnline && !wasOnline) {
            LOG.info("Connectivity restored, syncing pending records");
            pool.execute(() -> syncNow(SyncTrigger.CONNECTIVITY_RESTORED));
        } else if (!nowOnline && wasOnline) {
            LOG.info("Connectivity lost, records will be kept locally");
        }
    }

    /** Critical records skip the battery-driven sync interval. */
    public void requestPrioritySync() {
        pool.execute(() -> syncNow(SyncTrigger.PRIORITY));
    }

    public boolean isOnline() {
        return online;
    }

    public boolean isSyncing() {
        return inProgress.get();
    }
}
