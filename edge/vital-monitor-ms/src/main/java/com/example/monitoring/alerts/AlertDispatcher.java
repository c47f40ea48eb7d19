package com.example.monitoring.alerts;

import com.example.monitoring.config.WorkerPool;
import com.example.monitoring.model.CriticalAlert;
import com.example.monitoring.store.Priority;
import com.example.monitoring.store.RecordType;
import com.example.monitoring.store.StorageWriter;
import com.example.monitoring.sync.SyncService;
import com.example.monitoring.sync.UploadClient;
import com.example.monitoring.sync.UploadException;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Stores every raised alert and escalates the ones flagged for it. Escalation runs off the
 * calling thread; if it fails the stored copy still reaches the cloud with the next sync.
 */
@ApplicationScoped
public class AlertDispatcher {

    private static final Logger LOG = Logger.getLogger(AlertDispatcher.class);

    private final StorageWriter writer;
    private final UploadClient uploadClient;
    private final SyncService syncService;
    private final WorkerPool pool;

    public AlertDispatcher(StorageWriter writer, UploadClient uploadClient, SyncService syncService, WorkerPool pool) {
        this.writer = writer;
        this.uploadClient = uploadClient;
        this.syncService = syncService;
        this.pool = pool;
    }

    public void dispatch(List<CriticalAlert> alerts) {
        boolean escalated = false;
        for (CriticalAlert alert : alerts) {
            Priority priority = alert.autoEscalate() ? Priority.CRITICAL : Priority.HIGH;
            writer.write(RecordType.ALERT, alert, priority);
            if (alert.autoEscalate()) {
                escalated = true;
                pool.execute(() -> escalate(alert));
            }
        }
        if (escalated) {
            syncService.requestPrioritySync();
        }
    }

    private void escalate(CriticalAlert alert) {
        try {
            uploadClient.sendCriticalAlert(alert);
        } catch (UploadException e) {
            LOG.errorf(e, "Escalation of alert %s failed, it will go out with the next sync", alert.id());
        }
    }
}
