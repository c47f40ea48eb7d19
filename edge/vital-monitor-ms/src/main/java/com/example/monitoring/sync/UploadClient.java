package com.example.monitoring.sync;

import com.example.monitoring.model.CriticalAlert;

/** Remote side of synchronization. Implementations must not report success before delivery is confirmed. */
public interface UploadClient {

    void batchUpload(UploadBatch batch) throws UploadException;

    void sendCriticalAlert(CriticalAlert alert) throws UploadException;
}
