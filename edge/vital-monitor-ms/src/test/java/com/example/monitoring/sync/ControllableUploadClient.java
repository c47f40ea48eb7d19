package com.example.monitoring.sync;

import com.example.monitoring.messaging.KafkaUploadClient;
import com.example.monitoring.model.CriticalAlert;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;
import java.util.concurrent.atomic.AtomicInteger;

/** Forwards to the Kafka client unless told to fail, so tests can take the cloud side down. */
@Alternative
@Priority(1)
@ApplicationScoped
public class ControllableUploadClient implements UploadClient {

    private final KafkaUploadClient delegate;
    private final AtomicInteger failedCalls = new AtomicInteger();
    private volatile boolean failing;

    public ControllableUploadClient(KafkaUploadClient delegate) {
        this.delegate = delegate;
    }

    public void failing(boolean failing) {
        this.failing = failing;
    }

    public int failedCalls() {
        return failedCalls.get();
    }

    @Override
    public void batchUpload(UploadBatch batch) throws UploadException {
        if (failing) {
            failedCalls.incrementAndGet();
            throw new UploadException("cloud unreachable");
        }
        delegate.batchUpload(batch);
    }

    @Override
    public void sendCriticalAlert(CriticalAlert alert) throws UploadException {
        if (failing) {
            failedCalls.incrementAndGet();
            throw new UploadException("cloud unreachable");
        }
        delegate.sendCriticalAlert(alert);
    }
}
