package com.example.monitoring.messaging;

import com.example.monitoring.model.CriticalAlert;
import com.example.monitoring.sync.UploadBatch;
import com.example.monitoring.sync.UploadClient;
import com.example.monitoring.sync.UploadException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * Uploads over the outgoing Kafka channels. A send only counts as delivered once the broker
 * acknowledges it within {@code monitoring.sync.ack-timeout}.
 */
@ApplicationScoped
public class KafkaUploadClient implements UploadClient {

    private static final Logger LOG = Logger.getLogger(KafkaUploadClient.class);

    private final Emitter<UploadBatch> records;
    private final Emitter<CriticalAlert> alerts;
    private final Duration ackTimeout;

    @Inject
    public KafkaUploadClient(
        @Channel("health-records") Emitter<UploadBatch> records,
        @Channel("critical-alerts") Emitter<CriticalAlert> alerts,
        @ConfigProperty(name = "monitoring.sync.ack-timeout", defaultValue = "PT10S") Duration ackTimeout
    ) {
        this.records = records;
        this.alerts = alerts;
        this.ackTimeout = ackTimeout;
    }

    @Override
    public void batchUpload(UploadBatch batch) throws UploadException {
        LOG.debugf("Publishing batch of %d records", batch.size());
        await(() -> records.send(batch), "record batch");
    }

    @Override
    public void sendCriticalAlert(CriticalAlert alert) throws UploadException {
        LOG.infof("Escalating %s %s alert %s", alert.severity(), alert.type(), alert.id());
        await(() -> alerts.send(alert), "alert " + alert.id());
    }

    private void await(Supplier<CompletionStage<Void>> send, String what) throws UploadException {
        try {
            send.get().toCompletableFuture().get(ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new UploadException("Broker rejected " + what, e.getCause());
        } catch (TimeoutException e) {
            throw new UploadException("No acknowledgement for %s within %d ms".formatted(what, ackTimeout.toMillis()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UploadException("Interrupted while sending " + what, e);
        } catch (IllegalStateException e) {
            // emitter buffer full or channel down
            throw new UploadException("Channel unavailable for " + what, e);
        }
    }
}
