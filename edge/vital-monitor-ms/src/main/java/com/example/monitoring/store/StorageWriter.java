package com.example.monitoring.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Serializes pipeline output and hands it to the {@link OfflineStore}. A write that fails is kept
 * in a bounded in-memory queue and retried with exponential back-off; monitoring never waits on it.
 */
@ApplicationScoped
public class StorageWriter {

    static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    static final Duration MAX_BACKOFF = Duration.ofSeconds(60);
    static final int DEGRADED_AFTER_FAILURES = 3;

    private static final Logger LOG = Logger.getLogger(StorageWriter.class);

    private final OfflineStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int sizeCheckEvery;
    private final int maxQueued;

    private final Deque<PendingWrite> retryQueue = new ConcurrentLinkedDeque<>();
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final Object retryLock = new Object();
    private volatile Instant nextRetryAt = Instant.MIN;
    private volatile boolean degraded;

    private record PendingWrite(RecordType type, byte[] payload, Priority priority) {}

    @Inject
    public StorageWriter(
        OfflineStore store,
        ObjectMapper mapper,
        Clock clock,
        @ConfigProperty(name = "monitoring.store.size-check-every", defaultValue = "50") int sizeCheckEvery,
        @ConfigProperty(name = "monitoring.store.retry-queue-size", defaultValue = "10000") int maxQueued
    ) {
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
        this.sizeCheckEvery = sizeCheckEvery;
        this.maxQueued = maxQueued;
    }

    /** @return true when the record reached the store now, false when it was queued for retry */
    public boolean write(RecordType type, Object payload, Priority priority) {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Could not serialize %s payload of type %s", type, payload.getClass().getSimpleName());
            return false;
        }
        retryPending();
        return attempt(new PendingWrite(type, json, priority), true);
    }

    /** Replays queued writes once the back-off has elapsed. Called on each write and sync tick. */
    public void retryPending() {
        if (retryQueue.isEmpty() || clock.instant().isBefore(nextRetryAt)) return;
        synchronized (retryLock) {
            PendingWrite next;
            while ((next = retryQueue.pollFirst()) != null) {
                queued.decrementAndGet();
                if (!attempt(next, false)) {
                    retryQueue.addFirst(next);
                    queued.incrementAndGet();
                    return;
                }
            }
            LOG.info("Storage retry queue drained");
        }
    }

    private boolean attempt(PendingWrite w, boolean enqueueOnFailure) {
        try {
            store.persist(w.type(), w.payload(), w.priority());
        } catch (RuntimeException e) {
            onFailure(w, e);
            if (enqueueOnFailure) enqueue(w);
            return false;
        }
        onSuccess();
        return true;
    }

    private void onSuccess() {
        if (consecutiveFailures.getAndSet(0) > 0 || degraded) {
            degraded = false;
            nextRetryAt = Instant.MIN;
            LOG.info("Storage writes succeeding again");
        }
        if (writes.incrementAndGet() % sizeCheckEvery == 0) {
            try {
                store.enforceSizeCap();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Size cap check failed");
            }
        }
    }

    private void onFailure(PendingWrite w, RuntimeException e) {
        int failures = consecutiveFailures.incrementAndGet();
        long backoffMillis = Math.min(
            MAX_BACKOFF.toMillis(),
            INITIAL_BACKOFF.toMillis() << Math.min(failures - 1, 16)
        );
        nextRetryAt = clock.instant().plusMillis(backoffMillis);
        if (failures >= DEGRADED_AFTER_FAILURES && !degraded) {
            degraded = true;
            LOG.errorf(e, "Storage degraded after %d consecutive failures, continuing in memory", failures);
        } else {
            LOG.warnf("Storing %s record failed (%s), retrying in %d ms", w.type(), e.getMessage(), backoffMillis);
        }
    }

    private void enqueue(PendingWrite w) {
        retryQueue.addLast(w);
        if (queued.incrementAndGet() > maxQueued) {
            PendingWrite oldest = retryQueue.pollFirst();
            if (oldest != null) {
                queued.decrementAndGet();
                dropped.incrementAndGet();
                LOG.errorf("Retry queue full, dropped oldest %s record", oldest.type());
            }
        }
    }

    public boolean isDegraded() {
        return degraded;
    }

    public int queuedWrites() {
        return queued.get();
    }

    public long droppedWrites() {
        return dropped.get();
    }
}
