package com.example.monitoring.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class OfflineStoreTest {

    @Inject
    OfflineStore store;

    @Inject
    StoredRecordRepository repository;

    @BeforeEach
    void clean() {
        QuarkusTransaction.requiringNew().run(repository::deleteAll);
    }

    @Test
    void pendingComesHighestPriorityFirstThenOldest() {
        long normal = store.persist(RecordType.VITAL_SIGNS, json("a"), Priority.NORMAL);
        long critical = store.persist(RecordType.ALERT, json("b"), Priority.CRITICAL);
        long low = store.persist(RecordType.EDGE_PREDICTION, json("c"), Priority.LOW);
        long high = store.persist(RecordType.ECG_WAVEFORM, json("d"), Priority.HIGH);
        long normalLater = store.persist(RecordType.BIOMARKERS, json("e"), Priority.NORMAL);

        List<Long> order = store.pending(10).stream().map(r -> r.id).toList();

        assertEquals(List.of(critical, high, normal, normalLater, low), order);
        assertEquals(List.of(critical, high), store.pending(2).stream().map(r -> r.id).toList());
    }

    @Test
    void payloadIsEncryptedAtRestAndOpensAgain() throws GeneralSecurityException {
        byte[] plaintext = json("heart rate 72");
        store.persist(RecordType.VITAL_SIGNS, plaintext, Priority.NORMAL);

        StoredRecord record = store.pending(1).get(0);

        assertFalse(new String(record.encryptedPayload, StandardCharsets.UTF_8).contains("heart rate"));
        assertArrayEquals(plaintext, store.decryptPayload(record));
        assertEquals(record.encryptedPayload.length + OfflineStore.ROW_OVERHEAD_BYTES, record.sizeBytes);
    }

    @Test
    void payloadDoesNotOpenUnderAnotherCategory() {
        store.persist(RecordType.VITAL_SIGNS, json("x"), Priority.NORMAL);
        StoredRecord record = store.pending(1).get(0);
        record.dataType = RecordType.ALERT;

        assertThrows(GeneralSecurityException.class, () -> store.decryptPayload(record));
    }

    @Test
    void markSyncedIsIdempotent() {
        long a = store.persist(RecordType.VITAL_SIGNS, json("a"), Priority.NORMAL);
        long b = store.persist(RecordType.VITAL_SIGNS, json("b"), Priority.NORMAL);

        assertEquals(2, store.markSynced(List.of(a, b)));
        assertEquals(0, store.markSynced(List.of(a, b)));
        assertEquals(0, store.markSynced(List.of()));
        assertEquals(0, store.countUnsynced());
    }

    @Test
    void sweepRemovesOnlySyncedRecordsPastRetention() {
        long synced = store.persist(RecordType.VITAL_SIGNS, json("a"), Priority.NORMAL);
        store.persist(RecordType.ALERT, json("b"), Priority.CRITICAL);
        store.markSynced(List.of(synced));

        assertEquals(0, store.sweepExpired(Instant.now().plus(Duration.ofHours(71))));
        assertEquals(1, store.sweepExpired(Instant.now().plus(Duration.ofHours(73))));

        long remaining = QuarkusTransaction.requiringNew().call(repository::count);
        assertEquals(1, remaining);
        assertEquals(1, store.countUnsynced());
    }

    @Test
    void sizeCapEvictsOldestSyncedFirstAndNeverUnsynced() {
        long first = store.persist(RecordType.VITAL_SIGNS, json("1"), Priority.NORMAL);
        long second = store.persist(RecordType.VITAL_SIGNS, json("2"), Priority.NORMAL);
        long third = store.persist(RecordType.VITAL_SIGNS, json("3"), Priority.NORMAL);
        store.persist(RecordType.ALERT, json("4"), Priority.CRITICAL);
        store.markSynced(List.of(first, second, third));
        long total = store.totalSizeBytes();

        assertEquals(1, store.enforceSizeCap(total - 1));
        long remaining = QuarkusTransaction.requiringNew().call(repository::count);
        assertEquals(3, remaining);
        assertNull(QuarkusTransaction.requiringNew().call(() -> repository.findById(first)));

        assertEquals(2, store.enforceSizeCap(0));
        assertEquals(1, store.countUnsynced());
        assertEquals(0, store.enforceSizeCap(0));
    }

    private static byte[] json(String value) {
        return ("{\"v\":\"" + value + "\"}").getBytes(StandardCharsets.UTF_8);
    }
}
