package com.example.monitoring.store;

import io.quarkus.hibernate.orm.panache.PanacheRepository;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

@ApplicationScoped
public class StoredRecordRepository implements PanacheRepository<StoredRecord> {

    public List<StoredRecord> findPending(int limit) {
        return find(
            "synced = false and quarantined = false",
            Sort.by("priority", Sort.Direction.Descending).and("createdAt").and("id")
        ).page(0, limit).list();
    }

    public int markSynced(Collection<Long> ids) {
        return update("synced = true where synced = false and id in ?1", ids);
    }

    public int markQuarantined(Collection<Long> ids) {
        return update("quarantined = true where synced = false and id in ?1", ids);
    }

    public long countQuarantined() {
        return count("quarantined = true");
    }

    public long deleteSyncedBefore(Instant cutoff) {
        return delete("synced = true and createdAt < ?1", cutoff);
    }

    public long totalSizeBytes() {
        return getEntityManager()
            .createQuery("select coalesce(sum(r.sizeBytes), 0) from StoredRecord r", Long.class)
            .getSingleResult();
    }

    /** {@code [id, sizeBytes]} of the oldest synced records. */
    public List<Object[]> oldestSynced(int limit) {
        return getEntityManager()
            .createQuery(
                "select r.id, r.sizeBytes from StoredRecord r where r.synced = true order by r.createdAt, r.id",
                Object[].class
            )
            .setMaxResults(limit)
            .getResultList();
    }

    public long deleteByIds(Collection<Long> ids) {
        return delete("id in ?1", ids);
    }

    public long countUnsynced() {
        return count("synced = false");
    }
}
