package com.example.ingestionservice.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDateTime;

/**
 * Native PostgreSQL ON CONFLICT upsert for vector_sync_status.
 * 
 * CRITICAL: Two syncs of the same source finishing together never hit a
 * unique violation; the row simply takes the later write.
 */
@Repository
@Slf4j
public class SyncStatusRepositoryImpl implements SyncStatusRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public int upsertLastSync(String source, LocalDateTime lastSync) {
        String sql = """
                INSERT INTO vector_sync_status (source, last_sync, updated_at)
                VALUES (:source, :lastSync, :updatedAt)
                ON CONFLICT (source)
                DO UPDATE SET
                    last_sync = EXCLUDED.last_sync,
                    updated_at = EXCLUDED.updated_at
                """;

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("source", source);
        query.setParameter("lastSync", Timestamp.valueOf(lastSync));
        query.setParameter("updatedAt", Timestamp.valueOf(LocalDateTime.now()));

        int affected = query.executeUpdate();
        entityManager.clear();
        log.debug("Upserted sync status source={}, lastSync={}", source, lastSync);
        return affected;
    }
}
