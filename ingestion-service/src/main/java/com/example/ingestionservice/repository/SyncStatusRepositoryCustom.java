package com.example.ingestionservice.repository;

import java.time.LocalDateTime;

/**
 * Custom repository interface for SyncStatus UPSERT.
 */
public interface SyncStatusRepositoryCustom {

    /**
     * Insert or move forward the last sync time of a source using PostgreSQL ON CONFLICT.
     * Idempotent: safe to call again with the same value.
     *
     * @return Number of rows affected
     */
    int upsertLastSync(String source, LocalDateTime lastSync);
}
