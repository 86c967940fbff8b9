package com.example.ingestionservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Last successful incremental sync per source.
 * Written through {@code SyncStatusRepositoryImpl#upsertLastSync} only.
 */
@Entity
@Table(name = "vector_sync_status")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncStatus {

    @Id
    @Column(name = "source", length = 50)
    private String source;

    @Column(name = "last_sync", nullable = false)
    private LocalDateTime lastSync;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
