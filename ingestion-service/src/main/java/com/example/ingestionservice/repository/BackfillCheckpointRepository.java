package com.example.ingestionservice.repository;

import com.example.ingestionservice.entity.BackfillCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BackfillCheckpointRepository extends JpaRepository<BackfillCheckpoint, Long> {

    Optional<BackfillCheckpoint> findBySourceAndBatchId(String source, String batchId);

    List<BackfillCheckpoint> findByStatusOrderByStartedAtAsc(BackfillCheckpoint.CheckpointStatus status);

    /**
     * Batches that were RUNNING when the process died, for startup reporting.
     */
    default List<BackfillCheckpoint> findRunning() {
        return findByStatusOrderByStartedAtAsc(BackfillCheckpoint.CheckpointStatus.RUNNING);
    }
}
