package com.example.ingestionservice.service;

import com.example.ingestionservice.entity.BackfillCheckpoint;
import com.example.ingestionservice.repository.BackfillCheckpointRepository;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Map-backed checkpoint repository behind a real {@link CheckpointService}.
 * Records processed_items at every save so tests can check it never went backwards.
 */
class CheckpointStore {

    private final Map<Long, BackfillCheckpoint> rows = new LinkedHashMap<>();
    private final List<Integer> processedHistory = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();
    private final BackfillCheckpointRepository repository = mock(BackfillCheckpointRepository.class);

    CheckpointStore() {
        when(repository.findBySourceAndBatchId(anyString(), anyString()))
                .thenAnswer(inv -> find(inv.getArgument(0), inv.getArgument(1)));
        when(repository.findById(anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get(inv.<Long>getArgument(0))));
        when(repository.save(any(BackfillCheckpoint.class)))
                .thenAnswer(inv -> store(inv.getArgument(0)));
        when(repository.saveAndFlush(any(BackfillCheckpoint.class)))
                .thenAnswer(inv -> store(inv.getArgument(0)));
    }

    CheckpointService service() {
        return new CheckpointService(repository);
    }

    BackfillCheckpointRepository repository() {
        return repository;
    }

    Optional<BackfillCheckpoint> find(String source, String batchId) {
        return rows.values().stream()
                .filter(row -> row.getSource().equals(source) && row.getBatchId().equals(batchId))
                .findFirst();
    }

    BackfillCheckpoint put(BackfillCheckpoint checkpoint) {
        return store(checkpoint);
    }

    List<Integer> processedHistory() {
        return processedHistory;
    }

    private BackfillCheckpoint store(BackfillCheckpoint checkpoint) {
        if (checkpoint.getId() == null) {
            ReflectionTestUtils.setField(checkpoint, "id", ids.incrementAndGet());
        }
        rows.put(checkpoint.getId(), checkpoint);
        processedHistory.add(checkpoint.getProcessedItems());
        return checkpoint;
    }
}
