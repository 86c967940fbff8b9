package com.example.ingestionservice.service;

import com.example.ingestionservice.dto.SyncStatusResponse;
import com.example.ingestionservice.entity.SyncStatus;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.repository.SyncStatusRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Last successful incremental sync per source, stored in UTC.
 */
@Service
@Slf4j
public class SyncStatusService {

    private final SyncStatusRepository syncStatusRepository;
    private final Duration staleAfter;
    private final Clock clock;

    public SyncStatusService(SyncStatusRepository syncStatusRepository,
                             @Value("${ingestion.sync.stale-after:P1D}") Duration staleAfter) {
        this(syncStatusRepository, staleAfter, Clock.systemUTC());
    }

    SyncStatusService(SyncStatusRepository syncStatusRepository, Duration staleAfter, Clock clock) {
        this.syncStatusRepository = syncStatusRepository;
        this.staleAfter = staleAfter;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<Instant> lastSync(Source source) {
        return syncStatusRepository.findById(source.key())
                .map(status -> status.getLastSync().toInstant(ZoneOffset.UTC));
    }

    @Transactional
    public void markSynced(Source source, Instant syncedUpTo) {
        syncStatusRepository.upsertLastSync(source.key(), LocalDateTime.ofInstant(syncedUpTo, ZoneOffset.UTC));
        log.info("Sync status updated: source={}, lastSync={}", source.key(), syncedUpTo);
    }

    @Transactional(readOnly = true)
    public List<SyncStatusResponse> statuses() {
        Map<String, SyncStatus> bySource = syncStatusRepository.findAll().stream()
                .collect(Collectors.toMap(SyncStatus::getSource, Function.identity()));
        LocalDateTime threshold = LocalDateTime.ofInstant(clock.instant().minus(staleAfter), ZoneOffset.UTC);

        List<SyncStatusResponse> responses = new ArrayList<>();
        for (Source source : Source.values()) {
            SyncStatus status = bySource.get(source.key());
            LocalDateTime lastSync = status != null ? status.getLastSync() : null;
            responses.add(SyncStatusResponse.builder()
                    .source(source.key())
                    .lastSync(lastSync)
                    .stale(lastSync == null || lastSync.isBefore(threshold))
                    .build());
        }
        return responses;
    }
}
