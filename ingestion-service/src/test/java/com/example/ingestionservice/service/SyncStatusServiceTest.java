package com.example.ingestionservice.service;

import com.example.ingestionservice.dto.SyncStatusResponse;
import com.example.ingestionservice.entity.SyncStatus;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.repository.SyncStatusRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SyncStatusServiceTest {

    private static final Instant NOW = Instant.parse("2024-11-15T08:00:00Z");

    private SyncStatusRepository repository;
    private SyncStatusService service;

    @BeforeEach
    void setUp() {
        repository = mock(SyncStatusRepository.class);
        service = new SyncStatusService(repository, Duration.ofDays(1), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testLastSync_StoredRow_ReturnsUtcInstant() {
        // GIVEN
        when(repository.findById("jira")).thenReturn(Optional.of(status("jira", "2024-11-15T07:00:00")));

        // WHEN / THEN
        assertThat(service.lastSync(Source.JIRA)).contains(Instant.parse("2024-11-15T07:00:00Z"));
    }

    @Test
    void testLastSync_NeverSynced_ReturnsEmpty() {
        when(repository.findById("slack")).thenReturn(Optional.empty());

        assertThat(service.lastSync(Source.SLACK)).isEmpty();
    }

    @Test
    void testMarkSynced_ConvertsInstantToUtcLocalDateTime() {
        // WHEN
        service.markSynced(Source.TEMPO, Instant.parse("2024-11-15T07:30:00Z"));

        // THEN
        verify(repository).upsertLastSync("tempo", LocalDateTime.parse("2024-11-15T07:30:00"));
    }

    @Test
    void testStatuses_ListsEverySource_WithStaleness() {
        // GIVEN: jira fresh, notion older than one day, others never synced
        when(repository.findAll()).thenReturn(List.of(
                status("jira", "2024-11-15T07:00:00"),
                status("notion", "2024-11-13T07:00:00")));

        // WHEN
        List<SyncStatusResponse> statuses = service.statuses();

        // THEN
        assertThat(statuses).extracting(SyncStatusResponse::getSource)
                .containsExactly("jira", "tempo", "fireflies", "notion", "slack");
        assertThat(statuses.get(0).isStale()).isFalse();
        assertThat(statuses.get(0).getLastSync()).isEqualTo(LocalDateTime.parse("2024-11-15T07:00:00"));
        assertThat(statuses.get(1).isStale()).isTrue();
        assertThat(statuses.get(1).getLastSync()).isNull();
        assertThat(statuses.get(3).isStale()).isTrue();
    }

    private static SyncStatus status(String source, String lastSync) {
        return SyncStatus.builder()
                .source(source)
                .lastSync(LocalDateTime.parse(lastSync))
                .updatedAt(LocalDateTime.parse(lastSync))
                .build();
    }
}
