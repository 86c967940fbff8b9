package com.example.ingestionservice.service;

import com.example.ingestionservice.record.Source;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkPlannerTest {

    private final ChunkPlanner planner = new ChunkPlanner();

    @Test
    void testPlan_NinetyOneDays_FourChunksLastTruncated() {
        // GIVEN
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 3, 31);

        // WHEN
        List<BackfillChunk> chunks = planner.plan(Source.TEMPO, start, end, 30);

        // THEN
        assertThat(chunks).hasSize(4);
        assertThat(chunks.get(0).getStartDate()).isEqualTo(start);
        assertThat(chunks.get(0).getEndDate()).isEqualTo(LocalDate.of(2024, 1, 30));
        assertThat(chunks.get(3).getStartDate()).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(chunks.get(3).getEndDate()).isEqualTo(end);
    }

    @Test
    void testPlan_ChunksContiguousAndNonOverlapping() {
        List<BackfillChunk> chunks = planner.plan(Source.JIRA,
                LocalDate.of(2023, 5, 17), LocalDate.of(2024, 5, 16), 30);

        for (int i = 1; i < chunks.size(); i++) {
            assertThat(chunks.get(i).getStartDate()).isEqualTo(chunks.get(i - 1).getEndDate().plusDays(1));
            assertThat(chunks.get(i).getIndex()).isEqualTo(i + 1);
        }
        assertThat(chunks.get(chunks.size() - 1).getEndDate()).isEqualTo(LocalDate.of(2024, 5, 16));
    }

    @Test
    void testPlan_SingleDay_OneChunk() {
        LocalDate day = LocalDate.of(2024, 2, 29);

        List<BackfillChunk> chunks = planner.plan(Source.SLACK, day, day, 30);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).getStartDate()).isEqualTo(day);
        assertThat(chunks.get(0).getEndDate()).isEqualTo(day);
    }

    @Test
    void testBatchId_StableAndZeroPadded() {
        BackfillChunk chunk = planner.plan(Source.TEMPO,
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31), 30).get(0);

        assertThat(chunk.batchId()).isEqualTo("tempo-chunk-01-2024-01-01_to_2024-01-30");
        assertThat(chunk.toRequest().getBatchId()).isEqualTo(chunk.batchId());
        assertThat(chunk.toRequest().getStartDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(chunk.toRequest().getEndDate()).isEqualTo(LocalDate.of(2024, 1, 30));
    }

    @Test
    void testPlan_InvalidArguments_Rejected() {
        assertThatThrownBy(() -> planner.plan(Source.TEMPO, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1), 30))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planner.plan(Source.TEMPO, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
