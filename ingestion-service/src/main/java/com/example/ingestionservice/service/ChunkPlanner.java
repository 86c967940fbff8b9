package com.example.ingestionservice.service;

import com.example.ingestionservice.record.Source;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits [startDate, endDate] into contiguous, non-overlapping chunks of
 * {@code chunkDays} days. The last chunk ends at endDate and may be shorter.
 */
@Component
public class ChunkPlanner {

    public List<BackfillChunk> plan(Source source, LocalDate startDate, LocalDate endDate, int chunkDays) {
        if (chunkDays < 1) {
            throw new IllegalArgumentException("chunkDays must be >= 1");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate " + startDate + " is after endDate " + endDate);
        }
        List<BackfillChunk> chunks = new ArrayList<>();
        LocalDate chunkStart = startDate;
        int index = 1;
        while (!chunkStart.isAfter(endDate)) {
            LocalDate chunkEnd = chunkStart.plusDays(chunkDays - 1L);
            if (chunkEnd.isAfter(endDate)) {
                chunkEnd = endDate;
            }
            chunks.add(new BackfillChunk(source, index++, chunkStart, chunkEnd));
            chunkStart = chunkEnd.plusDays(1);
        }
        return chunks;
    }
}
