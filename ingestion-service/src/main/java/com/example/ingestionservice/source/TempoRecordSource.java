package com.example.ingestionservice.source;

import com.example.ingestionservice.client.external.TempoClient;
import com.example.ingestionservice.dto.TempoPage;
import com.example.ingestionservice.dto.TempoWorklogDto;
import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.retry.RetryEnvelope;
import com.example.ingestionservice.service.RecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tempo filters by work date, so the window is widened to whole days.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TempoRecordSource implements RecordSource {

    private final TempoClient tempoClient;
    private final RecordMapper recordMapper;
    private final RetryEnvelope retryEnvelope;

    @Override
    public Source source() {
        return Source.TEMPO;
    }

    @Override
    public List<ActivityRecord> fetch(FetchWindow window) {
        tempoClient.requireConfigured();

        List<ActivityRecord> records = new ArrayList<>();
        TempoPage<TempoWorklogDto> page = retryEnvelope.execute("tempo.worklogs",
                () -> tempoClient.fetchWorklogs(window.fromDate(), window.toDate()));
        int pages = 1;
        while (true) {
            for (TempoWorklogDto worklog : page.getResults()) {
                records.add(recordMapper.tempoWorklogToRecord(worklog));
            }
            String next = page.getMetadata() != null ? page.getMetadata().getNext() : null;
            if (next == null || next.isBlank() || page.getResults().isEmpty()) {
                break;
            }
            page = retryEnvelope.execute("tempo.worklogs", () -> tempoClient.fetchWorklogs(next));
            pages++;
        }

        log.info("Fetched {} Tempo worklogs in {} pages for {} to {}",
                records.size(), pages, window.fromDate(), window.toDate());
        return records;
    }
}
