package com.example.ingestionservice.source;

import com.example.ingestionservice.client.external.FirefliesClient;
import com.example.ingestionservice.dto.FirefliesTranscriptDto;
import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.retry.RetryEnvelope;
import com.example.ingestionservice.service.RecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class FirefliesRecordSource implements RecordSource {

    private final FirefliesClient firefliesClient;
    private final RecordMapper recordMapper;
    private final RetryEnvelope retryEnvelope;

    @Override
    public Source source() {
        return Source.FIREFLIES;
    }

    @Override
    public List<ActivityRecord> fetch(FetchWindow window) {
        firefliesClient.requireConfigured();

        List<ActivityRecord> records = new ArrayList<>();
        int skip = 0;
        while (true) {
            int offset = skip;
            List<FirefliesTranscriptDto> page = retryEnvelope.execute("fireflies.transcripts",
                    () -> firefliesClient.fetchTranscripts(window.getFrom(), window.getTo(), offset));
            for (FirefliesTranscriptDto transcript : page) {
                records.add(recordMapper.firefliesTranscriptToRecord(transcript));
            }
            if (page.size() < FirefliesClient.PAGE_SIZE) {
                break;
            }
            skip += page.size();
        }

        log.info("Fetched {} Fireflies transcripts for window {}", records.size(), window);
        return records;
    }
}
