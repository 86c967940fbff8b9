package com.example.ingestionservice.source;

import com.example.ingestionservice.client.external.JiraClient;
import com.example.ingestionservice.dto.JiraIssueDto;
import com.example.ingestionservice.dto.JiraSearchResponse;
import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.retry.RetryEnvelope;
import com.example.ingestionservice.service.RecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JiraRecordSource implements RecordSource {

    static final int PAGE_SIZE = 100;
    private static final DateTimeFormatter JQL_FORMAT =
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm").withZone(ZoneOffset.UTC);

    private final JiraClient jiraClient;
    private final RecordMapper recordMapper;
    private final RetryEnvelope retryEnvelope;

    @Override
    public Source source() {
        return Source.JIRA;
    }

    @Override
    public List<ActivityRecord> fetch(FetchWindow window) {
        jiraClient.requireConfigured();
        String jql = buildJql(window);

        List<ActivityRecord> records = new ArrayList<>();
        int startAt = 0;
        while (true) {
            int offset = startAt;
            JiraSearchResponse page = retryEnvelope.execute("jira.search",
                    () -> jiraClient.searchIssues(jql, offset, PAGE_SIZE));
            List<JiraIssueDto> issues = page.getIssues() != null ? page.getIssues() : List.of();
            for (JiraIssueDto issue : issues) {
                records.add(recordMapper.jiraIssueToRecord(issue));
            }
            startAt += issues.size();
            if (issues.isEmpty() || startAt >= page.getTotal()) {
                break;
            }
        }

        log.info("Fetched {} Jira issues for window {}", records.size(), window);
        return records;
    }

    static String buildJql(FetchWindow window) {
        return "updated >= \"" + JQL_FORMAT.format(window.getFrom()) + "\""
                + " AND updated <= \"" + JQL_FORMAT.format(window.getTo()) + "\""
                + " ORDER BY updated ASC, key ASC";
    }
}
