package com.example.ingestionservice.vector;

import com.example.ingestionservice.client.external.ExternalApiException;
import com.example.ingestionservice.metrics.IngestionMetrics;
import com.example.ingestionservice.record.JiraIssueRecord;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.record.TempoWorklogRecord;
import com.example.ingestionservice.resolver.CanonicalIdentity;
import com.example.ingestionservice.resolver.ResolutionPath;
import com.example.ingestionservice.resolver.ResolvedRecord;
import com.example.ingestionservice.retry.RetryTestSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Embedding, batching and overwrite semantics of the vector sink.
 */
class VectorIngestionSinkTest {

    private static final Instant T0 = Instant.parse("2024-11-01T10:00:00Z");

    private InMemoryVectorStore store;
    private HashingEmbeddingService embeddings;
    private SimpleMeterRegistry meterRegistry;
    private VectorIngestionSink sink;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        embeddings = new HashingEmbeddingService();
        meterRegistry = new SimpleMeterRegistry();
        sink = sinkWithBatchSize(embeddings, 3);
    }

    private VectorIngestionSink sinkWithBatchSize(EmbeddingService embeddingService, int batchSize) {
        IngestionMetrics metrics = new IngestionMetrics(meterRegistry);
        return new VectorIngestionSink(store, embeddingService, new VectorDocumentFactory("https://acme.atlassian.net"),
                RetryTestSupport.noBackoff(metrics, 1), metrics, batchSize);
    }

    private static ResolvedRecord issue(String key, String summary, Instant updated) {
        JiraIssueRecord record = JiraIssueRecord.builder()
                .issueId("id-" + key)
                .issueKey(key)
                .projectKey("SUBS")
                .summary(summary)
                .description("details of " + summary)
                .updated(updated)
                .build();
        CanonicalIdentity identity = CanonicalIdentity.builder()
                .source(Source.JIRA)
                .rawId(record.getIssueId())
                .resolvedKey(key)
                .resolutionPath(ResolutionPath.FAST)
                .build();
        return new ResolvedRecord(record, identity);
    }

    private static List<ResolvedRecord> issues(int count) {
        List<ResolvedRecord> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            records.add(issue("SUBS-" + i, "summary " + i, T0.plusSeconds(i)));
        }
        return records;
    }

    @Test
    void testUpsert_SameKeyTenMinutesApart_OneDocumentWithLaterContent() {
        // GIVEN
        ResolvedRecord earlier = issue("SUBS-482", "Login redirect broken", T0);
        ResolvedRecord later = issue("SUBS-482", "Login redirect fixed", T0.plus(Duration.ofMinutes(10)));

        // WHEN: the later version arrives first in the input
        SinkResult result = sink.upsert(List.of(later, earlier));

        // THEN
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("jira-SUBS-482").getContent()).contains("Login redirect fixed");
        assertThat(result.getIngested()).isEqualTo(1);
        assertThat(result.getCollapsedDuplicates()).isEqualTo(1);
    }

    @Test
    void testUpsert_WorklogWithoutId_SkippedOthersIngested() {
        // GIVEN: a resolved worklog that has no worklog id to key its document on
        TempoWorklogRecord worklog = TempoWorklogRecord.builder()
                .issueId("10482")
                .description("SUBS-482 pairing")
                .timeSpentSeconds(1800)
                .authorAccountId("acc-1")
                .startDate(LocalDate.of(2024, 11, 1))
                .updated(T0)
                .build();
        ResolvedRecord keyless = new ResolvedRecord(worklog, CanonicalIdentity.builder()
                .source(Source.TEMPO)
                .rawId("10482")
                .resolvedKey("SUBS-482")
                .resolutionPath(ResolutionPath.FAST)
                .build());

        // WHEN
        SinkResult result = sink.upsert(List.of(issue("SUBS-1", "good issue", T0), keyless));

        // THEN
        assertThat(result.getIngested()).isEqualTo(1);
        assertThat(result.getInvalidDocuments()).isEqualTo(1);
        assertThat(store.get("jira-SUBS-1")).isNotNull();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void testUpsert_ReingestAcrossRuns_OverwritesInsteadOfDuplicating() {
        sink.upsert(List.of(issue("SUBS-7", "first version", T0)));
        sink.upsert(List.of(issue("SUBS-7", "second version", T0.plusSeconds(600))));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("jira-SUBS-7").getTitle()).isEqualTo("SUBS-7: second version");
    }

    @Test
    void testUpsert_SplitsIntoBatches() {
        SinkResult result = sink.upsert(issues(7));

        assertThat(store.getBatchSizes()).containsExactly(3, 3, 1);
        assertThat(result.getIngested()).isEqualTo(7);
        assertThat(result.getFailedBatches()).isZero();
    }

    @Test
    void testUpsert_FailedBatch_ExcludedFromCountLaterBatchesStillWritten() {
        // GIVEN: the batch holding SUBS-4 always fails
        store.failBatchesWhere(batch -> batch.stream().anyMatch(d -> d.getId().equals("jira-SUBS-4")));

        // WHEN
        SinkResult result = sink.upsert(issues(7));

        // THEN
        assertThat(result.getIngested()).isEqualTo(4);
        assertThat(result.getFailedBatches()).isEqualTo(1);
        assertThat(result.getErrors()).hasSize(1);
        assertThat(store.get("jira-SUBS-4")).isNull();
        assertThat(store.get("jira-SUBS-7")).isNotNull();
        assertThat(meterRegistry.get("vector_upsert_batch_failures_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testUpsert_EmbeddingFails_RecordSkippedOthersContinue() {
        // GIVEN
        EmbeddingService flaky = text -> {
            if (text.contains("summary 2")) {
                throw new ExternalApiException("openai", 400, "input rejected");
            }
            return embeddings.embed(text);
        };
        VectorIngestionSink flakySink = sinkWithBatchSize(flaky, 100);

        // WHEN
        SinkResult result = flakySink.upsert(issues(3));

        // THEN
        assertThat(result.getIngested()).isEqualTo(2);
        assertThat(result.getEmbeddingFailures()).isEqualTo(1);
        assertThat(store.get("jira-SUBS-2")).isNull();
        assertThat(meterRegistry.get("embedding_failures_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testUpsert_EmptyEmbedding_CountedAsFailure() {
        VectorIngestionSink emptySink = sinkWithBatchSize(text -> List.of(), 100);

        SinkResult result = emptySink.upsert(issues(2));

        assertThat(result.getIngested()).isZero();
        assertThat(result.getEmbeddingFailures()).isEqualTo(2);
        assertThat(store.getUpsertCalls()).isZero();
    }

    @Test
    void testUpsert_RejectedCredentials_Aborts() {
        VectorIngestionSink unauthorized = sinkWithBatchSize(text -> {
            throw new ExternalApiException.AuthenticationException("openai", 401);
        }, 100);

        assertThatThrownBy(() -> unauthorized.upsert(issues(2)))
                .isInstanceOf(ExternalApiException.AuthenticationException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void testUpsert_UnresolvedRecord_Ignored() {
        JiraIssueRecord record = JiraIssueRecord.builder().issueId("1").summary("orphan").updated(T0).build();
        ResolvedRecord unresolved = new ResolvedRecord(record, CanonicalIdentity.unresolved(Source.JIRA, "1"));

        SinkResult result = sink.upsert(List.of(unresolved));

        assertThat(result.getIngested()).isZero();
        assertThat(embeddings.getCalls()).isZero();
    }

    @Test
    void testUpsert_EmptyInput_NoCalls() {
        assertThat(sink.upsert(List.of()).getIngested()).isZero();
        assertThat(store.getUpsertCalls()).isZero();
    }

    @Test
    void testQuery_FilterAndRanking() {
        // GIVEN
        sink.upsert(List.of(
                issue("SUBS-1", "login redirect loop", T0),
                issue("SUBS-2", "billing invoice totals", T0.plusSeconds(60)),
                issue("SUBS-3", "login page styling", T0.plusSeconds(120))));

        // WHEN
        List<VectorMatch> matches = sink.query("login redirect", MetadataFilter.create().eq("source", "jira"), 2);
        List<VectorMatch> filtered = sink.query("login redirect",
                MetadataFilter.create().range(VectorDocumentFactory.TIMESTAMP_EPOCH, T0.getEpochSecond() + 30, null), 5);

        // THEN
        assertThat(matches).hasSize(2);
        assertThat(matches.get(0).getId()).isEqualTo("jira-SUBS-1");
        assertThat(filtered).extracting(VectorMatch::getId).containsExactlyInAnyOrder("jira-SUBS-2", "jira-SUBS-3");
    }

    @Test
    void testConstructor_InvalidBatchSize_Rejected() {
        assertThatThrownBy(() -> sinkWithBatchSize(embeddings, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
