package com.example.ingestionservice.dedup;

import com.example.ingestionservice.record.FirefliesTranscriptRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptDeduplicatorTest {

    private static final long START = 1_730_455_200_000L; // 2024-11-01T10:00:00Z
    private static final long MINUTE = 60_000L;

    private final TranscriptDeduplicator deduplicator = new TranscriptDeduplicator();

    private static FirefliesTranscriptRecord transcript(String id, String title, long dateMillis, Double duration,
                                                        int sentences, String... participants) {
        return FirefliesTranscriptRecord.builder()
                .transcriptId(id)
                .title(title)
                .dateMillis(dateMillis)
                .duration(duration)
                .sentenceCount(sentences)
                .hasTranscript(sentences > 0)
                .participants(List.of(participants))
                .content("content of " + id)
                .build();
    }

    private static List<String> ids(List<FirefliesTranscriptRecord> transcripts) {
        List<String> ids = new ArrayList<>();
        for (FirefliesTranscriptRecord transcript : transcripts) {
            ids.add(transcript.getTranscriptId());
        }
        return ids;
    }

    @Test
    void testDeduplicate_ThreeVersionsOfSameMeeting_KeepsMostComplete() {
        // GIVEN: the same meeting re-reported twice with more content each time
        List<FirefliesTranscriptRecord> input = List.of(
                transcript("t1", "Weekly Sync", START, 30.0, 0),
                transcript("t2", "weekly  sync ", START + 2 * MINUTE, 31.0, 120, "ana", "ben"),
                transcript("t3", "Weekly sync", START + 4 * MINUTE, 29.0, 40, "ana"));

        // WHEN
        DedupResult result = deduplicator.deduplicate(input);

        // THEN
        assertThat(ids(result.getSurvivors())).containsExactly("t2");
        assertThat(result.getStats().getTotal()).isEqualTo(3);
        assertThat(result.getStats().getExactDuplicatesRemoved()).isZero();
        assertThat(result.getStats().getFuzzyDuplicatesRemoved()).isEqualTo(2);
        assertThat(result.getStats().getFinalCount()).isEqualTo(1);
    }

    @Test
    void testDeduplicate_SameId_KeepsFirstSeen() {
        FirefliesTranscriptRecord first = transcript("t1", "Planning", START, 60.0, 10);
        FirefliesTranscriptRecord again = transcript("t1", "Planning (edited)", START, 60.0, 500);

        DedupResult result = deduplicator.deduplicate(List.of(first, again));

        assertThat(result.getSurvivors()).containsExactly(first);
        assertThat(result.getStats().getExactDuplicatesRemoved()).isEqualTo(1);
    }

    @Test
    void testDeduplicate_StartsTooFarApart_BothKept() {
        List<FirefliesTranscriptRecord> input = List.of(
                transcript("t1", "Standup", START, 15.0, 50),
                transcript("t2", "Standup", START + 6 * MINUTE, 15.0, 50));

        assertThat(ids(deduplicator.deduplicate(input).getSurvivors())).containsExactly("t1", "t2");
    }

    @Test
    void testDeduplicate_FiveMinutesApartDurationsWithinTenPercent_Collapsed() {
        // GIVEN: starts exactly 5 minutes apart, durations 40 and 43 (about 7% apart)
        List<FirefliesTranscriptRecord> input = List.of(
                transcript("t1", "Standup", START, 40.0, 10),
                transcript("t2", "Standup", START + 5 * MINUTE, 43.0, 90));

        // WHEN
        DedupResult result = deduplicator.deduplicate(input);

        // THEN: both bounds are inclusive, richer copy survives
        assertThat(ids(result.getSurvivors())).containsExactly("t2");
        assertThat(result.getStats().getFuzzyDuplicatesRemoved()).isEqualTo(1);
    }

    @Test
    void testDeduplicate_DurationsDiffer_BothKept() {
        List<FirefliesTranscriptRecord> input = List.of(
                transcript("t1", "Standup", START, 15.0, 50),
                transcript("t2", "Standup", START + MINUTE, 45.0, 50));

        assertThat(deduplicator.deduplicate(input).getSurvivors()).hasSize(2);
    }

    @Test
    void testDeduplicate_DifferentTitles_BothKept() {
        List<FirefliesTranscriptRecord> input = List.of(
                transcript("t1", "Standup", START, 15.0, 50),
                transcript("t2", "Retro", START, 15.0, 50));

        assertThat(deduplicator.deduplicate(input).getSurvivors()).hasSize(2);
    }

    @Test
    void testDeduplicate_ChainedSimilarity_CollapsesWholeGroup() {
        // GIVEN: t1~t2 and t2~t3, but t1 and t3 are 8 minutes apart
        List<FirefliesTranscriptRecord> input = List.of(
                transcript("t1", "Demo", START, null, 10),
                transcript("t2", "Demo", START + 4 * MINUTE, null, 20),
                transcript("t3", "Demo", START + 8 * MINUTE, null, 5));

        DedupResult result = deduplicator.deduplicate(input);

        assertThat(ids(result.getSurvivors())).containsExactly("t2");
    }

    @Test
    void testDeduplicate_EqualScores_KeepsEarliestInInput() {
        List<FirefliesTranscriptRecord> input = List.of(
                transcript("t1", "Sync", START, 30.0, 10),
                transcript("t2", "Sync", START, 30.0, 10));

        assertThat(ids(deduplicator.deduplicate(input).getSurvivors())).containsExactly("t1");
    }

    @Test
    void testDeduplicate_RunTwice_SecondPassChangesNothing() {
        List<FirefliesTranscriptRecord> input = new ArrayList<>(List.of(
                transcript("t1", "Weekly Sync", START, 30.0, 0),
                transcript("t2", "Weekly Sync", START + MINUTE, 30.0, 80, "ana"),
                transcript("t3", "Retro", START, 60.0, 10),
                transcript("t1", "Weekly Sync", START, 30.0, 0),
                transcript("t4", "Standup", START + 30 * MINUTE, 15.0, 3)));

        List<FirefliesTranscriptRecord> once = deduplicator.deduplicate(input).getSurvivors();
        DedupResult twice = deduplicator.deduplicate(once);

        assertThat(twice.getSurvivors()).containsExactlyElementsOf(once);
        assertThat(twice.getStats().getExactDuplicatesRemoved()).isZero();
        assertThat(twice.getStats().getFuzzyDuplicatesRemoved()).isZero();
    }

    @Test
    void testDeduplicate_InputOrderOfGroups_DoesNotChangeSurvivorSet() {
        List<FirefliesTranscriptRecord> input = new ArrayList<>(List.of(
                transcript("t1", "Weekly Sync", START, 30.0, 0),
                transcript("t2", "Weekly Sync", START + MINUTE, 30.0, 80, "ana"),
                transcript("t3", "Retro", START, 60.0, 10)));
        List<FirefliesTranscriptRecord> reversed = new ArrayList<>(input);
        Collections.reverse(reversed);

        assertThat(ids(deduplicator.deduplicate(reversed).getSurvivors()))
                .containsExactlyInAnyOrderElementsOf(ids(deduplicator.deduplicate(input).getSurvivors()));
    }

    @Test
    void testDeduplicate_MissingIdOrDate_Kept() {
        // GIVEN: records without an id skip the exact pass, records without a date are never similar
        FirefliesTranscriptRecord noId = FirefliesTranscriptRecord.builder().title("Sync").dateMillis(START).build();
        FirefliesTranscriptRecord otherNoId = FirefliesTranscriptRecord.builder()
                .title("Sync").dateMillis(START + 20 * MINUTE).build();
        FirefliesTranscriptRecord noDate = FirefliesTranscriptRecord.builder().transcriptId("t9").title("Sync").build();
        FirefliesTranscriptRecord noDateEither = FirefliesTranscriptRecord.builder().transcriptId("t10").title("Sync").build();

        // WHEN
        DedupResult result = deduplicator.deduplicate(List.of(noId, otherNoId, noDate, noDateEither));

        // THEN
        assertThat(result.getSurvivors()).containsExactly(noId, otherNoId, noDate, noDateEither);
        assertThat(result.getStats().getExactDuplicatesRemoved()).isZero();
    }

    @Test
    void testDeduplicate_Empty_ReturnsEmpty() {
        DedupResult result = deduplicator.deduplicate(List.of());

        assertThat(result.getSurvivors()).isEmpty();
        assertThat(result.getStats().getFinalCount()).isZero();
    }

    @Test
    void testDurationsMatch_ToleranceRelativeToAverage() {
        assertThat(TranscriptDeduplicator.durationsMatch(30.0, 33.0)).isTrue();
        assertThat(TranscriptDeduplicator.durationsMatch(30.0, 34.0)).isFalse();
        assertThat(TranscriptDeduplicator.durationsMatch(null, 34.0)).isTrue();
        assertThat(TranscriptDeduplicator.durationsMatch(0.0, 0.0)).isTrue();
    }

    @Test
    void testScore_TranscriptFlagWithoutSentences_CountsAsContent() {
        FirefliesTranscriptRecord flagged = FirefliesTranscriptRecord.builder()
                .transcriptId("a").dateMillis(START).hasTranscript(true).build();
        FirefliesTranscriptRecord empty = FirefliesTranscriptRecord.builder()
                .transcriptId("b").dateMillis(START).build();

        assertThat(TranscriptDeduplicator.score(flagged)).isGreaterThan(TranscriptDeduplicator.score(empty) + 99);
    }
}
