package com.example.ingestionservice.dedup;

import com.example.ingestionservice.record.FirefliesTranscriptRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Collapses transcripts that describe the same meeting.
 * 
 * CRITICAL DESIGN:
 * - Exact pass: same transcript id → keep the first seen; records without an id are always kept
 * - Fuzzy pass: same normalized title AND start within 5 minutes AND duration within 10%
 *   of the pair's average (missing duration on either side, or both zero, matches)
 * - Similarity is made transitive with union-find; pairs are only compared inside
 *   one normalized-title bucket
 * - Survivor = highest completeness score, ties keep the earliest record in input order
 * - Survivors keep their input order, so a second pass over the output changes nothing
 */
@Component
@Slf4j
public class TranscriptDeduplicator {

    static final long TIME_WINDOW_MILLIS = Duration.ofMinutes(5).toMillis();
    static final double DURATION_TOLERANCE = 0.10;

    private static final double SENTENCE_WEIGHT = 1.0;
    private static final double PARTICIPANT_WEIGHT = 50.0;
    private static final double RECENCY_WEIGHT = 0.001;
    private static final int TRANSCRIPT_WITHOUT_SENTENCES_UNITS = 100;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    public DedupResult deduplicate(List<FirefliesTranscriptRecord> transcripts) {
        if (transcripts == null || transcripts.isEmpty()) {
            return new DedupResult(List.of(), DedupStats.builder().build());
        }

        List<FirefliesTranscriptRecord> unique = removeExactDuplicates(transcripts);
        int exactRemoved = transcripts.size() - unique.size();

        List<FirefliesTranscriptRecord> survivors = removeFuzzyDuplicates(unique);
        int fuzzyRemoved = unique.size() - survivors.size();

        DedupStats stats = DedupStats.builder()
                .total(transcripts.size())
                .exactDuplicatesRemoved(exactRemoved)
                .fuzzyDuplicatesRemoved(fuzzyRemoved)
                .finalCount(survivors.size())
                .build();

        if (exactRemoved > 0 || fuzzyRemoved > 0) {
            log.info("Transcript dedup: total={}, exactRemoved={}, fuzzyRemoved={}, final={}",
                    stats.getTotal(), exactRemoved, fuzzyRemoved, stats.getFinalCount());
        }
        return new DedupResult(survivors, stats);
    }

    private List<FirefliesTranscriptRecord> removeExactDuplicates(List<FirefliesTranscriptRecord> transcripts) {
        Set<String> seen = new HashSet<>();
        List<FirefliesTranscriptRecord> unique = new ArrayList<>(transcripts.size());
        for (FirefliesTranscriptRecord transcript : transcripts) {
            String id = transcript.getTranscriptId();
            if (id == null || id.isBlank()) {
                unique.add(transcript);
            } else if (seen.add(id)) {
                unique.add(transcript);
            } else {
                log.debug("Exact duplicate transcript id={}", id);
            }
        }
        return unique;
    }

    private List<FirefliesTranscriptRecord> removeFuzzyDuplicates(List<FirefliesTranscriptRecord> unique) {
        Map<String, List<Integer>> buckets = new LinkedHashMap<>();
        for (int i = 0; i < unique.size(); i++) {
            buckets.computeIfAbsent(normalizeTitle(unique.get(i).getTitle()), k -> new ArrayList<>()).add(i);
        }

        UnionFind groups = new UnionFind(unique.size());
        for (List<Integer> bucket : buckets.values()) {
            for (int a = 0; a < bucket.size(); a++) {
                for (int b = a + 1; b < bucket.size(); b++) {
                    int i = bucket.get(a);
                    int j = bucket.get(b);
                    if (isSimilar(unique.get(i), unique.get(j))) {
                        groups.union(i, j);
                    }
                }
            }
        }

        // root → index of the current best member
        Map<Integer, Integer> best = new LinkedHashMap<>();
        for (int i = 0; i < unique.size(); i++) {
            int root = groups.find(i);
            Integer current = best.get(root);
            if (current == null || score(unique.get(i)) > score(unique.get(current))) {
                best.put(root, i);
            }
        }

        Set<Integer> keep = new HashSet<>(best.values());
        List<FirefliesTranscriptRecord> survivors = new ArrayList<>(keep.size());
        for (int i = 0; i < unique.size(); i++) {
            if (keep.contains(i)) {
                survivors.add(unique.get(i));
            }
        }
        return survivors;
    }

    static boolean isSimilar(FirefliesTranscriptRecord a, FirefliesTranscriptRecord b) {
        if (!normalizeTitle(a.getTitle()).equals(normalizeTitle(b.getTitle()))) {
            return false;
        }
        if (a.getDateMillis() == null || b.getDateMillis() == null) {
            return false;
        }
        if (Math.abs(a.getDateMillis() - b.getDateMillis()) > TIME_WINDOW_MILLIS) {
            return false;
        }
        return durationsMatch(a.getDuration(), b.getDuration());
    }

    static boolean durationsMatch(Double a, Double b) {
        if (a == null || b == null) {
            return true;
        }
        if (a == 0 && b == 0) {
            return true;
        }
        double average = (a + b) / 2.0;
        return Math.abs(a - b) <= average * DURATION_TOLERANCE;
    }

    static double score(FirefliesTranscriptRecord transcript) {
        int contentUnits = transcript.getSentenceCount();
        if (contentUnits == 0 && transcript.hasTranscript()) {
            contentUnits = TRANSCRIPT_WITHOUT_SENTENCES_UNITS;
        }
        double ageDays = transcript.getDateMillis() != null ? transcript.getDateMillis() / MILLIS_PER_DAY : 0.0;
        return contentUnits * SENTENCE_WEIGHT
                + transcript.getParticipants().size() * PARTICIPANT_WEIGHT
                + ageDays * RECENCY_WEIGHT;
    }

    static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        return title.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private static final class UnionFind {

        private final int[] parent;

        UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        int find(int i) {
            while (parent[i] != i) {
                parent[i] = parent[parent[i]];
                i = parent[i];
            }
            return i;
        }

        void union(int a, int b) {
            int rootA = find(a);
            int rootB = find(b);
            if (rootA != rootB) {
                parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
            }
        }
    }
}
