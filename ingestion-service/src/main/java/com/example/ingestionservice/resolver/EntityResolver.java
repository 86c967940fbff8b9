package com.example.ingestionservice.resolver;

import com.example.ingestionservice.metrics.IngestionMetrics;
import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.ActivityRecordVisitor;
import com.example.ingestionservice.record.FirefliesTranscriptRecord;
import com.example.ingestionservice.record.JiraIssueRecord;
import com.example.ingestionservice.record.NotionPageRecord;
import com.example.ingestionservice.record.SlackMessageRecord;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.record.TempoWorklogRecord;
import com.example.ingestionservice.retry.RetryEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Dual-path identity resolution.
 * 
 * CRITICAL DESIGN:
 * - Fast path first: issue key written in the record's own text, zero network calls
 * - Slow path only when the fast path finds nothing: throttled, cached Jira lookup
 * - Transcripts, pages and messages carry their own key (path NONE, never looked up)
 * - Nothing found on either path → unresolved identity, record skipped (not an error)
 * 
 * The caller owns the {@link ResolverCache}: one per batch, created with {@link #newCache()}.
 */
@Component
@Slf4j
public class EntityResolver {

    private final IdentityLookup identityLookup;
    private final LookupThrottle lookupThrottle;
    private final RetryEnvelope retryEnvelope;
    private final IngestionMetrics ingestionMetrics;
    private final IssueKeyExtractor issueKeyExtractor;
    private final boolean resolveEpics;
    private final boolean resolveTeams;

    public EntityResolver(IdentityLookup identityLookup,
                          LookupThrottle lookupThrottle,
                          RetryEnvelope retryEnvelope,
                          IngestionMetrics ingestionMetrics,
                          IssueKeyExtractor issueKeyExtractor,
                          @Value("${ingestion.tempo.resolve-epics:false}") boolean resolveEpics,
                          @Value("${ingestion.tempo.resolve-teams:false}") boolean resolveTeams) {
        this.identityLookup = identityLookup;
        this.lookupThrottle = lookupThrottle;
        this.retryEnvelope = retryEnvelope;
        this.ingestionMetrics = ingestionMetrics;
        this.issueKeyExtractor = issueKeyExtractor;
        this.resolveEpics = resolveEpics;
        this.resolveTeams = resolveTeams;
    }

    public ResolverCache newCache() {
        return new ResolverCache(identityLookup, lookupThrottle, retryEnvelope, ingestionMetrics);
    }

    public CanonicalIdentity resolve(ActivityRecord record, ResolverCache cache) {
        CanonicalIdentity identity = record.accept(new IdentityVisitor(cache));
        ingestionMetrics.recordResolution(record.getSource().key(),
                identity.isResolved() ? identity.getResolutionPath().name().toLowerCase(Locale.ROOT) : "skipped");
        return identity;
    }

    /**
     * Resolve identity and, for worklogs, look up the attributes shown in document
     * metadata. A missing attribute never skips the record.
     */
    public ResolvedRecord resolveRecord(ActivityRecord record, ResolverCache cache) {
        CanonicalIdentity identity = resolve(record, cache);
        if (!identity.isResolved() || !(record instanceof TempoWorklogRecord worklog)) {
            return new ResolvedRecord(record, identity);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        cache.resolve(IdentityKind.DISPLAY_NAME, worklog.getAuthorAccountId())
                .ifPresent(name -> attributes.put(ResolvedRecord.AUTHOR_NAME, name));
        if (resolveEpics) {
            cache.resolve(IdentityKind.EPIC, identity.getResolvedKey())
                    .ifPresent(epic -> attributes.put(ResolvedRecord.EPIC_KEY, epic));
        }
        if (resolveTeams) {
            cache.resolve(IdentityKind.USER_TEAM, worklog.getAuthorAccountId())
                    .ifPresent(team -> attributes.put(ResolvedRecord.TEAM, team));
        }
        return new ResolvedRecord(record, identity, attributes);
    }

    private class IdentityVisitor implements ActivityRecordVisitor<CanonicalIdentity> {

        private final ResolverCache cache;

        IdentityVisitor(ResolverCache cache) {
            this.cache = cache;
        }

        @Override
        public CanonicalIdentity visitIssue(JiraIssueRecord issue) {
            return fastThenSlow(Source.JIRA, issue.getIssueId(), issue.getIssueKey());
        }

        @Override
        public CanonicalIdentity visitWorklog(TempoWorklogRecord worklog) {
            // the worklog id is the document key
            if (worklog.getWorklogId() == null || worklog.getWorklogId().isBlank()) {
                return CanonicalIdentity.unresolved(Source.TEMPO, worklog.getIssueId());
            }
            return fastThenSlow(Source.TEMPO, worklog.getIssueId(), worklog.getDescription());
        }

        @Override
        public CanonicalIdentity visitTranscript(FirefliesTranscriptRecord transcript) {
            return intrinsic(Source.FIREFLIES, transcript.getTranscriptId());
        }

        @Override
        public CanonicalIdentity visitPage(NotionPageRecord page) {
            return intrinsic(Source.NOTION, page.getPageId());
        }

        @Override
        public CanonicalIdentity visitMessage(SlackMessageRecord message) {
            if (message.getChannelId() == null || message.getTs() == null) {
                return CanonicalIdentity.unresolved(Source.SLACK, message.getTs());
            }
            return intrinsic(Source.SLACK, message.getSourceId());
        }

        private CanonicalIdentity fastThenSlow(Source source, String rawIssueId, String text) {
            Optional<String> fast = issueKeyExtractor.extract(text);
            if (fast.isPresent()) {
                return CanonicalIdentity.builder()
                        .source(source)
                        .rawId(rawIssueId)
                        .resolvedKey(fast.get())
                        .resolutionPath(ResolutionPath.FAST)
                        .build();
            }

            Optional<String> slow = cache.resolve(IdentityKind.ISSUE_KEY, rawIssueId);
            if (slow.isPresent()) {
                return CanonicalIdentity.builder()
                        .source(source)
                        .rawId(rawIssueId)
                        .resolvedKey(slow.get())
                        .resolutionPath(ResolutionPath.AUTHORITATIVE)
                        .build();
            }

            log.debug("No identity for {} record rawId={}", source.key(), rawIssueId);
            return CanonicalIdentity.unresolved(source, rawIssueId);
        }

        private CanonicalIdentity intrinsic(Source source, String sourceId) {
            if (sourceId == null || sourceId.isBlank()) {
                return CanonicalIdentity.unresolved(source, sourceId);
            }
            return CanonicalIdentity.builder()
                    .source(source)
                    .rawId(sourceId)
                    .resolvedKey(sourceId)
                    .resolutionPath(ResolutionPath.NONE)
                    .build();
        }
    }
}
