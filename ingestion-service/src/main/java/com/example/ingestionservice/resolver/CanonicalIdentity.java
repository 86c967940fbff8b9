package com.example.ingestionservice.resolver;

import com.example.ingestionservice.record.Source;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Durable identity a raw record resolved to.
 * 
 * resolvedKey == null means unresolved: the record is skipped, not failed.
 */
@Getter
@Builder
@ToString
public class CanonicalIdentity {

    private final Source source;
    private final String rawId;
    private final String resolvedKey;
    private final ResolutionPath resolutionPath;

    public boolean isResolved() {
        return resolvedKey != null;
    }

    public static CanonicalIdentity unresolved(Source source, String rawId) {
        return CanonicalIdentity.builder()
                .source(source)
                .rawId(rawId)
                .resolutionPath(ResolutionPath.NONE)
                .build();
    }
}
