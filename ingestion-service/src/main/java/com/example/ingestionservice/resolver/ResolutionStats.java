package com.example.ingestionservice.resolver;

import lombok.Getter;

/**
 * Per-batch counts of how identities were obtained.
 * A falling fast/slow ratio means the key heuristic is drifting.
 */
@Getter
public class ResolutionStats {

    private int fastPath;
    private int slowPath;
    private int direct;
    private int skipped;

    public void record(CanonicalIdentity identity) {
        if (!identity.isResolved()) {
            skipped++;
            return;
        }
        switch (identity.getResolutionPath()) {
            case FAST -> fastPath++;
            case AUTHORITATIVE -> slowPath++;
            case NONE -> direct++;
        }
    }

    public int total() {
        return fastPath + slowPath + direct + skipped;
    }
}
