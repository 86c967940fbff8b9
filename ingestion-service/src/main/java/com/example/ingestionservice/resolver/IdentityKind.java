package com.example.ingestionservice.resolver;

/**
 * Kinds of identity the authoritative lookup can answer. Each kind gets its
 * own cache inside {@link ResolverCache}.
 */
public enum IdentityKind {
    /** Numeric Jira issue id → issue key (SUBS-482). */
    ISSUE_KEY,
    /** Atlassian account id → Tempo team name. */
    USER_TEAM,
    /** Issue key → epic key (the issue itself when it is an epic). */
    EPIC,
    /** Atlassian account id → display name. */
    DISPLAY_NAME
}
