package com.example.ingestionservice.client.external;

import com.example.ingestionservice.resolver.IdentityKind;
import com.example.ingestionservice.resolver.IdentityLookup;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Authoritative lookups backed by Jira (issues, users, epics) and Tempo (teams).
 */
@Component
@RequiredArgsConstructor
public class JiraIdentityLookup implements IdentityLookup {

    private final JiraClient jiraClient;
    private final TempoClient tempoClient;

    @Override
    public Optional<String> lookup(IdentityKind kind, String rawId) {
        return switch (kind) {
            case ISSUE_KEY -> jiraClient.getIssueKey(rawId);
            case DISPLAY_NAME -> jiraClient.getDisplayName(rawId);
            case EPIC -> jiraClient.getEpicKey(rawId);
            case USER_TEAM -> tempoClient.getTeamName(rawId);
        };
    }
}
