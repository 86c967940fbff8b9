package com.example.ingestionservice.resolver;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fast-path heuristic: finds an issue key written in free text.
 * 
 * A candidate is any run of alphanumeric tokens joined by hyphens. Inside a run, the
 * first pair of adjacent tokens made of upper-case letters then digits is the key, so
 * "feature/SUBS-482-login" gives "SUBS-482". A run without such a pair gives nothing:
 * "2024-11-01" never matches because its first token is not letters.
 */
@Component
public class IssueKeyExtractor {

    private static final Pattern CANDIDATE = Pattern.compile("[A-Za-z0-9]+(?:-[A-Za-z0-9]+)+");
    private static final Pattern PROJECT_TOKEN = Pattern.compile("[A-Z]+");
    private static final Pattern NUMBER_TOKEN = Pattern.compile("\\d+");

    public Optional<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = CANDIDATE.matcher(text);
        while (matcher.find()) {
            String[] tokens = matcher.group().split("-");
            for (int i = 0; i + 1 < tokens.length; i++) {
                String candidate = tokens[i] + "-" + tokens[i + 1];
                if (isWellFormed(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    public boolean isWellFormed(String candidate) {
        if (candidate == null) {
            return false;
        }
        String[] tokens = candidate.split("-", -1);
        return tokens.length == 2
                && PROJECT_TOKEN.matcher(tokens[0]).matches()
                && NUMBER_TOKEN.matcher(tokens[1]).matches();
    }

    public static String projectOf(String issueKey) {
        int dash = issueKey.indexOf('-');
        return dash > 0 ? issueKey.substring(0, dash) : issueKey;
    }
}
