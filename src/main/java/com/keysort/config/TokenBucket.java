package com.keysort.config;

import java.util.List;

/**
 * Named group of identifiers sharing a classification rank.
 *
 * @param name   Bucket name (e.g. "focus")
 * @param match  How entries are matched
 * @param tokens Identifier entries
 */
public record TokenBucket(
        String name,
        MatchStyle match,
        List<String> tokens
) {
    public TokenBucket {
        tokens = List.copyOf(tokens);
    }

    /**
     * Whether the identifier belongs to this bucket.
     */
    public boolean matches(String identifier) {
        if (identifier.isEmpty()) {
            return false;
        }
        for (String token : tokens) {
            boolean hit = match == MatchStyle.PREFIX
                    ? identifier.startsWith(token)
                    : IdentifierPatterns.matchesEntry(identifier, token);
            if (hit) {
                return true;
            }
        }
        return false;
    }
}
