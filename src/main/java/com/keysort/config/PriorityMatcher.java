package com.keysort.config;

import com.keysort.exception.ConfigurationException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One entry of the explicit priority list: a literal identifier (or prefix) or a regex.
 *
 * @param entry   Source text of the entry
 * @param pattern Compiled regex, null for literal entries
 */
public record PriorityMatcher(String entry, Pattern pattern) {

    public static PriorityMatcher literal(String entry) {
        return new PriorityMatcher(entry, null);
    }

    public static PriorityMatcher regex(String regex) {
        try {
            return new PriorityMatcher(regex, Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid priority regex '" + regex + "': " + e.getDescription(), e);
        }
    }

    public boolean isRegex() {
        return pattern != null;
    }

    /**
     * Whether the left identifier of an operand matches this entry.
     */
    public boolean matches(String identifier) {
        if (pattern != null) {
            return pattern.matcher(identifier).find();
        }
        return IdentifierPatterns.matchesEntry(identifier, entry);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriorityMatcher that)) return false;
        return entry.equals(that.entry) && isRegex() == that.isRegex();
    }

    @Override
    public int hashCode() {
        return entry.hashCode() * 31 + (isRegex() ? 1 : 0);
    }

    @Override
    public String toString() {
        return isRegex() ? "/" + entry + "/" : entry;
    }
}
