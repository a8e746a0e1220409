package com.keysort.config;

/**
 * Matching of left identifiers against literal list entries.
 */
public final class IdentifierPatterns {

    /**
     * Placeholder standing for any view id inside an entry.
     */
    public static final String VIEW_ID_PLACEHOLDER = "<viewId>";

    private IdentifierPatterns() {
    }

    /**
     * Match with {@link MatchStyle#EXACT} semantics.
     */
    public static boolean matchesEntry(String identifier, String entry) {
        if (entry.isEmpty()) {
            return false;
        }
        if (entry.endsWith(".")) {
            return identifier.startsWith(entry);
        }
        int placeholder = entry.indexOf(VIEW_ID_PLACEHOLDER);
        if (placeholder >= 0) {
            String prefix = entry.substring(0, placeholder);
            String suffix = entry.substring(placeholder + VIEW_ID_PLACEHOLDER.length());
            return identifier.length() >= prefix.length() + suffix.length()
                    && identifier.startsWith(prefix)
                    && identifier.endsWith(suffix);
        }
        return identifier.equals(entry);
    }

    /**
     * Extract the left identifier of an operand: leading parentheses and negations are
     * skipped, then the text up to the first space, parenthesis or comparison operator
     * is taken. For a composite operand this is its first identifier.
     */
    public static String leftIdentifier(String operand) {
        String t = operand.strip();
        int start = 0;
        while (start < t.length()) {
            char c = t.charAt(start);
            if (c != '(' && c != '!' && !Character.isWhitespace(c)) {
                break;
            }
            start++;
        }
        for (int i = start; i < t.length(); i++) {
            char c = t.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == ')'
                    || c == '=' || c == '!' || c == '<' || c == '>' || c == '~') {
                return t.substring(start, i);
            }
        }
        return t.substring(start);
    }

    /**
     * Remove parentheses that enclose the whole text, e.g. "((a || b))" becomes "a || b"
     * while "(a) && (b)" is returned trimmed but otherwise unchanged.
     */
    public static String stripOuterParens(String text) {
        String t = text.strip();
        while (t.length() >= 2 && t.charAt(0) == '(' && closingParen(t) == t.length() - 1) {
            t = t.substring(1, t.length() - 1).strip();
        }
        return t;
    }

    private static int closingParen(String t) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
