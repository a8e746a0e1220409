package com.keysort.document;

/**
 * One rule of the document with its surrounding text.
 *
 * @param position           Index in input order
 * @param leadingComments    Whitespace and comments before the object
 * @param rawText            Object source, possibly with a rewritten condition or inserted comments
 * @param trailingTrivia     Commas and comments after the object on its line
 * @param fields             Extracted fields, null when the object could not be parsed
 * @param canonicalCondition Canonical condition, empty when absent or unparsed
 * @param conditionRewritten Whether the condition literal in {@code rawText} was replaced
 */
public record RuleRecord(
        int position,
        String leadingComments,
        String rawText,
        String trailingTrivia,
        RuleFields fields,
        String canonicalCondition,
        boolean conditionRewritten
) {
    public RuleRecord {
        canonicalCondition = canonicalCondition == null ? "" : canonicalCondition;
    }

    public boolean parseOk() {
        return fields != null;
    }

    public String trigger() {
        return parseOk() ? fields.trigger() : "";
    }

    public RuleRecord withRawText(String rawText) {
        return new RuleRecord(position, leadingComments, rawText, trailingTrivia, fields, canonicalCondition, conditionRewritten);
    }

    /**
     * Insert a line comment inside the object, just before its closing brace and
     * indented like the brace line. When the brace shares the first line of the
     * object, the indentation of the rule's own line in the leading block is used.
     */
    public RuleRecord withInlineComment(String comment) {
        int brace = rawText.lastIndexOf('}');
        if (brace < 0) {
            return this;
        }
        int lineStart = rawText.lastIndexOf('\n', brace - 1) + 1;
        String beforeBrace = rawText.substring(lineStart, brace);
        String annotated;
        if (beforeBrace.isBlank()) {
            annotated = rawText.substring(0, lineStart) + leadingWhitespace(beforeBrace) + comment + "\n"
                    + rawText.substring(lineStart);
        } else {
            String indent = lineStart == 0
                    ? leadingWhitespace(leadingComments.substring(leadingComments.lastIndexOf('\n') + 1))
                    : leadingWhitespace(beforeBrace);
            annotated = rawText.substring(0, brace).stripTrailing() + "\n" + indent + comment + "\n" + indent
                    + rawText.substring(brace);
        }
        return withRawText(annotated);
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }
}
