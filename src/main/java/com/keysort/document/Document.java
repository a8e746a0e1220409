package com.keysort.document;

import java.util.List;

/**
 * A binding document: the rule array and the text around it.
 *
 * @param preamble         Text before the opening bracket
 * @param records          Rules in current order
 * @param trailingComments Array body after the last rule
 * @param postamble        Text after the closing bracket
 */
public record Document(
        String preamble,
        List<RuleRecord> records,
        String trailingComments,
        String postamble
) {
    public Document {
        records = List.copyOf(records);
    }

    public Document withRecords(List<RuleRecord> records) {
        return new Document(preamble, records, trailingComments, postamble);
    }

    /**
     * Whether the last rule in input order carries a trailing comma.
     */
    public boolean hasTrailingComma() {
        RuleRecord last = null;
        for (RuleRecord record : records) {
            if (last == null || record.position() > last.position()) {
                last = record;
            }
        }
        return (last != null && Trivia.hasComma(last.trailingTrivia())) || Trivia.hasComma(trailingComments);
    }
}
