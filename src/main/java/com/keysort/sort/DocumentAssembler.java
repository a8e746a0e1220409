package com.keysort.sort;

import com.keysort.document.Document;
import com.keysort.document.RuleRecord;
import com.keysort.document.Trivia;

import java.util.List;

/**
 * Writes a document back to text with its rules in their new order.
 * <p>
 * Only commas are adjusted: every rule but the last has exactly one, the last one
 * follows the input's trailing-comma style, and stray commas outside comments in
 * leading blocks and trailing comments are dropped. Commas after non-object values
 * are kept. All other text is emitted verbatim.
 */
public class DocumentAssembler {

    public String assemble(Document document, boolean trailingComma) {
        StringBuilder sb = new StringBuilder(document.preamble()).append('[');
        List<RuleRecord> records = document.records();
        for (int i = 0; i < records.size(); i++) {
            RuleRecord record = records.get(i);
            boolean last = i == records.size() - 1;
            String trailing = !last || trailingComma
                    ? Trivia.withOneComma(record.trailingTrivia())
                    : Trivia.withoutCommas(record.trailingTrivia());
            sb.append(Trivia.withoutStrayCommas(record.leadingComments()))
                    .append(record.rawText())
                    .append(trailing);
        }
        return sb.append(Trivia.withoutStrayCommas(document.trailingComments()))
                .append(']')
                .append(document.postamble())
                .toString();
    }
}
