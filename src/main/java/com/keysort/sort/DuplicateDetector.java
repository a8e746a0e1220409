package com.keysort.sort;

import com.keysort.document.RuleFieldNames;
import com.keysort.document.RuleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags rules whose (normalized trigger, canonical condition) pair was already seen.
 * Later occurrences get an inline comment; nothing is removed. Unparsed rules are skipped.
 */
public class DuplicateDetector {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final ChordNormalizer normalizer;
    private final RuleFieldNames names;

    public DuplicateDetector(ChordNormalizer normalizer, RuleFieldNames names) {
        this.normalizer = normalizer;
        this.names = names;
    }

    /**
     * Annotated rules and the number of duplicates found.
     */
    public record Result(List<RuleRecord> records, int duplicates) {
    }

    /**
     * Annotate duplicates in output order.
     */
    public Result annotate(List<RuleRecord> ordered) {
        Set<Pair> seen = new HashSet<>();
        List<RuleRecord> result = new ArrayList<>(ordered.size());
        int duplicates = 0;

        for (RuleRecord record : ordered) {
            if (record.parseOk()
                    && !seen.add(new Pair(normalizer.normalize(record.trigger()), record.canonicalCondition()))) {
                String comment = "// DUPLICATE " + names.trigger() + ": '" + record.trigger() + "' "
                        + names.condition() + ": '" + record.canonicalCondition() + "'";
                log.warn("Duplicate rule #{}: {} '{}' {} '{}'", record.position() + 1,
                        names.trigger(), record.trigger(), names.condition(), record.canonicalCondition());
                result.add(record.withInlineComment(comment));
                duplicates++;
            } else {
                result.add(record);
            }
        }
        return new Result(result, duplicates);
    }

    private record Pair(String trigger, String condition) {
    }
}
