package com.keysort.sort;

import com.keysort.document.RuleFieldNames;
import com.keysort.document.RuleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that every rule carries a unique short identifier.
 * <p>
 * A repeated identifier is flagged, a missing one gets a freshly allocated proposal.
 * When allocation runs out of attempts the rule is marked as failed instead; an
 * identifier is never reused.
 */
public class IdAnnotator {

    private static final Logger log = LoggerFactory.getLogger(IdAnnotator.class);

    private final IdExtractor extractor;
    private final IdAllocator allocator;
    private final RuleFieldNames names;

    public IdAnnotator(IdExtractor extractor, IdAllocator allocator, RuleFieldNames names) {
        this.extractor = extractor;
        this.allocator = allocator;
        this.names = names;
    }

    /**
     * Annotated rules with counts per outcome.
     */
    public record Result(List<RuleRecord> records, int duplicates, int missing, int failed) {
    }

    public Result annotate(List<RuleRecord> ordered) {
        List<Optional<String>> ids = ordered.stream()
                .map(extractor::extract)
                .map(id -> id.map(value -> value.toLowerCase(Locale.ROOT)))
                .toList();

        Set<String> used = new HashSet<>();
        ids.forEach(id -> id.ifPresent(used::add));

        Set<String> seen = new HashSet<>();
        List<RuleRecord> result = new ArrayList<>(ordered.size());
        int duplicates = 0;
        int missing = 0;
        int failed = 0;

        for (int i = 0; i < ordered.size(); i++) {
            RuleRecord record = ordered.get(i);
            if (!record.parseOk()) {
                result.add(record);
                continue;
            }
            String label = record.trigger() + "/" + record.canonicalCondition();
            Optional<String> id = ids.get(i);

            if (id.isPresent()) {
                if (seen.add(id.get())) {
                    result.add(record);
                } else {
                    log.warn("Duplicate id {} on rule #{} ({})", id.get(), record.position() + 1, label);
                    result.add(record.withInlineComment("// DUPLICATE id " + id.get() + " detected for " + label));
                    duplicates++;
                }
                continue;
            }

            Optional<String> allocated = allocator.allocate(used);
            if (allocated.isPresent()) {
                seen.add(allocated.get());
                result.add(record.withInlineComment("// MISSING id: \"" + names.action() + "\": \""
                        + record.trigger() + " " + allocated.get() + "\","));
                missing++;
            } else {
                log.warn("Failed to allocate an id for rule #{} ({})", record.position() + 1, label);
                result.add(record.withInlineComment("// FAILED generating id for " + label));
                failed++;
            }
        }
        return new Result(result, duplicates, missing, failed);
    }
}
