package com.keysort.sort;

import com.keysort.canonical.Canonicalizer;
import com.keysort.canonical.CompositeKey;
import com.keysort.config.ClassificationProfiles;
import com.keysort.config.SortPolicy;
import com.keysort.document.Document;
import com.keysort.document.DocumentLoader;
import com.keysort.document.FieldExtractor;
import com.keysort.document.RuleFieldNames;
import com.keysort.document.RuleRecord;
import com.keysort.document.StructuralSegmenter;
import com.keysort.exception.DocumentStructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sorts a binding document.
 * <p>
 * Pipeline: segment and load the rules, canonicalize and rewrite their conditions,
 * stable-sort by record key, apply focus placement, annotate duplicates (and ids when
 * enabled), then reassemble the text with comments and comma style preserved.
 */
public class KeybindingSorter {

    private static final Logger log = LoggerFactory.getLogger(KeybindingSorter.class);

    private final SortPolicy policy;
    private final Canonicalizer canonicalizer;
    private final DocumentLoader loader;
    private final RecordSortKeys sortKeys = new RecordSortKeys();
    private final FocusPlacement focusPlacement;
    private final DuplicateDetector duplicateDetector;
    private final IdAnnotator idAnnotator;
    private final DocumentAssembler assembler = new DocumentAssembler();

    /**
     * @param idAnnotator Identifier checks, null to skip them
     */
    public KeybindingSorter(SortPolicy policy,
                            StructuralSegmenter segmenter,
                            FieldExtractor extractor,
                            Canonicalizer canonicalizer,
                            DuplicateDetector duplicateDetector,
                            IdAnnotator idAnnotator) {
        this.policy = policy;
        this.canonicalizer = canonicalizer;
        this.loader = new DocumentLoader(segmenter, extractor, canonicalizer);
        this.focusPlacement = new FocusPlacement(canonicalizer.getClassifier());
        this.duplicateDetector = duplicateDetector;
        this.idAnnotator = idAnnotator;
    }

    /**
     * Sorter with default collaborators and no identifier checks.
     */
    public static KeybindingSorter create(ClassificationProfiles profiles, SortPolicy policy, RuleFieldNames names) {
        return new KeybindingSorter(policy,
                new StructuralSegmenter(),
                new FieldExtractor(names),
                new Canonicalizer(profiles),
                new DuplicateDetector(new ChordNormalizer(profiles.modifierOrder()), names),
                null);
    }

    /**
     * Summary of one run.
     *
     * @param text       Output document
     * @param records    Number of rules
     * @param rewritten  Rules whose condition was canonicalized in place
     * @param unparsed   Rules passed through unparsed
     * @param duplicates Duplicate rules annotated
     */
    public record Outcome(String text, int records, int rewritten, int unparsed, int duplicates) {
    }

    /**
     * Sort a document and return its new text.
     *
     * @throws DocumentStructureException if the text has no top-level array
     */
    public String sort(String text) {
        return process(text).text();
    }

    public Outcome process(String text) {
        Document document = loader.load(text, policy);
        List<RuleRecord> records = document.records();

        Map<RuleRecord, CompositeKey> keys = new HashMap<>();
        records.forEach(record -> keys.put(record, sortKeys.keyFor(record, policy)));
        List<RuleRecord> ordered = records.stream()
                .sorted(Comparator.comparing(keys::get))
                .toList();
        ordered = focusPlacement.apply(ordered, policy.grouping());

        DuplicateDetector.Result duplicates = duplicateDetector.annotate(ordered);
        ordered = duplicates.records();
        if (idAnnotator != null) {
            IdAnnotator.Result ids = idAnnotator.annotate(ordered);
            ordered = ids.records();
            log.info("Identifier check: {} duplicate, {} missing, {} failed",
                    ids.duplicates(), ids.missing(), ids.failed());
        }

        String output = assembler.assemble(document.withRecords(ordered), document.hasTrailingComma());

        int rewritten = (int) records.stream().filter(RuleRecord::conditionRewritten).count();
        int unparsed = (int) records.stream().filter(record -> !record.parseOk()).count();
        log.info("Sorted {} rules: {} conditions rewritten, {} unparsed, {} duplicates, {} cached conditions",
                records.size(), rewritten, unparsed, duplicates.duplicates(), canonicalizer.cacheSize());

        return new Outcome(output, records.size(), rewritten, unparsed, duplicates.duplicates());
    }
}
