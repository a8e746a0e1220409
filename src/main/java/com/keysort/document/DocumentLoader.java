package com.keysort.document;

import com.keysort.canonical.Canonicalizer;
import com.keysort.config.SortPolicy;
import com.keysort.exception.DocumentStructureException;
import com.keysort.exception.RuleFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns document text into records with extracted fields and canonical conditions.
 * <p>
 * A rule that cannot be parsed is kept verbatim with {@code parseOk() == false}.
 * A parsed rule whose canonical condition differs from its raw condition gets the
 * condition literal rewritten in place.
 */
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private final StructuralSegmenter segmenter;
    private final FieldExtractor extractor;
    private final Canonicalizer canonicalizer;

    public DocumentLoader(StructuralSegmenter segmenter, FieldExtractor extractor, Canonicalizer canonicalizer) {
        this.segmenter = segmenter;
        this.extractor = extractor;
        this.canonicalizer = canonicalizer;
    }

    /**
     * Load a document.
     *
     * @throws DocumentStructureException if the text has no top-level array
     */
    public Document load(String text, SortPolicy policy) {
        SegmentedArray array = segmenter.segment(text)
                .orElseThrow(() -> new DocumentStructureException("No top-level array found in input"));

        List<RuleRecord> records = new ArrayList<>();
        List<Segment> segments = array.segments();
        for (int i = 0; i < segments.size(); i++) {
            records.add(toRecord(i, segments.get(i), policy));
        }
        return new Document(array.preamble(), records, array.trailingComments(), array.postamble());
    }

    private RuleRecord toRecord(int position, Segment segment, SortPolicy policy) {
        RuleFields fields;
        try {
            fields = extractor.extract(segment.object());
        } catch (RuleFormatException e) {
            log.warn("Rule #{} cannot be parsed, passing it through unchanged: {}", position + 1, e.getMessage());
            return new RuleRecord(position, segment.leading(), segment.object(), segment.trailing(),
                    null, "", false);
        }

        String canonical = canonicalizer.canonicalize(fields.condition(), policy);
        String rawText = segment.object();
        boolean rewritten = false;
        if (fields.hasCondition() && !canonical.equals(fields.condition())) {
            String updated = extractor.rewriteCondition(rawText, canonical);
            rewritten = !updated.equals(rawText);
            rawText = updated;
        }
        return new RuleRecord(position, segment.leading(), rawText, segment.trailing(),
                fields, canonical, rewritten);
    }
}
