package com.keysort.document;

import java.util.List;

/**
 * Result of splitting a document around its top-level array.
 * Concatenating preamble, {@code [}, every segment, trailing comments,
 * {@code ]} and postamble reproduces the input exactly.
 *
 * @param preamble         Text before the opening bracket
 * @param segments         Rule objects in input order
 * @param trailingComments Array body after the last rule
 * @param postamble        Text after the closing bracket
 */
public record SegmentedArray(
        String preamble,
        List<Segment> segments,
        String trailingComments,
        String postamble
) {
    public SegmentedArray {
        segments = List.copyOf(segments);
    }

    /**
     * Rebuild the source text.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(preamble).append('[');
        for (Segment segment : segments) {
            sb.append(segment.leading()).append(segment.object()).append(segment.trailing());
        }
        return sb.append(trailingComments).append(']').append(postamble).toString();
    }
}
