package com.keysort.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a commented JSON document into preamble, rule objects and postamble
 * without altering any byte.
 * <p>
 * Brackets and braces are only counted outside strings and comments.
 */
public class StructuralSegmenter {

    private static final Logger log = LoggerFactory.getLogger(StructuralSegmenter.class);

    /**
     * Positions of the top-level array brackets.
     *
     * @param open  Index of {@code [}
     * @param close Index of the matching {@code ]}
     */
    public record ArrayBounds(int open, int close) {
    }

    /**
     * Locate the first top-level array.
     *
     * @return Bounds, or empty when there is no complete array
     */
    public Optional<ArrayBounds> findArray(String text) {
        int open = JsoncScanner.indexOfCode(text, '[', 0, text.length());
        if (open < 0) {
            return Optional.empty();
        }
        int close = JsoncScanner.matchingClose(text, open, text.length());
        if (close < 0) {
            return Optional.empty();
        }
        return Optional.of(new ArrayBounds(open, close));
    }

    /**
     * Segment the document.
     *
     * @return Segmented array, or empty when there is no top-level array
     */
    public Optional<SegmentedArray> segment(String text) {
        Optional<ArrayBounds> bounds = findArray(text);
        if (bounds.isEmpty()) {
            return Optional.empty();
        }
        int bodyStart = bounds.get().open() + 1;
        int bodyEnd = bounds.get().close();

        List<Segment> segments = new ArrayList<>();
        int pos = bodyStart;
        while (true) {
            int objectStart = JsoncScanner.indexOfCode(text, '{', pos, bodyEnd);
            if (objectStart < 0) {
                break;
            }
            int objectEnd = JsoncScanner.matchingClose(text, objectStart, bodyEnd);
            if (objectEnd < 0) {
                log.warn("Unterminated object at offset {}, keeping the rest of the array verbatim", objectStart);
                break;
            }
            int trailingEnd = trailingTriviaEnd(text, objectEnd + 1, bodyEnd);
            segments.add(new Segment(
                    text.substring(pos, objectStart),
                    text.substring(objectStart, objectEnd + 1),
                    text.substring(objectEnd + 1, trailingEnd)));
            pos = trailingEnd;
        }

        log.debug("Segmented {} rule objects", segments.size());
        return Optional.of(new SegmentedArray(
                text.substring(0, bounds.get().open()),
                segments,
                text.substring(pos, bodyEnd),
                text.substring(bodyEnd + 1)));
    }

    /**
     * End of the trivia after an object: spaces, tabs, commas and comments up to the
     * line break. A block comment is taken whole.
     */
    static int trailingTriviaEnd(String text, int from, int to) {
        int i = from;
        while (i < to) {
            char c = text.charAt(i);
            if (c == ' ' || c == '\t' || c == ',') {
                i++;
            } else if (text.startsWith("//", i)) {
                int newline = text.indexOf('\n', i);
                return newline < 0 || newline > to ? to : newline;
            } else if (text.startsWith("/*", i)) {
                int close = text.indexOf("*/", i + 2);
                if (close < 0 || close + 2 > to) {
                    return to;
                }
                i = close + 2;
            } else {
                break;
            }
        }
        return i;
    }
}
