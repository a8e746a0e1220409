package com.keysort.document;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StructuralSegmenter.
 */
class StructuralSegmenterTest {

    private StructuralSegmenter segmenter;

    @BeforeEach
    void setUp() {
        segmenter = new StructuralSegmenter();
    }

    @Test
    @DisplayName("Block comment after a rule is its trailing trivia")
    void blockCommentIsTrailingTrivia() {
        String text = "[ {\"a\":1} /*c*/, {\"a\":2} ]";

        SegmentedArray array = segmenter.segment(text).orElseThrow();

        assertEquals(2, array.segments().size());
        assertEquals("{\"a\":1}", array.segments().get(0).object());
        assertEquals(" /*c*/,", array.segments().get(0).trailing());
        assertEquals("{\"a\":2}", array.segments().get(1).object());
        assertEquals(text, array.render());
    }

    @Test
    @DisplayName("Brackets inside strings and comments are ignored")
    void bracketsInStringsAndComments() {
        String text = """
                // [not the array]
                [
                  // {not a rule}
                  {"key": "a]}", "when": "x"}, /* ] */
                  {"key": "b"}
                ]
                // ] tail
                """;

        SegmentedArray array = segmenter.segment(text).orElseThrow();

        assertEquals("// [not the array]\n", array.preamble());
        assertEquals(2, array.segments().size());
        assertEquals("\n  // {not a rule}\n  ", array.segments().get(0).leading());
        assertEquals("{\"key\": \"a]}\", \"when\": \"x\"}", array.segments().get(0).object());
        assertEquals(", /* ] */", array.segments().get(0).trailing());
        assertEquals("\n  ", array.segments().get(1).leading());
        assertEquals("\n", array.trailingComments());
        assertEquals("\n// ] tail\n", array.postamble());
        assertEquals(text, array.render());
    }

    @Test
    @DisplayName("Line comment after the comma stays with the rule")
    void lineCommentStaysOnItsLine() {
        String text = "[\n  {\"a\": 1}, // first\n  {\"a\": 2} // last\n  // closing note\n]";

        SegmentedArray array = segmenter.segment(text).orElseThrow();

        assertEquals(", // first", array.segments().get(0).trailing());
        assertEquals(" // last", array.segments().get(1).trailing());
        assertEquals("\n  // closing note\n", array.trailingComments());
    }

    @Test
    @DisplayName("Nested objects and arrays belong to their rule")
    void nestedValues() {
        String text = "[{\"key\": \"k\", \"args\": {\"list\": [1, {\"x\": \"}\"}]}}]";

        SegmentedArray array = segmenter.segment(text).orElseThrow();

        assertEquals(1, array.segments().size());
        assertEquals(text.substring(1, text.length() - 1), array.segments().get(0).object());
    }

    @Test
    @DisplayName("Unterminated rule is kept verbatim in the trailing comments")
    void unterminatedRule() {
        String text = "[\n  {\"a\": 1},\n  {\"b\": 2\n]";

        SegmentedArray array = segmenter.segment(text).orElseThrow();

        assertEquals(1, array.segments().size());
        assertEquals("\n  {\"b\": 2\n", array.trailingComments());
        assertEquals(text, array.render());
    }

    @Test
    @DisplayName("Empty array has no rules")
    void emptyArray() {
        SegmentedArray array = segmenter.segment("// none\n[\n]\n").orElseThrow();

        assertTrue(array.segments().isEmpty());
        assertEquals("\n", array.trailingComments());
    }

    @Test
    @DisplayName("Missing top-level array yields no bounds")
    void missingArray() {
        assertEquals(Optional.empty(), segmenter.segment("{\"key\": \"a\"}"));
        assertEquals(Optional.empty(), segmenter.segment("// [commented]\n"));
        assertEquals(Optional.empty(), segmenter.segment("[ {\"a\": 1}"));
    }

    @Test
    @DisplayName("Scanner tracks strings and comments")
    void scannerStates() {
        String text = "a\"//\"/*x*/'b'//c\nd";
        JsoncScanner scanner = new JsoncScanner(text);
        StringBuilder code = new StringBuilder();
        while (scanner.hasNext()) {
            int at = scanner.position();
            if (scanner.next() == JsoncScanner.State.CODE) {
                code.append(text.charAt(at));
            }
        }

        assertEquals("a\nd", code.toString());
    }
}
