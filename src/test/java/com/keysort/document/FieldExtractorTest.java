package com.keysort.document;

import com.keysort.exception.RuleFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FieldExtractor.
 */
class FieldExtractorTest {

    private FieldExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new FieldExtractor(RuleFieldNames.defaults());
    }

    @Test
    @DisplayName("Should extract fields from a commented object with trailing comma")
    void shouldExtractLenientObject() {
        RuleFields fields = extractor.extract("""
                {
                    // open the thing
                    "key": "ctrl+k ctrl+o",
                    "command": "workbench.action.open", /* 1a2b */
                    "when": "editorFocus && !inputFocus",
                }""");

        assertEquals("ctrl+k ctrl+o", fields.trigger());
        assertEquals("workbench.action.open", fields.action());
        assertEquals("editorFocus && !inputFocus", fields.condition());
        assertTrue(fields.hasCondition());
    }

    @Test
    @DisplayName("Missing fields are empty")
    void missingFieldsAreEmpty() {
        RuleFields fields = extractor.extract("{key: 'ctrl+a'}");

        assertEquals("ctrl+a", fields.trigger());
        assertEquals("", fields.action());
        assertFalse(fields.hasCondition());
    }

    @Test
    @DisplayName("Non-string values use their text form")
    void nonStringValues() {
        RuleFields fields = extractor.extract("{\"key\": 12, \"command\": [\"a\", \"b\"]}");

        assertEquals("12", fields.trigger());
        assertEquals("[\"a\",\"b\"]", fields.action());
    }

    @Test
    @DisplayName("Configured member names are honored")
    void configuredNames() {
        FieldExtractor custom = new FieldExtractor(new RuleFieldNames("chord", "action", "if"));

        RuleFields fields = custom.extract("{\"chord\": \"f5\", \"action\": \"run\", \"if\": \"debugging\"}");

        assertEquals("f5", fields.trigger());
        assertEquals("run", fields.action());
        assertEquals("debugging", fields.condition());
    }

    @Test
    @DisplayName("Malformed object is a rule format error")
    void malformedObject() {
        assertThrows(RuleFormatException.class, () -> extractor.extract("{\"key\": }"));
        assertThrows(RuleFormatException.class, () -> extractor.extract("{\"key\": \"a\""));
    }

    @Test
    @DisplayName("Condition rewrite skips commented-out members")
    void rewriteSkipsComments() {
        String object = """
                {
                    // "when": "old && stuff",
                    "key": "k",
                    "when": "b && a"
                }""";

        String rewritten = extractor.rewriteCondition(object, "a && b");

        assertTrue(rewritten.contains("// \"when\": \"old && stuff\","));
        assertTrue(rewritten.contains("\"when\": \"a && b\""));
        assertFalse(rewritten.contains("b && a"));
    }

    @Test
    @DisplayName("Condition rewrite ignores nested members")
    void rewriteIgnoresNested() {
        String object = "{\"args\": {\"when\": \"inner\"}, \"when\": \"outer\"}";

        assertEquals("{\"args\": {\"when\": \"inner\"}, \"when\": \"x\"}", extractor.rewriteCondition(object, "x"));
    }

    @Test
    @DisplayName("Rewritten condition is JSON-escaped")
    void rewriteEscapes() {
        String rewritten = extractor.rewriteCondition("{\"when\": \"x\"}", "a == \"q\\z\"");

        assertEquals("{\"when\": \"a == \\\"q\\\\z\\\"\"}", rewritten);
        assertEquals("a == \"q\\z\"", extractor.extract(rewritten).condition());
    }

    @Test
    @DisplayName("Object without a condition member is left unchanged")
    void rewriteWithoutMember() {
        String object = "{\"key\": \"k\"}";

        assertSame(object, extractor.rewriteCondition(object, "a"));
    }

    @Test
    @DisplayName("Unquoted and single-quoted member names are located")
    void locateLenientNames() {
        String object = "{when: 'a', 'key': \"k\"}";

        FieldExtractor.Span span = extractor.locateStringMember(object, "when").orElseThrow();
        assertEquals("'a'", object.substring(span.start(), span.end()));
        assertTrue(extractor.locateStringMember(object, "key").isPresent());
    }
}
