package com.keysort.sort;

import com.keysort.config.SortField;
import com.keysort.config.SortPolicy;
import com.keysort.document.RuleFields;
import com.keysort.document.RuleRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RecordSortKeys.
 */
class RecordSortKeysTest {

    private final RecordSortKeys keys = new RecordSortKeys();

    @ParameterizedTest
    @DisplayName("Specificity counts joined operands")
    @CsvSource({
            "'',                  0",
            "a,                   1",
            "a && b,              2",
            "a && (b || c) && !d, 4"
    })
    void specificity(String condition, int expected) {
        assertEquals(expected, RecordSortKeys.specificity(condition));
    }

    @Test
    @DisplayName("First operand of the top-level expression")
    void firstOperand() {
        assertEquals("a || b", RecordSortKeys.firstOperand("(a || b) && c"));
        assertEquals("!x", RecordSortKeys.firstOperand("!x"));
        assertEquals("", RecordSortKeys.firstOperand(""));
    }

    @Test
    @DisplayName("Field order always covers trigger and condition")
    void fieldOrder() {
        SortPolicy policy = SortPolicy.defaults();

        assertEquals(List.of(SortField.TRIGGER, SortField.CONDITION), RecordSortKeys.fieldOrder(policy));
        assertEquals(List.of(SortField.CONDITION, SortField.TRIGGER),
                RecordSortKeys.fieldOrder(policy.withPrimary(SortField.CONDITION).withSecondary(SortField.CONDITION)));
    }

    @Test
    @DisplayName("Unparsed rules sort after parsed ones by position")
    void unparsedLast() {
        RuleRecord parsed = new RuleRecord(5, "", "{}", "", new RuleFields("z", "", ""), "", false);
        RuleRecord first = new RuleRecord(0, "", "{", "", null, "", false);
        RuleRecord second = new RuleRecord(1, "", "{", "", null, "", false);
        SortPolicy policy = SortPolicy.defaults();

        assertTrue(keys.keyFor(parsed, policy).compareTo(keys.keyFor(first, policy)) < 0);
        assertTrue(keys.keyFor(first, policy).compareTo(keys.keyFor(second, policy)) < 0);
    }

    @Test
    @DisplayName("More specific conditions sort later for the same trigger")
    void specificityOrdersConditions() {
        SortPolicy policy = SortPolicy.defaults();
        RuleRecord general = new RuleRecord(1, "", "{}", "", new RuleFields("k", "", "z"), "z", false);
        RuleRecord specific = new RuleRecord(0, "", "{}", "", new RuleFields("k", "", "a && b"), "a && b", false);

        assertTrue(keys.keyFor(general, policy).compareTo(keys.keyFor(specific, policy)) < 0);
    }
}
