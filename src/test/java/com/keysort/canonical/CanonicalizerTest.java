package com.keysort.canonical;

import com.keysort.condition.Condition;
import com.keysort.config.ClassificationProfiles;
import com.keysort.config.ConditionExpressionParser;
import com.keysort.config.ConfigLoader;
import com.keysort.config.GroupingMode;
import com.keysort.config.PriorityMatcher;
import com.keysort.config.SortPolicy;
import com.keysort.config.TieBreakMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Canonicalizer.
 */
class CanonicalizerTest {

    private ClassificationProfiles profiles;
    private Canonicalizer canonicalizer;
    private SortPolicy policy;

    @BeforeEach
    void setUp() {
        profiles = ConfigLoader.loadDefaults();
        canonicalizer = new Canonicalizer(profiles);
        policy = SortPolicy.defaults();
    }

    // =====================================================================
    // Ordering
    // =====================================================================

    @Test
    @DisplayName("Alphabetical mode orders conjunction operands")
    void alphabeticalOrdersOperands() {
        assertEquals("a && b", canonicalizer.canonicalize("b && a", policy));
    }

    @ParameterizedTest
    @DisplayName("Tie-break modes order operands within a bucket")
    @CsvSource({
            "ALPHABETICAL,                           !b && a,         !b && a",
            "ALPHABETICAL_IGNORING_NEGATION,         !b && a,         a && !b",
            "NEGATION_PREFERRED,                     a && !b,         !b && a",
            "NEGATION_PREFERRED,                     !foo && foo,     !foo && foo",
            "NEGATION_DEPRIORITIZED,                 !a && b,         b && !a",
            "NEGATION_DEPRIORITIZED,                 !foo && foo,     foo && !foo",
            "ALPHABETICAL,                           view10 && view2, view10 && view2",
            "NATURAL_NUMERIC,                        view10 && view2, view2 && view10",
            "NATURAL_NUMERIC_NEGATION_PREFERRED,     view2 && !view10, !view10 && view2",
            "NATURAL_NUMERIC_NEGATION_DEPRIORITIZED, !view2 && view10, view10 && !view2"
    })
    void tieBreakModes(TieBreakMode mode, String input, String expected) {
        assertEquals(expected, canonicalizer.canonicalize(input, policy.withTieBreak(mode)));
    }

    @Test
    @DisplayName("OR operands use natural order regardless of tie-break mode")
    void orUsesNaturalOrder() {
        for (TieBreakMode mode : TieBreakMode.values()) {
            assertEquals("a || B || view2 || view10",
                    canonicalizer.canonicalize("view10 || B || view2 || a", policy.withTieBreak(mode)));
        }
    }

    @Test
    @DisplayName("Config-first grouping orders operands by bucket")
    void configFirstGrouping() {
        String input = "zed && sideBarVisible && editorFocus && activeEditor == 'x' && config.foo";

        assertEquals("config.foo && activeEditor == 'x' && editorFocus && sideBarVisible && zed",
                canonicalizer.canonicalize(input, policy.withGrouping(GroupingMode.CONFIG_FIRST)));
    }

    @Test
    @DisplayName("Focus-invariant grouping puts focus operands first within a clause")
    void focusInvariantGrouping() {
        String input = "zed && sideBarVisible && editorFocus && activeEditor == 'x' && config.foo";

        assertEquals("editorFocus && sideBarVisible && activeEditor == 'x' && config.foo && zed",
                canonicalizer.canonicalize(input, policy.withGrouping(GroupingMode.FOCUS_INVARIANT)));
    }

    @ParameterizedTest
    @DisplayName("Bucket ranks are unchanged by the tie-break mode")
    @EnumSource(TieBreakMode.class)
    void groupingStableAcrossTieBreakModes(TieBreakMode mode) {
        SortPolicy focusFirst = policy.withGrouping(GroupingMode.FOCUS_INVARIANT).withTieBreak(mode);
        String result = canonicalizer.canonicalize(
                "config.b && !editorFocus && zed && !config.a && textInputFocus && view.x.visible", focusFirst);

        OperandClassifier classifier = canonicalizer.getClassifier();
        List<Integer> ranks = Arrays.stream(result.split(" && "))
                .map(operand -> classifier.rank(operand, focusFirst))
                .toList();
        assertEquals(List.of(1, 1, 2, 4, 4, 5), ranks);
    }

    // =====================================================================
    // Priority list
    // =====================================================================

    @Test
    @DisplayName("Priority entries move matching operands to the front, in list order")
    void priorityEntriesFirst() {
        SortPolicy prioritized = policy.withPriorities(List.of(
                PriorityMatcher.literal("zeta"),
                PriorityMatcher.regex("^be")));

        assertEquals("zeta && beta && alpha && gamma",
                canonicalizer.canonicalize("alpha && beta && gamma && zeta", prioritized));
    }

    @Test
    @DisplayName("Priority entries outrank every bucket")
    void priorityOutranksBuckets() {
        SortPolicy prioritized = policy.withGrouping(GroupingMode.CONFIG_FIRST)
                .withPriorities(List.of(PriorityMatcher.literal("resourceLangId")));

        assertEquals("resourceLangId == 'md' && config.x && editorFocus",
                canonicalizer.canonicalize("editorFocus && config.x && resourceLangId == 'md'", prioritized));
    }

    @Test
    @DisplayName("Several operands matching one entry keep natural order")
    void priorityTiesAreSorted() {
        SortPolicy prioritized = policy.withPriorities(List.of(PriorityMatcher.literal("view.")));

        assertEquals("!view.c && view.b && a",
                canonicalizer.canonicalize("a && !view.c && view.b", prioritized));
    }

    // =====================================================================
    // Structure
    // =====================================================================

    @Test
    @DisplayName("Duplicates are removed")
    void duplicatesRemoved() {
        assertEquals("a", canonicalizer.canonicalize("a && a", policy));
        assertEquals("a || b", canonicalizer.canonicalize("a || a || b", policy));
        assertEquals("a || b", canonicalizer.canonicalize("b || (a || a)", policy));
    }

    @Test
    @DisplayName("An operand and its negation are both kept")
    void negationIsDistinct() {
        String result = canonicalizer.canonicalize("a && !a", policy);

        assertEquals("!a && a", result);
        assertEquals(2, result.split(" && ").length);
    }

    @Test
    @DisplayName("Nested conjunctions are flattened, disjunctions under them are not")
    void flattening() {
        assertEquals("a && b && c", canonicalizer.canonicalize("c && (b && a)", policy));
        assertEquals("(a || b) && c", canonicalizer.canonicalize("c && (b || a)", policy));
        assertEquals("(a && b) || c", canonicalizer.canonicalize("c || (b && a)", policy));
    }

    @Test
    @DisplayName("Redundant parentheses are removed")
    void redundantParenthesesRemoved() {
        assertEquals("a", canonicalizer.canonicalize("((a))", policy));
        assertEquals("!(a && b)", canonicalizer.canonicalize("!((b && a))", policy));
    }

    @Test
    @DisplayName("Operators inside strings and regex literals are left alone")
    void quotedOperatorsUntouched() {
        assertEquals("a == 'x && y' && b", canonicalizer.canonicalize("b && a == 'x && y'", policy));
        assertEquals("editorFocus && resourceFilename =~ /a||b/",
                canonicalizer.canonicalize("resourceFilename =~ /a||b/ && editorFocus", policy));
    }

    @Test
    @DisplayName("Empty operands are dropped")
    void emptyOperandsDropped() {
        assertEquals("a && b", canonicalizer.canonicalize("b && && a", policy));
    }

    @Test
    @DisplayName("A condition that does not fully parse is returned unchanged")
    void incompleteParseUnchanged() {
        assertEquals("b && a) || c", canonicalizer.canonicalize("b && a) || c", policy));
    }

    @Test
    @DisplayName("Blank conditions canonicalize to empty")
    void blankIsEmpty() {
        assertEquals("", canonicalizer.canonicalize("   ", policy));
        assertEquals("", canonicalizer.canonicalize((String) null, policy));
    }

    // =====================================================================
    // Properties
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Canonicalization is idempotent")
    @ValueSource(strings = {
            "b && a",
            "!b && (d || c) && a",
            "(x && y) || !(b || a) || z",
            "editorFocus && config.a && !sideBarVisible && (view.b.visible || activePanel == 'p')",
            "view10 && !view2 && view1"
    })
    void idempotent(String input) {
        for (GroupingMode grouping : GroupingMode.values()) {
            for (TieBreakMode mode : TieBreakMode.values()) {
                SortPolicy p = policy.withGrouping(grouping).withTieBreak(mode);
                String once = canonicalizer.canonicalize(input, p);
                assertEquals(once, canonicalizer.canonicalize(once, p), input + " under " + p);
            }
        }
    }

    @Test
    @DisplayName("Every permutation of a conjunction canonicalizes identically")
    void commutativeConjunction() {
        List<String> operands = List.of("a", "!b", "config.x", "editorFocus", "(c || d)");
        for (TieBreakMode mode : TieBreakMode.values()) {
            SortPolicy p = policy.withGrouping(GroupingMode.CONFIG_FIRST).withTieBreak(mode);
            String expected = null;
            for (List<String> permutation : permutations(operands)) {
                String result = canonicalizer.canonicalize(String.join(" && ", permutation), p);
                if (expected == null) {
                    expected = result;
                }
                assertEquals(expected, result, "permutation " + permutation);
            }
        }
    }

    @Test
    @DisplayName("Every permutation of a disjunction canonicalizes identically")
    void commutativeDisjunction() {
        List<String> operands = List.of("a", "!a", "B", "view10", "view2");
        String expected = canonicalizer.canonicalize(String.join(" || ", operands), policy);
        for (List<String> permutation : permutations(operands)) {
            assertEquals(expected, canonicalizer.canonicalize(String.join(" || ", permutation), policy));
        }
    }

    @ParameterizedTest
    @DisplayName("Canonical form is semantically equivalent to the input")
    @ValueSource(strings = {
            "!(b || a) && c || d && (e || !a)",
            "a && (b || c && !d) || !(e && a)",
            "e && e && (d || d) && !(c || (b && a))"
    })
    void semanticallyEquivalent(String input) {
        List<String> names = List.of("a", "b", "c", "d", "e");
        Condition original = ConditionExpressionParser.parse(input).root();
        for (GroupingMode grouping : GroupingMode.values()) {
            Condition canonical = ConditionExpressionParser.parse(
                    canonicalizer.canonicalize(input, policy.withGrouping(grouping))).root();
            for (int bits = 0; bits < 1 << names.size(); bits++) {
                int valuation = bits;
                assertEquals(
                        original.evaluate(name -> (valuation & (1 << names.indexOf(name))) != 0),
                        canonical.evaluate(name -> (valuation & (1 << names.indexOf(name))) != 0),
                        input + " with valuation " + bits);
            }
        }
    }

    // =====================================================================
    // Memoization
    // =====================================================================

    @Test
    @DisplayName("Results are memoized per condition and policy")
    void memoization() {
        Map<Canonicalizer.CacheKey, String> cache = new HashMap<>();
        Canonicalizer cached = new Canonicalizer(new OperandClassifier(profiles), cache);

        cached.canonicalize("b && a", policy);
        cached.canonicalize("b && a", policy);
        assertEquals(1, cached.cacheSize());

        cached.canonicalize("b && a", policy.withTieBreak(TieBreakMode.NATURAL_NUMERIC));
        assertEquals(2, cached.cacheSize());

        Canonicalizer.CacheKey key = new Canonicalizer.CacheKey("b && a", GroupingMode.NONE,
                TieBreakMode.ALPHABETICAL, List.of());
        assertEquals("a && b", cache.get(key));
    }

    @Test
    @DisplayName("Separate instances do not share memoized results")
    void cachesAreIndependent() {
        canonicalizer.canonicalize("b && a", policy);

        assertEquals(0, new Canonicalizer(profiles).cacheSize());
    }

    private static List<List<String>> permutations(List<String> items) {
        if (items.size() <= 1) {
            return List.of(items);
        }
        List<List<String>> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<String> rest = new ArrayList<>(items);
            String head = rest.remove(i);
            for (List<String> tail : permutations(rest)) {
                List<String> permutation = new ArrayList<>();
                permutation.add(head);
                permutation.addAll(tail);
                result.add(permutation);
            }
        }
        return result;
    }
}
