package com.keysort.sort;

import com.keysort.canonical.OperandClassifier;
import com.keysort.condition.Condition;
import com.keysort.condition.impl.LiteralCondition;
import com.keysort.config.ConditionExpressionParser;
import com.keysort.config.GroupingMode;
import com.keysort.config.IdentifierPatterns;
import com.keysort.document.RuleRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Whole-document placement pass for focus-invariant grouping.
 * <p>
 * Rules with any operand in the profile's focus bucket are moved behind all other
 * parsed rules. The remaining rules are partitioned by the lowest bucket rank among
 * the operands of their canonical condition and partitions are emitted from the
 * highest rank down. Order inside a partition is kept and unparsed rules stay last.
 * This runs opposite to the clause-local order, where focus operands come first.
 */
public class FocusPlacement {

    private final OperandClassifier classifier;

    public FocusPlacement(OperandClassifier classifier) {
        this.classifier = classifier;
    }

    public List<RuleRecord> apply(List<RuleRecord> sorted, GroupingMode mode) {
        if (mode != GroupingMode.FOCUS_INVARIANT) {
            return sorted;
        }
        int focusRank = classifier.getProfiles().focusRank(mode);
        int otherRank = classifier.getProfiles().otherRank(mode);

        TreeMap<Integer, List<RuleRecord>> partitions = new TreeMap<>();
        List<RuleRecord> focused = new ArrayList<>();
        List<RuleRecord> unparsed = new ArrayList<>();
        for (RuleRecord record : sorted) {
            if (!record.parseOk()) {
                unparsed.add(record);
                continue;
            }
            Set<Integer> ranks = operandRanks(record, mode);
            if (ranks.contains(focusRank)) {
                focused.add(record);
            } else {
                int lowest = ranks.isEmpty() ? otherRank : Collections.min(ranks);
                partitions.computeIfAbsent(lowest, rank -> new ArrayList<>()).add(record);
            }
        }
        List<RuleRecord> placed = new ArrayList<>(sorted.size());
        partitions.descendingMap().values().forEach(placed::addAll);
        placed.addAll(focused);
        placed.addAll(unparsed);
        return placed;
    }

    /**
     * Bucket ranks of the non-empty operands of a rule's canonical condition.
     */
    Set<Integer> operandRanks(RuleRecord record, GroupingMode mode) {
        Set<Integer> ranks = new TreeSet<>();
        if (record.canonicalCondition().isEmpty()) {
            return ranks;
        }
        List<String> literals = new ArrayList<>();
        collectLiterals(ConditionExpressionParser.parse(record.canonicalCondition()).root(), literals);
        for (String literal : literals) {
            ranks.add(classifier.bucketRank(IdentifierPatterns.leftIdentifier(literal), mode));
        }
        return ranks;
    }

    private static void collectLiterals(Condition node, List<String> literals) {
        if (node instanceof LiteralCondition literal) {
            if (!literal.isEmpty()) {
                literals.add(literal.getText());
            }
            return;
        }
        for (Condition child : node.getChildren()) {
            collectLiterals(child, literals);
        }
    }
}
