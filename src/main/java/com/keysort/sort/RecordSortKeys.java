package com.keysort.sort;

import com.keysort.canonical.CompositeKey;
import com.keysort.canonical.NaturalKey;
import com.keysort.canonical.TieBreakKeys;
import com.keysort.condition.Condition;
import com.keysort.condition.ConditionRenderer;
import com.keysort.condition.ConditionType;
import com.keysort.config.ConditionExpressionParser;
import com.keysort.config.IdentifierPatterns;
import com.keysort.config.SortField;
import com.keysort.config.SortPolicy;
import com.keysort.config.expression.ExpressionTokenizer;
import com.keysort.config.expression.Token;
import com.keysort.config.expression.TokenType;
import com.keysort.document.RuleRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the total-order document sort key of a rule.
 * <p>
 * Parsed rules come first. Fields are compared in the order primary, secondary,
 * then whichever of trigger and condition is left, so every key covers both.
 * Unparsed rules only compare by input position.
 */
public class RecordSortKeys {

    public CompositeKey keyFor(RuleRecord record, SortPolicy policy) {
        CompositeKey.Builder key = CompositeKey.builder();
        if (!record.parseOk()) {
            return key.add(1).add(record.position()).build();
        }
        key.add(0);

        for (SortField field : fieldOrder(policy)) {
            if (field == SortField.TRIGGER) {
                key.addAll(triggerKey(record.trigger()));
            } else if (field == policy.primary()) {
                key.addAll(primaryConditionKey(record, policy));
            } else {
                String canonical = record.canonicalCondition();
                key.add(specificity(canonical)).add(NaturalKey.caseSensitive(canonical));
            }
        }
        return key.build();
    }

    static List<SortField> fieldOrder(SortPolicy policy) {
        List<SortField> order = new ArrayList<>();
        order.add(policy.primary());
        if (policy.secondary() != SortField.NONE && policy.secondary() != policy.primary()) {
            order.add(policy.secondary());
        }
        for (SortField field : List.of(SortField.TRIGGER, SortField.CONDITION)) {
            if (!order.contains(field)) {
                order.add(field);
            }
        }
        return order;
    }

    private static CompositeKey triggerKey(String trigger) {
        return CompositeKey.builder().add(NaturalKey.of(trigger)).add(trigger).build();
    }

    private static CompositeKey primaryConditionKey(RuleRecord record, SortPolicy policy) {
        String canonical = record.canonicalCondition();
        String first = firstOperand(canonical);
        int rank = policy.priorityIndex(IdentifierPatterns.leftIdentifier(first));

        CompositeKey.Builder key = CompositeKey.builder();
        if (rank >= 0) {
            key.add(rank).addAll(triggerKey(record.trigger()));
        } else {
            key.add(policy.priorities().size()).add(NaturalKey.caseSensitive(operandBase(first)));
        }
        return key.add(specificity(canonical))
                .addAll(TieBreakKeys.of(canonical, policy.tieBreak()))
                .build();
    }

    /**
     * Number of operands joined by {@code &&} or {@code ||}, 0 for an empty condition.
     */
    static int specificity(String condition) {
        if (condition == null || condition.isBlank()) {
            return 0;
        }
        int count = 1;
        for (Token token : new ExpressionTokenizer(condition).tokenize()) {
            if (token.type() == TokenType.AND || token.type() == TokenType.OR) {
                count++;
            }
        }
        return count;
    }

    /**
     * First top-level operand of a canonical condition.
     */
    static String firstOperand(String canonical) {
        if (canonical == null || canonical.isBlank()) {
            return "";
        }
        Condition root = ConditionExpressionParser.parse(canonical).root();
        if (root.getType() == ConditionType.AND || root.getType() == ConditionType.OR) {
            root = root.getChildren().get(0);
        }
        return ConditionRenderer.render(root);
    }

    private static String operandBase(String operand) {
        String base = IdentifierPatterns.stripOuterParens(operand);
        if (base.startsWith("!")) {
            base = IdentifierPatterns.stripOuterParens(base.substring(1).strip());
        }
        return base;
    }
}
