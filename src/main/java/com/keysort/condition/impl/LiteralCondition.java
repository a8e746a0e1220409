package com.keysort.condition.impl;

import com.keysort.condition.Condition;
import com.keysort.condition.ConditionType;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Opaque operand: an identifier, a comparison or a regex match.
 * Never decomposed further.
 */
public final class LiteralCondition implements Condition {

    private static final LiteralCondition EMPTY = new LiteralCondition("", false);

    private final String text;
    private final boolean explicitParens;

    public LiteralCondition(String text, boolean explicitParens) {
        this.text = Objects.requireNonNull(text, "text cannot be null");
        this.explicitParens = explicitParens;
    }

    public LiteralCondition(String text) {
        this(text, false);
    }

    /**
     * Leaf used for empty or missing operands.
     */
    public static LiteralCondition empty() {
        return EMPTY;
    }

    public String getText() {
        return text;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.LITERAL;
    }

    @Override
    public List<Condition> getChildren() {
        return List.of();
    }

    @Override
    public boolean hasExplicitParens() {
        return explicitParens;
    }

    @Override
    public Condition withExplicitParens(boolean explicitParens) {
        return explicitParens == this.explicitParens ? this : new LiteralCondition(text, explicitParens);
    }

    @Override
    public boolean evaluate(Predicate<String> valuation) {
        return valuation.test(text);
    }

    @Override
    public String toString() {
        return "LITERAL(" + text + ")";
    }
}
