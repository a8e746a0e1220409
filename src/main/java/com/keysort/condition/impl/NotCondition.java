package com.keysort.condition.impl;

import com.keysort.condition.Condition;
import com.keysort.condition.ConditionType;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Logical NOT condition - negates the nested condition.
 */
public final class NotCondition implements Condition {

    private final Condition condition;
    private final boolean explicitParens;

    public NotCondition(Condition condition, boolean explicitParens) {
        this.condition = Objects.requireNonNull(condition, "condition cannot be null");
        this.explicitParens = explicitParens;
    }

    public NotCondition(Condition condition) {
        this(condition, false);
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }

    @Override
    public List<Condition> getChildren() {
        return List.of(condition);
    }

    @Override
    public boolean hasExplicitParens() {
        return explicitParens;
    }

    @Override
    public Condition withExplicitParens(boolean explicitParens) {
        return explicitParens == this.explicitParens ? this : new NotCondition(condition, explicitParens);
    }

    @Override
    public boolean evaluate(Predicate<String> valuation) {
        return !condition.evaluate(valuation);
    }

    @Override
    public String toString() {
        return "NOT(" + condition + ")";
    }
}
