package com.keysort.condition.impl;

import com.keysort.condition.Condition;
import com.keysort.condition.ConditionType;

import java.util.List;
import java.util.function.Predicate;

/**
 * Logical AND condition - all nested conditions must be true.
 */
public final class AndCondition implements Condition {

    private final List<Condition> conditions;
    private final boolean explicitParens;

    public AndCondition(List<Condition> conditions, boolean explicitParens) {
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("AND requires at least one nested condition");
        }
        this.conditions = List.copyOf(conditions);
        this.explicitParens = explicitParens;
    }

    public AndCondition(List<Condition> conditions) {
        this(conditions, false);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.AND;
    }

    @Override
    public List<Condition> getChildren() {
        return conditions;
    }

    @Override
    public boolean hasExplicitParens() {
        return explicitParens;
    }

    @Override
    public Condition withExplicitParens(boolean explicitParens) {
        return explicitParens == this.explicitParens ? this : new AndCondition(conditions, explicitParens);
    }

    @Override
    public boolean evaluate(Predicate<String> valuation) {
        return conditions.stream().allMatch(c -> c.evaluate(valuation));
    }

    @Override
    public String toString() {
        return "AND(" + conditions + ")";
    }
}
