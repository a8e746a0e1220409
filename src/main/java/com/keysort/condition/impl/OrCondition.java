package com.keysort.condition.impl;

import com.keysort.condition.Condition;
import com.keysort.condition.ConditionType;

import java.util.List;
import java.util.function.Predicate;

/**
 * Logical OR condition - at least one nested condition must be true.
 */
public final class OrCondition implements Condition {

    private final List<Condition> conditions;
    private final boolean explicitParens;

    public OrCondition(List<Condition> conditions, boolean explicitParens) {
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("OR requires at least one nested condition");
        }
        this.conditions = List.copyOf(conditions);
        this.explicitParens = explicitParens;
    }

    public OrCondition(List<Condition> conditions) {
        this(conditions, false);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.OR;
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
        return explicitParens == this.explicitParens ? this : new OrCondition(conditions, explicitParens);
    }

    @Override
    public boolean evaluate(Predicate<String> valuation) {
        return conditions.stream().anyMatch(c -> c.evaluate(valuation));
    }

    @Override
    public String toString() {
        return "OR(" + conditions + ")";
    }
}
