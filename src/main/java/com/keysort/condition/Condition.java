package com.keysort.condition;

import java.util.List;
import java.util.function.Predicate;

/**
 * Node of a parsed condition tree.
 * Nodes are immutable; rewriting produces new nodes.
 */
public interface Condition {

    /**
     * Get the node type.
     */
    ConditionType getType();

    /**
     * Direct children, empty for literals.
     */
    List<Condition> getChildren();

    /**
     * Whether the source wrapped this node in parentheses.
     */
    boolean hasExplicitParens();

    /**
     * Copy of this node with the parenthesis flag replaced.
     */
    Condition withExplicitParens(boolean explicitParens);

    /**
     * Evaluate this condition with every operand resolved by the given valuation.
     *
     * @param valuation Truth value of each operand text
     * @return true if condition holds
     */
    boolean evaluate(Predicate<String> valuation);
}
