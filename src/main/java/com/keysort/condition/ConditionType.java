package com.keysort.condition;

/**
 * Node kinds of a parsed condition.
 */
public enum ConditionType {
    // Leaf
    LITERAL,

    // Logical
    NOT,
    AND,
    OR;

    /**
     * Whether operands of this node may be reordered.
     */
    public boolean isCommutative() {
        return this == AND || this == OR;
    }
}
