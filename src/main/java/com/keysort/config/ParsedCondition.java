package com.keysort.config;

import com.keysort.condition.Condition;

/**
 * Result of parsing one condition string.
 *
 * @param root     Parsed tree (best effort when incomplete)
 * @param complete Whether every token was consumed
 */
public record ParsedCondition(Condition root, boolean complete) {
}
