package com.keysort.document;

/**
 * Typed fields of one rule object. Absent fields are empty strings.
 *
 * @param trigger   Key chord
 * @param action    Action identifier
 * @param condition Raw activation condition
 */
public record RuleFields(String trigger, String action, String condition) {

    public RuleFields {
        trigger = trigger == null ? "" : trigger;
        action = action == null ? "" : action;
        condition = condition == null ? "" : condition;
    }

    public boolean hasCondition() {
        return !condition.isEmpty();
    }
}
