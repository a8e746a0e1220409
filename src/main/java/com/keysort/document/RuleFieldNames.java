package com.keysort.document;

import java.util.Objects;

/**
 * JSON member names of the trigger, action and condition fields.
 */
public record RuleFieldNames(String trigger, String action, String condition) {

    public RuleFieldNames {
        Objects.requireNonNull(trigger, "trigger cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        Objects.requireNonNull(condition, "condition cannot be null");
    }

    public static RuleFieldNames defaults() {
        return new RuleFieldNames("key", "command", "when");
    }
}
