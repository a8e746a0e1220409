package com.keysort.config;

import java.util.Locale;

/**
 * Built-in bucket orders for classifying condition operands.
 */
public enum GroupingMode {
    /**
     * Every operand shares one bucket; only the priority list and tie-break apply.
     */
    NONE,

    /**
     * config.* first, then positional, focus, visibility, other.
     */
    CONFIG_FIRST,

    /**
     * focus first, then visibility, positional, config.*, other.
     * Rules depending on focus are additionally moved to the end of the document.
     */
    FOCUS_INVARIANT;

    /**
     * Profile key used in the classification YAML (e.g. "config-first").
     */
    public String profileKey() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
