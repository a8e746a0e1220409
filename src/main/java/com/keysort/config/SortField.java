package com.keysort.config;

/**
 * Rule fields that can drive document ordering.
 */
public enum SortField {
    TRIGGER,
    CONDITION,

    /**
     * Only valid as secondary field.
     */
    NONE
}
