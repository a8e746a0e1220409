package com.keysort.config;

/**
 * How the entries of a token bucket are matched against an identifier.
 */
public enum MatchStyle {
    /**
     * Identifier starts with the entry.
     */
    PREFIX,

    /**
     * Identifier equals the entry; entries ending in "." match as prefixes and
     * entries containing "&lt;viewId&gt;" match any text in that place.
     */
    EXACT
}
