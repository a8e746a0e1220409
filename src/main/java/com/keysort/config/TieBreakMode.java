package com.keysort.config;

/**
 * Ordering of operands that share a bucket rank.
 */
public enum TieBreakMode {
    ALPHABETICAL(false, false, 0),
    ALPHABETICAL_IGNORING_NEGATION(false, true, 0),
    NEGATION_PREFERRED(false, true, -1),
    NEGATION_DEPRIORITIZED(false, true, 1),
    NATURAL_NUMERIC(true, true, 0),
    NATURAL_NUMERIC_NEGATION_PREFERRED(true, true, -1),
    NATURAL_NUMERIC_NEGATION_DEPRIORITIZED(true, true, 1);

    private final boolean natural;
    private final boolean ignoresNegation;
    private final int negationBias;

    TieBreakMode(boolean natural, boolean ignoresNegation, int negationBias) {
        this.natural = natural;
        this.ignoresNegation = ignoresNegation;
        this.negationBias = negationBias;
    }

    /**
     * Whether the base text is compared digit-aware and case-insensitive.
     */
    public boolean isNatural() {
        return natural;
    }

    /**
     * Whether a leading "!" is stripped before comparing.
     */
    public boolean ignoresNegation() {
        return ignoresNegation;
    }

    /**
     * -1 puts negated operands first, 1 puts them last, 0 ignores negation.
     */
    public int negationBias() {
        return negationBias;
    }
}
