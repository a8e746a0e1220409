package com.keysort.canonical;

import com.keysort.config.IdentifierPatterns;
import com.keysort.config.TieBreakMode;

/**
 * Builds the intra-bucket ordering key of a rendered operand.
 * Every key ends with the rendered text so the order is total.
 */
public final class TieBreakKeys {

    private TieBreakKeys() {
    }

    public static CompositeKey of(String rendered, TieBreakMode mode) {
        CompositeKey.Builder key = CompositeKey.builder();
        if (mode.ignoresNegation()) {
            String base = IdentifierPatterns.stripOuterParens(rendered);
            boolean negated = base.startsWith("!");
            if (negated) {
                base = base.substring(1).stripLeading();
            }
            if (mode.negationBias() != 0) {
                boolean first = mode.negationBias() < 0 ? negated : !negated;
                key.add(first ? 0 : 1);
            }
            if (mode.isNatural()) {
                key.add(NaturalKey.of(base));
            } else {
                key.add(base);
            }
        }
        return key.add(rendered).build();
    }
}
