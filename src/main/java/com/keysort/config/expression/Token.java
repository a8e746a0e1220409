package com.keysort.config.expression;

/**
 * Represents a token in a condition.
 *
 * @param type     Token type
 * @param text     Token text (whitespace-normalized for operands)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
