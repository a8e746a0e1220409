package com.keysort.config.expression;

/**
 * Token types for condition parsing.
 */
public enum TokenType {
    // Leaf
    OPERAND,

    // Delimiters
    LPAREN,
    RPAREN,

    // Logical operators
    AND,
    OR,
    NOT,

    // Special
    EOF
}
