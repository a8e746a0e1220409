package com.keysort.config.expression;

/**
 * Operator spellings of the condition language.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    public static final String AND = "&&";
    public static final String OR = "||";

    /**
     * Separators used when rendering commutative nodes.
     */
    public static final String AND_SEPARATOR = " && ";
    public static final String OR_SEPARATOR = " || ";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char NOT = '!';
        public static final char EQUALS = '=';
        public static final char TILDE = '~';
        public static final char SLASH = '/';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';

        private Operators() {
        }
    }
}
