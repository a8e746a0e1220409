package com.keysort.config.expression;

import java.util.ArrayList;
import java.util.List;

import static com.keysort.config.expression.ExpressionConfig.*;

/**
 * Tokenizer for condition strings.
 * <p>
 * Everything that is not an operator is absorbed into the current operand, so
 * comparisons ({@code a == b}, {@code a != 'x'}) and regex matches
 * ({@code a =~ /x|y/}) stay single operands. Quoted strings and regex literals
 * are copied verbatim; operators inside them are never recognized.
 * The tokenizer never fails: unrecognized characters become operand text.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder operand = new StringBuilder();
    private int operandStart = -1;
    private int pos;
    private char previousNonSpace;

    public ExpressionTokenizer(String input) {
        this.input = input == null ? "" : input;
        this.length = this.input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always terminated by an EOF token
     */
    public List<Token> tokenize() {
        while (!isAtEnd()) {
            char c = peek();

            if (c == Operators.QUOTE_SINGLE || c == Operators.QUOTE_DOUBLE) {
                readQuoted(c);
                continue;
            }
            if (c == Operators.SLASH && previousNonSpace == Operators.TILDE) {
                readRegex();
                continue;
            }
            if (input.startsWith(AND, pos) || input.startsWith(OR, pos)) {
                flushOperand();
                TokenType type = input.startsWith(AND, pos) ? TokenType.AND : TokenType.OR;
                tokens.add(new Token(type, input.substring(pos, pos + 2), pos));
                pos += 2;
                previousNonSpace = 0;
                continue;
            }

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    flushOperand();
                    tokens.add(new Token(TokenType.LPAREN, "(", pos));
                    advance();
                }
                case Operators.RIGHT_PAREN -> {
                    flushOperand();
                    tokens.add(new Token(TokenType.RPAREN, ")", pos));
                    advance();
                }
                case Operators.NOT -> {
                    if (peekNext() == Operators.EQUALS || !operandIsBlank()) {
                        // part of "!=" or in the middle of an operand
                        append(advance());
                    } else {
                        flushOperand();
                        tokens.add(new Token(TokenType.NOT, "!", pos));
                        advance();
                    }
                }
                default -> append(advance());
            }
        }

        flushOperand();
        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    private void readQuoted(char quote) {
        append(advance());
        while (!isAtEnd()) {
            char c = advance();
            append(c);
            if (c == Operators.BACKSLASH) {
                if (!isAtEnd()) {
                    append(advance());
                }
            } else if (c == quote) {
                return;
            }
        }
    }

    private void readRegex() {
        append(advance());
        while (!isAtEnd()) {
            char c = advance();
            append(c);
            if (c == Operators.BACKSLASH) {
                if (!isAtEnd()) {
                    append(advance());
                }
            } else if (c == Operators.SLASH) {
                return;
            }
        }
    }

    private void append(char c) {
        if (operandStart < 0 && !Character.isWhitespace(c)) {
            operandStart = pos - 1;
        }
        operand.append(c);
        if (!Character.isWhitespace(c)) {
            previousNonSpace = c;
        }
    }

    private void flushOperand() {
        if (!operandIsBlank()) {
            tokens.add(new Token(TokenType.OPERAND, normalizeOperand(operand), operandStart));
        }
        operand.setLength(0);
        operandStart = -1;
    }

    private boolean operandIsBlank() {
        for (int i = 0; i < operand.length(); i++) {
            if (!Character.isWhitespace(operand.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Collapse whitespace runs to one space and trim.
     */
    static String normalizeOperand(CharSequence text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean pendingSpace = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < length ? input.charAt(pos + 1) : 0;
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
