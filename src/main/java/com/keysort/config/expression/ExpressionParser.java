package com.keysort.config.expression;

import com.keysort.condition.Condition;
import com.keysort.condition.impl.AndCondition;
import com.keysort.condition.impl.LiteralCondition;
import com.keysort.condition.impl.NotCondition;
import com.keysort.condition.impl.OrCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for condition strings.
 * Converts tokens into a Condition tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: ! > && > ||):
 * <pre>
 * expression := or
 * or         := and ('||' and)*
 * and        := unary ('&&' unary)*
 * unary      := '!' unary | primary
 * primary    := '(' expression ')' | OPERAND
 * </pre>
 * The parser never throws. A missing operand becomes an empty literal, a missing
 * closing parenthesis is tolerated, and parsing stops at the first token that
 * cannot continue the expression; {@link #isComplete()} reports whether the
 * whole input was consumed.
 */
public final class ExpressionParser {

    private final List<Token> tokens;
    private int index;

    public ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a Condition tree.
     *
     * @return Root condition
     */
    public Condition parse() {
        return parseExpression();
    }

    /**
     * Whether every token was consumed by the last {@link #parse()}.
     */
    public boolean isComplete() {
        return isAtEnd();
    }

    private Condition parseExpression() {
        return parseOr();
    }

    private Condition parseOr() {
        Condition left = parseAnd();
        List<Condition> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.OR)) {
            conditions.add(parseAnd());
        }

        return conditions.size() == 1 ? left : new OrCondition(conditions);
    }

    private Condition parseAnd() {
        Condition left = parseUnary();
        List<Condition> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.AND)) {
            conditions.add(parseUnary());
        }

        return conditions.size() == 1 ? left : new AndCondition(conditions);
    }

    private Condition parseUnary() {
        if (match(TokenType.NOT)) {
            return new NotCondition(parseUnary());
        }
        return parsePrimary();
    }

    private Condition parsePrimary() {
        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            Condition expr = parseExpression();
            if (match(TokenType.RPAREN)) {
                return expr.withExplicitParens(true);
            }
            return expr;
        }

        if (match(TokenType.OPERAND)) {
            return new LiteralCondition(previous().text());
        }

        // Missing operand; leave the offending token for the caller
        return LiteralCondition.empty();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }
}
