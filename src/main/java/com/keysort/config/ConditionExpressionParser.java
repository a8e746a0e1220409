package com.keysort.config;

import com.keysort.condition.impl.LiteralCondition;
import com.keysort.config.expression.ExpressionParser;
import com.keysort.config.expression.ExpressionTokenizer;
import com.keysort.config.expression.Token;

import java.util.List;

/**
 * Facade for parsing rule conditions into Condition trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: &amp;&amp;, ||, !</li>
 *   <li>Opaque operands: identifiers, {@code ==}/{@code !=} comparisons, {@code =~ /regex/} matches</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: ! > &amp;&amp; > || (parentheses override)
 */
public final class ConditionExpressionParser {

    private ConditionExpressionParser() {
    }

    /**
     * Parse a condition string. Never throws; an empty condition yields an empty literal.
     *
     * @param expression Condition text
     * @return Parsed condition with completeness flag
     */
    public static ParsedCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return new ParsedCondition(LiteralCondition.empty(), true);
        }

        // Tokenize
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        // Parse
        ExpressionParser parser = new ExpressionParser(tokens);
        return new ParsedCondition(parser.parse(), parser.isComplete());
    }
}
