package com.keysort.condition;

import com.keysort.condition.impl.LiteralCondition;

import java.util.StringJoiner;

import static com.keysort.config.expression.ExpressionConfig.AND_SEPARATOR;
import static com.keysort.config.expression.ExpressionConfig.OR_SEPARATOR;

/**
 * Renders a condition tree back to text.
 * <p>
 * Parentheses are derived from the tree shape alone: an OR inside an AND, an AND
 * inside an OR, and a composite operand of NOT are wrapped; nothing else is.
 * The explicit-parenthesis flag of the nodes is ignored.
 */
public final class ConditionRenderer {

    private ConditionRenderer() {
    }

    public static String render(Condition node) {
        StringBuilder sb = new StringBuilder();
        render(node, sb);
        return sb.toString();
    }

    private static void render(Condition node, StringBuilder sb) {
        switch (node.getType()) {
            case LITERAL -> sb.append(((LiteralCondition) node).getText());
            case NOT -> {
                Condition child = node.getChildren().get(0);
                sb.append('!');
                renderChild(child, child.getType().isCommutative(), sb);
            }
            case AND -> renderJoined(node, AND_SEPARATOR, ConditionType.OR, sb);
            case OR -> renderJoined(node, OR_SEPARATOR, ConditionType.AND, sb);
        }
    }

    private static void renderJoined(Condition node, String separator, ConditionType wrapped, StringBuilder sb) {
        StringJoiner joiner = new StringJoiner(separator);
        for (Condition child : node.getChildren()) {
            StringBuilder part = new StringBuilder();
            renderChild(child, child.getType() == wrapped, part);
            joiner.add(part);
        }
        sb.append(joiner);
    }

    private static void renderChild(Condition child, boolean parenthesize, StringBuilder sb) {
        if (parenthesize) {
            sb.append('(');
            render(child, sb);
            sb.append(')');
        } else {
            render(child, sb);
        }
    }
}
