package com.keysort.canonical;

import com.keysort.condition.Condition;
import com.keysort.condition.ConditionRenderer;
import com.keysort.condition.ConditionType;
import com.keysort.condition.impl.AndCondition;
import com.keysort.condition.impl.LiteralCondition;
import com.keysort.condition.impl.NotCondition;
import com.keysort.condition.impl.OrCondition;
import com.keysort.config.ClassificationProfiles;
import com.keysort.config.ConditionExpressionParser;
import com.keysort.config.GroupingMode;
import com.keysort.config.IdentifierPatterns;
import com.keysort.config.ParsedCondition;
import com.keysort.config.PriorityMatcher;
import com.keysort.config.SortPolicy;
import com.keysort.config.TieBreakMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites conditions into their canonical form.
 * <p>
 * Post-order over the tree:
 * <ul>
 *   <li>OR: nested ORs are flattened, operands ordered by natural key, duplicates dropped.</li>
 *   <li>AND: nested ANDs are flattened (ORs never are), priority-list operands moved to
 *       the front, the rest ordered by (bucket rank, tie-break key), duplicates dropped.</li>
 *   <li>NOT: only its operand is rewritten.</li>
 * </ul>
 * Empty operands are dropped from AND/OR, a node left with one operand collapses to it,
 * and all explicit-parenthesis flags are cleared. Duplicates are exact render matches,
 * so {@code a} and {@code !a} are always kept apart.
 * <p>
 * String results are memoized per (condition, grouping, tie-break, priority list) for the
 * lifetime of this instance.
 */
public class Canonicalizer {

    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    private final OperandClassifier classifier;
    private final Map<CacheKey, String> cache;

    public Canonicalizer(ClassificationProfiles profiles) {
        this(new OperandClassifier(profiles), new HashMap<>());
    }

    public Canonicalizer(OperandClassifier classifier, Map<CacheKey, String> cache) {
        this.classifier = classifier;
        this.cache = cache;
    }

    public OperandClassifier getClassifier() {
        return classifier;
    }

    /**
     * Canonicalize a condition string.
     * A condition the parser cannot fully consume is returned unchanged.
     *
     * @param condition Condition text, may be null
     * @param policy    Active policy
     * @return Canonical rendering, empty for an empty condition
     */
    public String canonicalize(String condition, SortPolicy policy) {
        if (condition == null || condition.isBlank()) {
            return "";
        }
        CacheKey key = new CacheKey(condition, policy.grouping(), policy.tieBreak(), policy.priorities());
        String cached = cache.get(key);
        if (cached != null) {
            return cached;
        }

        String result;
        ParsedCondition parsed = ConditionExpressionParser.parse(condition);
        if (parsed.complete()) {
            result = ConditionRenderer.render(canonicalize(parsed.root(), policy));
        } else {
            log.debug("Condition '{}' is not fully parseable, leaving it unchanged", condition);
            result = condition;
        }

        cache.put(key, result);
        log.debug("Canonicalized '{}' -> '{}'", condition, result);
        return result;
    }

    /**
     * Canonicalize a parsed tree.
     */
    public Condition canonicalize(Condition node, SortPolicy policy) {
        return switch (node.getType()) {
            case LITERAL -> node.withExplicitParens(false);
            case NOT -> new NotCondition(canonicalize(node.getChildren().get(0), policy));
            case OR -> canonicalOr(node, policy);
            case AND -> canonicalAnd(node, policy);
        };
    }

    /**
     * Number of memoized conditions.
     */
    public int cacheSize() {
        return cache.size();
    }

    private Condition canonicalOr(Condition node, SortPolicy policy) {
        List<Operand> operands = flattenedOperands(node, ConditionType.OR, policy);

        // OR order is fixed: natural key regardless of the tie-break mode
        operands.sort(Comparator
                .comparing((Operand o) -> NaturalKey.of(o.rendered()))
                .thenComparing(Operand::rendered)
                .thenComparingInt(Operand::index));

        return rebuild(ConditionType.OR, unique(operands));
    }

    private Condition canonicalAnd(Condition node, SortPolicy policy) {
        List<Operand> operands = flattenedOperands(node, ConditionType.AND, policy);

        // Priority entries first, in list order
        List<Operand> prioritized = new ArrayList<>();
        for (PriorityMatcher matcher : policy.priorities()) {
            List<Operand> matches = new ArrayList<>();
            for (Operand operand : operands) {
                if (matcher.matches(IdentifierPatterns.leftIdentifier(operand.rendered()))) {
                    matches.add(operand);
                }
            }
            matches.sort(Comparator
                    .comparing((Operand o) -> NaturalKey.caseSensitive(o.rendered()))
                    .thenComparing(Operand::rendered)
                    .thenComparingInt(Operand::index));
            prioritized.addAll(matches);
            operands.removeAll(matches);
        }

        TieBreakMode tieBreak = policy.tieBreak();
        operands.sort(Comparator.comparing((Operand o) -> CompositeKey.builder()
                .add(classifier.rank(o.rendered(), policy))
                .addAll(TieBreakKeys.of(o.rendered(), tieBreak))
                .add(o.index())
                .build()));

        List<Operand> merged = new ArrayList<>(prioritized);
        merged.addAll(operands);
        return rebuild(ConditionType.AND, unique(merged));
    }

    private List<Operand> flattenedOperands(Condition node, ConditionType type, SortPolicy policy) {
        List<Operand> operands = new ArrayList<>();
        for (Condition child : node.getChildren()) {
            Condition rewritten = canonicalize(child, policy);
            if (rewritten.getType() == type) {
                for (Condition grandchild : rewritten.getChildren()) {
                    addOperand(operands, grandchild);
                }
            } else {
                addOperand(operands, rewritten);
            }
        }
        return operands;
    }

    private static void addOperand(List<Operand> operands, Condition node) {
        if (node instanceof LiteralCondition literal && literal.isEmpty()) {
            return;
        }
        operands.add(new Operand(operands.size(), node, ConditionRenderer.render(node)));
    }

    private static List<Operand> unique(List<Operand> operands) {
        Set<String> seen = new HashSet<>();
        List<Operand> result = new ArrayList<>();
        for (Operand operand : operands) {
            if (seen.add(operand.rendered())) {
                result.add(operand);
            }
        }
        return result;
    }

    private static Condition rebuild(ConditionType type, List<Operand> operands) {
        if (operands.isEmpty()) {
            return LiteralCondition.empty();
        }
        if (operands.size() == 1) {
            return operands.get(0).node();
        }
        List<Condition> children = operands.stream().map(Operand::node).toList();
        return type == ConditionType.AND ? new AndCondition(children) : new OrCondition(children);
    }

    private record Operand(int index, Condition node, String rendered) {
    }

    /**
     * Memoization key: canonical form is a pure function of these inputs.
     */
    public record CacheKey(
            String condition,
            GroupingMode grouping,
            TieBreakMode tieBreak,
            List<PriorityMatcher> priorities
    ) {
    }
}
