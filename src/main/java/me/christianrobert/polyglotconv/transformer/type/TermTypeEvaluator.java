package me.christianrobert.polyglotconv.transformer.type;

import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;

/**
 * Strategy interface for deciding whether an expression produces a ReQL term.
 * <p>
 * The answer selects the emission mode: ReQL terms are emitted as fluent method
 * chains, plain values with Java operators and literals.
 * </p>
 * <p>
 * <strong>Usage:</strong> the test converter asks once per definition right-hand side and
 * once per expected result; {@code VisitAssign} asks for nested assignments.
 * </p>
 *
 * @see SimpleTermTypeEvaluator
 */
public interface TermTypeEvaluator {

    /**
     * Evaluates the term type of an expression node.
     *
     * @param node The expression to classify (must not be null)
     * @return {@link TermType#REQL} if the expression evaluates to a ReQL term
     */
    TermType getType(ExpressionNode node);

    default boolean isReql(ExpressionNode node) {
        return getType(node) == TermType.REQL;
    }
}
