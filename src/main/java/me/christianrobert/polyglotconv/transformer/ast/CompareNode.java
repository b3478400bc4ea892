package me.christianrobert.polyglotconv.transformer.ast;

import java.util.List;
import java.util.Objects;

/**
 * Comparison {@code left op1 c1 op2 c2 ...}.
 *
 * <p>The host language allows chaining ({@code a < b < c}); a plain comparison has
 * exactly one operator and one comparator.</p>
 */
public class CompareNode extends ExpressionNode {

    private final ExpressionNode left;
    private final List<CompareOperator> operators;
    private final List<ExpressionNode> comparators;

    public CompareNode(ExpressionNode left, List<CompareOperator> operators, List<ExpressionNode> comparators) {
        if (operators.isEmpty() || operators.size() != comparators.size()) {
            throw new IllegalArgumentException("Comparison needs one comparator per operator: "
                    + operators.size() + " operators, " + comparators.size() + " comparators");
        }
        this.left = Objects.requireNonNull(left, "left");
        this.operators = List.copyOf(operators);
        this.comparators = List.copyOf(comparators);
    }

    public CompareNode(ExpressionNode left, CompareOperator operator, ExpressionNode right) {
        this(left, List.of(operator), List.of(right));
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public List<CompareOperator> getOperators() {
        return operators;
    }

    public List<ExpressionNode> getComparators() {
        return comparators;
    }

    public boolean isChained() {
        return operators.size() > 1;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }

    @Override
    public String toString() {
        return "CompareNode{left=" + left + ", operators=" + operators + ", comparators=" + comparators + "}";
    }
}
