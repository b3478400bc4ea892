package me.christianrobert.polyglotconv.transformer.ast;

import java.util.List;
import java.util.Objects;

/**
 * One {@code for target in iter if cond...} clause of a {@link ListComprehensionNode}.
 */
public class ComprehensionGenerator {

    private final ExpressionNode target;
    private final ExpressionNode iterable;
    private final List<ExpressionNode> conditions;

    public ComprehensionGenerator(ExpressionNode target, ExpressionNode iterable, List<ExpressionNode> conditions) {
        this.target = Objects.requireNonNull(target, "target");
        this.iterable = Objects.requireNonNull(iterable, "iterable");
        this.conditions = List.copyOf(conditions);
    }

    public ComprehensionGenerator(ExpressionNode target, ExpressionNode iterable) {
        this(target, iterable, List.of());
    }

    public ExpressionNode getTarget() {
        return target;
    }

    public ExpressionNode getIterable() {
        return iterable;
    }

    public List<ExpressionNode> getConditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return "for " + target + " in " + iterable + (conditions.isEmpty() ? "" : " if " + conditions);
    }
}
