package me.christianrobert.polyglotconv.transformer.ast;

import java.util.List;
import java.util.Objects;

/**
 * Assignment {@code t1 = t2 = ... = value}. Targets are in source order.
 */
public class AssignNode extends ExpressionNode {

    private final List<ExpressionNode> targets;
    private final ExpressionNode value;

    public AssignNode(List<ExpressionNode> targets, ExpressionNode value) {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("Assignment needs at least one target");
        }
        this.targets = List.copyOf(targets);
        this.value = Objects.requireNonNull(value, "value");
    }

    public AssignNode(String target, ExpressionNode value) {
        this(List.of(new NameNode(target)), value);
    }

    public List<ExpressionNode> getTargets() {
        return targets;
    }

    public ExpressionNode getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public String toString() {
        return "AssignNode{targets=" + targets + ", value=" + value + "}";
    }
}
