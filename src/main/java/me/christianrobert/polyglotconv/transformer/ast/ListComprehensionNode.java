package me.christianrobert.polyglotconv.transformer.ast;

import java.util.List;
import java.util.Objects;

public class ListComprehensionNode extends ExpressionNode {

    private final ExpressionNode element;
    private final List<ComprehensionGenerator> generators;

    public ListComprehensionNode(ExpressionNode element, List<ComprehensionGenerator> generators) {
        if (generators.isEmpty()) {
            throw new IllegalArgumentException("List comprehension needs at least one generator");
        }
        this.element = Objects.requireNonNull(element, "element");
        this.generators = List.copyOf(generators);
    }

    public ExpressionNode getElement() {
        return element;
    }

    public List<ComprehensionGenerator> getGenerators() {
        return generators;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitListComprehension(this);
    }

    @Override
    public String toString() {
        return "ListComprehensionNode{element=" + element + ", generators=" + generators + "}";
    }
}
