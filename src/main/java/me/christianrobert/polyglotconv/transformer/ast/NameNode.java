package me.christianrobert.polyglotconv.transformer.ast;

import java.util.Objects;

public class NameNode extends ExpressionNode {

    private final String id;

    public NameNode(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitName(this);
    }

    @Override
    public String toString() {
        return "NameNode{id=" + id + "}";
    }
}
