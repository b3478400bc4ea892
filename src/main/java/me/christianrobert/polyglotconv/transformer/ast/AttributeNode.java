package me.christianrobert.polyglotconv.transformer.ast;

import java.util.Objects;

/**
 * Attribute access {@code owner.member}.
 */
public class AttributeNode extends ExpressionNode {

    private final ExpressionNode owner;
    private final String member;

    public AttributeNode(ExpressionNode owner, String member) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.member = Objects.requireNonNull(member, "member");
    }

    public ExpressionNode getOwner() {
        return owner;
    }

    public String getMember() {
        return member;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }

    @Override
    public String toString() {
        return "AttributeNode{owner=" + owner + ", member=" + member + "}";
    }
}
