package me.christianrobert.polyglotconv.transformer.ast;

import java.util.Objects;

public class BinaryOpNode extends ExpressionNode {

    private final ExpressionNode left;
    private final BinaryOperator operator;
    private final ExpressionNode right;

    public BinaryOpNode(ExpressionNode left, BinaryOperator operator, ExpressionNode right) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public ExpressionNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String toString() {
        return "BinaryOpNode{left=" + left + ", operator=" + operator + ", right=" + right + "}";
    }
}
