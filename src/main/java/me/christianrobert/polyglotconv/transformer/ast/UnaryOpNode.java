package me.christianrobert.polyglotconv.transformer.ast;

import java.util.Objects;

public class UnaryOpNode extends ExpressionNode {

    private final UnaryOperator operator;
    private final ExpressionNode operand;

    public UnaryOpNode(UnaryOperator operator, ExpressionNode operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public ExpressionNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
        return "UnaryOpNode{operator=" + operator + ", operand=" + operand + "}";
    }
}
