package me.christianrobert.polyglotconv.transformer.ast;

import java.util.List;
import java.util.Objects;

public class LambdaNode extends ExpressionNode {

    private final List<String> parameters;
    private final ExpressionNode body;

    public LambdaNode(List<String> parameters, ExpressionNode body) {
        this.parameters = List.copyOf(parameters);
        this.body = Objects.requireNonNull(body, "body");
    }

    public List<String> getParameters() {
        return parameters;
    }

    public ExpressionNode getBody() {
        return body;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }

    @Override
    public String toString() {
        return "LambdaNode{parameters=" + parameters + ", body=" + body + "}";
    }
}
