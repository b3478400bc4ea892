package me.christianrobert.polyglotconv.transformer.ast;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Call {@code function(args..., name=value..., *starArgs, **doubleStarArgs)}.
 */
public class CallNode extends ExpressionNode {

    private final ExpressionNode function;
    private final List<ExpressionNode> arguments;
    private final List<KeywordArgument> keywords;
    private final List<ExpressionNode> starArguments;
    private final List<ExpressionNode> doubleStarArguments;

    public CallNode(ExpressionNode function, List<ExpressionNode> arguments, List<KeywordArgument> keywords,
                    List<ExpressionNode> starArguments, List<ExpressionNode> doubleStarArguments) {
        this.function = Objects.requireNonNull(function, "function");
        this.arguments = List.copyOf(arguments);
        this.keywords = List.copyOf(keywords);
        this.starArguments = List.copyOf(starArguments);
        this.doubleStarArguments = List.copyOf(doubleStarArguments);
    }

    public CallNode(ExpressionNode function, List<ExpressionNode> arguments, List<KeywordArgument> keywords) {
        this(function, arguments, keywords, Collections.emptyList(), Collections.emptyList());
    }

    public CallNode(ExpressionNode function, List<ExpressionNode> arguments) {
        this(function, arguments, Collections.emptyList());
    }

    public ExpressionNode getFunction() {
        return function;
    }

    public List<ExpressionNode> getArguments() {
        return arguments;
    }

    public List<KeywordArgument> getKeywords() {
        return keywords;
    }

    public List<ExpressionNode> getStarArguments() {
        return starArguments;
    }

    public List<ExpressionNode> getDoubleStarArguments() {
        return doubleStarArguments;
    }

    public boolean hasSplatArguments() {
        return !starArguments.isEmpty() || !doubleStarArguments.isEmpty();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        return "CallNode{function=" + function + ", arguments=" + arguments + ", keywords=" + keywords + "}";
    }
}
