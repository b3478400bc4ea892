package me.christianrobert.polyglotconv.transformer.ast;

import java.util.Objects;

/**
 * Named argument {@code name=value} of a {@link CallNode}.
 */
public class KeywordArgument {

    private final String name;
    private final ExpressionNode value;

    public KeywordArgument(String name, ExpressionNode value) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getName() {
        return name;
    }

    public ExpressionNode getValue() {
        return value;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
