package me.christianrobert.polyglotconv.testgen.model;

import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;

import java.util.Objects;

/**
 * A host-language source line, optionally with its already parsed expression tree.
 * Terms without a tree are parsed by the converter.
 */
public class Term {

    private final String line;
    private final ExpressionNode ast;

    public Term(String line, ExpressionNode ast) {
        this.line = Objects.requireNonNull(line, "line");
        this.ast = ast;
    }

    public Term(String line) {
        this(line, null);
    }

    public String getLine() {
        return line;
    }

    public ExpressionNode getAst() {
        return ast;
    }

    public boolean isParsed() {
        return ast != null;
    }

    @Override
    public String toString() {
        return "Term{line='" + line + "'}";
    }
}
