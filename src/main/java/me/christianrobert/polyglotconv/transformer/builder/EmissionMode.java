package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.AttributeNode;
import me.christianrobert.polyglotconv.transformer.ast.BinaryOpNode;
import me.christianrobert.polyglotconv.transformer.ast.CompareNode;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.ast.SubscriptNode;

/**
 * The node kinds whose Java form depends on whether the expression is a ReQL term.
 *
 * <p>{@link JavaCodeBuilder} handles every other node kind itself and delegates these four
 * to its mode:
 * <ul>
 *   <li>{@link #PLAIN} - Java operators, field access and array indexing</li>
 *   <li>{@link #REQL} - method calls on the ReQL API ({@code r.add(a, b)},
 *       {@code x.bracket("f")}, {@code t.getField("f")})</li>
 * </ul>
 *
 * <p>Also reports operator precedence of the emitted form, so the builder knows when an
 * operand needs parentheses.</p>
 */
public interface EmissionMode {

    EmissionMode PLAIN = new PlainEmission();
    EmissionMode REQL = new ReqlEmission();

    int PRECEDENCE_LAMBDA = 0;
    int PRECEDENCE_EQUALITY = 1;
    int PRECEDENCE_RELATIONAL = 2;
    int PRECEDENCE_ADDITIVE = 3;
    int PRECEDENCE_MULTIPLICATIVE = 4;
    int PRECEDENCE_UNARY = 5;
    int PRECEDENCE_PRIMARY = 6;

    String getName();

    boolean isReql();

    String visitAttribute(AttributeNode node, JavaCodeBuilder b);

    String visitSubscript(SubscriptNode node, JavaCodeBuilder b);

    String visitBinaryOp(BinaryOpNode node, JavaCodeBuilder b);

    String visitCompare(CompareNode node, JavaCodeBuilder b);

    /**
     * Java precedence of the code this mode emits for {@code node}
     * ({@link #PRECEDENCE_PRIMARY} for calls, literals, names and other atoms).
     */
    int precedence(ExpressionNode node);
}
