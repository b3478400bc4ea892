package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.AssignNode;
import me.christianrobert.polyglotconv.transformer.ast.AttributeNode;
import me.christianrobert.polyglotconv.transformer.ast.BinaryOpNode;
import me.christianrobert.polyglotconv.transformer.ast.CallNode;
import me.christianrobert.polyglotconv.transformer.ast.CollectionNode;
import me.christianrobert.polyglotconv.transformer.ast.CompareNode;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionVisitor;
import me.christianrobert.polyglotconv.transformer.ast.LambdaNode;
import me.christianrobert.polyglotconv.transformer.ast.ListComprehensionNode;
import me.christianrobert.polyglotconv.transformer.ast.LiteralNode;
import me.christianrobert.polyglotconv.transformer.ast.NameNode;
import me.christianrobert.polyglotconv.transformer.ast.SubscriptNode;
import me.christianrobert.polyglotconv.transformer.ast.UnaryOpNode;
import me.christianrobert.polyglotconv.transformer.context.ConversionContext;
import me.christianrobert.polyglotconv.transformer.context.ConversionException;
import me.christianrobert.polyglotconv.transformer.context.ConversionResult;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Emits Java source text for a host-language expression tree.
 *
 * <p>Each node kind is handled by a static {@code VisitX} helper; attribute access,
 * subscripts, binary operators and comparisons go through the builder's
 * {@link EmissionMode} instead, because their Java form depends on whether the
 * expression is a ReQL term.</p>
 *
 * <p>The mode applies to the whole subtree (lambda bodies and arguments of a ReQL
 * expression are emitted in ReQL mode as well), except for assignment values, which
 * {@link VisitAssign} classifies on their own.</p>
 *
 * <p>Builders are immutable and hold no output state, so converting the same tree twice
 * yields identical text.</p>
 */
public class JavaCodeBuilder implements ExpressionVisitor<String> {

    // no logging is desired, failures are reported once per test item by the converter

    private final ConversionContext context;
    private final EmissionMode mode;

    public JavaCodeBuilder(ConversionContext context, EmissionMode mode) {
        this.context = Objects.requireNonNull(context, "context");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    /**
     * Creates a builder in plain mode.
     */
    public JavaCodeBuilder(ConversionContext context) {
        this(context, EmissionMode.PLAIN);
    }

    /**
     * Creates a builder whose mode matches the term type of {@code node}.
     */
    public static JavaCodeBuilder forTerm(ConversionContext context, ExpressionNode node) {
        return new JavaCodeBuilder(context, context.isReql(node) ? EmissionMode.REQL : EmissionMode.PLAIN);
    }

    public ConversionContext getContext() {
        return context;
    }

    public EmissionMode getMode() {
        return mode;
    }

    /**
     * Returns a builder sharing this builder's context in the given mode.
     */
    public JavaCodeBuilder withMode(EmissionMode mode) {
        if (this.mode == mode) {
            return this;
        }
        return new JavaCodeBuilder(context, mode);
    }

    /**
     * Converts an expression, turning unhandled and skipped constructs into a result
     * instead of an exception.
     *
     * @param node Expression to convert
     * @return Java source text, or the reason the expression cannot be converted
     */
    public ConversionResult convert(ExpressionNode node) {
        try {
            return ConversionResult.success(visit(node));
        } catch (ConversionException e) {
            return ConversionResult.failure(e);
        }
    }

    /**
     * Emits Java source for a node.
     *
     * @throws UnhandledConstructException if the node has no Java translation
     * @throws me.christianrobert.polyglotconv.transformer.context.SkippedConstructException
     *         if the node is deliberately unsupported for Java
     */
    public String visit(ExpressionNode node) {
        if (node == null) {
            throw new UnhandledConstructException("Missing expression");
        }
        return node.accept(this);
    }

    /**
     * Emits each node and joins the results with {@code separator}.
     */
    public String join(List<? extends ExpressionNode> nodes, String separator) {
        return nodes.stream()
                .map(this::visit)
                .collect(Collectors.joining(separator));
    }

    /**
     * Emits a node, wrapping it in parentheses when its Java form binds weaker than
     * {@code minimumPrecedence}.
     */
    public String parenthesize(ExpressionNode node, int minimumPrecedence) {
        String code = visit(node);
        if (mode.precedence(node) < minimumPrecedence) {
            return "(" + code + ")";
        }
        return code;
    }

    // ========== Mode independent ==========

    @Override
    public String visitLiteral(LiteralNode node) {
        return VisitLiteral.v(node, this);
    }

    @Override
    public String visitName(NameNode node) {
        return VisitName.v(node, this);
    }

    @Override
    public String visitCall(CallNode node) {
        return VisitCall.v(node, this);
    }

    @Override
    public String visitCollection(CollectionNode node) {
        return VisitCollection.v(node, this);
    }

    @Override
    public String visitLambda(LambdaNode node) {
        return VisitLambda.v(node, this);
    }

    @Override
    public String visitUnaryOp(UnaryOpNode node) {
        return VisitUnaryOp.v(node, this);
    }

    @Override
    public String visitAssign(AssignNode node) {
        return VisitAssign.v(node, this);
    }

    @Override
    public String visitListComprehension(ListComprehensionNode node) {
        return VisitListComprehension.v(node, this);
    }

    // ========== Mode dependent ==========

    @Override
    public String visitAttribute(AttributeNode node) {
        return mode.visitAttribute(node, this);
    }

    @Override
    public String visitSubscript(SubscriptNode node) {
        return mode.visitSubscript(node, this);
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node) {
        return mode.visitBinaryOp(node, this);
    }

    @Override
    public String visitCompare(CompareNode node) {
        return mode.visitCompare(node, this);
    }
}
