package me.christianrobert.polyglotconv.transformer.type;

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
import me.christianrobert.polyglotconv.transformer.context.ReqlVariables;

import java.util.Objects;

/**
 * Syntactic term type evaluator.
 * <p>
 * Rules:
 * <ul>
 *   <li>A name is a ReQL term iff it is one of the known ReQL variables</li>
 *   <li>Calls, attribute accesses and subscripts are ReQL terms iff the thing being
 *       called / accessed / indexed is one ({@code r.table('x').get(1)} resolves through
 *       the chain down to {@code r})</li>
 *   <li>Binary operations and comparisons take the type of their left operand</li>
 *   <li>An assignment has the type of its value</li>
 *   <li>Literals, collections, lambdas, unary operations and comprehensions are plain</li>
 * </ul>
 * <p>
 * Results are not cached: each node is classified at most a handful of times per pass.
 * </p>
 */
public class SimpleTermTypeEvaluator implements TermTypeEvaluator, ExpressionVisitor<TermType> {

    private final ReqlVariables reqlVariables;

    /**
     * @param reqlVariables Names currently bound to ReQL terms (read-only snapshot)
     */
    public SimpleTermTypeEvaluator(ReqlVariables reqlVariables) {
        this.reqlVariables = Objects.requireNonNull(reqlVariables, "reqlVariables");
    }

    public ReqlVariables getReqlVariables() {
        return reqlVariables;
    }

    @Override
    public TermType getType(ExpressionNode node) {
        Objects.requireNonNull(node, "node");
        return node.accept(this);
    }

    @Override
    public TermType visitLiteral(LiteralNode node) {
        return TermType.PLAIN;
    }

    @Override
    public TermType visitName(NameNode node) {
        return reqlVariables.contains(node.getId()) ? TermType.REQL : TermType.PLAIN;
    }

    @Override
    public TermType visitAttribute(AttributeNode node) {
        return getType(node.getOwner());
    }

    @Override
    public TermType visitCall(CallNode node) {
        return getType(node.getFunction());
    }

    @Override
    public TermType visitSubscript(SubscriptNode node) {
        return getType(node.getValue());
    }

    @Override
    public TermType visitCollection(CollectionNode node) {
        return TermType.PLAIN;
    }

    @Override
    public TermType visitLambda(LambdaNode node) {
        return TermType.PLAIN;
    }

    @Override
    public TermType visitUnaryOp(UnaryOpNode node) {
        return TermType.PLAIN;
    }

    @Override
    public TermType visitBinaryOp(BinaryOpNode node) {
        return getType(node.getLeft());
    }

    @Override
    public TermType visitCompare(CompareNode node) {
        return getType(node.getLeft());
    }

    @Override
    public TermType visitAssign(AssignNode node) {
        return getType(node.getValue());
    }

    @Override
    public TermType visitListComprehension(ListComprehensionNode node) {
        return TermType.PLAIN;
    }
}
