package me.christianrobert.polyglotconv.transformer.ast;

/**
 * Visitor over the closed set of expression node kinds.
 *
 * @param <R> result of visiting a node
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(LiteralNode node);

    R visitName(NameNode node);

    R visitAttribute(AttributeNode node);

    R visitCall(CallNode node);

    R visitSubscript(SubscriptNode node);

    R visitCollection(CollectionNode node);

    R visitLambda(LambdaNode node);

    R visitUnaryOp(UnaryOpNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitCompare(CompareNode node);

    R visitAssign(AssignNode node);

    R visitListComprehension(ListComprehensionNode node);
}
