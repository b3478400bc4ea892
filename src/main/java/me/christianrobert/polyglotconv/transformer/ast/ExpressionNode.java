package me.christianrobert.polyglotconv.transformer.ast;

/**
 * Base class of the host-language expression tree.
 *
 * <p>The set of node kinds is closed: the constructor is package-private, so every
 * subclass lives in this package and has a matching {@code visitX} method on
 * {@link ExpressionVisitor}. Adding a node kind therefore breaks compilation of every
 * emitter and classifier until they handle it.</p>
 *
 * <p>Node kinds:
 * <ul>
 *   <li>{@link LiteralNode} - string, bytes, integer, float, boolean, None</li>
 *   <li>{@link NameNode} - bare identifier</li>
 *   <li>{@link AttributeNode} - {@code owner.member}</li>
 *   <li>{@link CallNode} - {@code callee(args, key=value)}</li>
 *   <li>{@link SubscriptNode} - {@code value[index]}, {@code value[lower:upper]}</li>
 *   <li>{@link CollectionNode} - list, tuple, dict displays</li>
 *   <li>{@link LambdaNode} - {@code lambda a, b: body}</li>
 *   <li>{@link UnaryOpNode} - {@code -x}, {@code not x}, {@code +x}, {@code ~x}</li>
 *   <li>{@link BinaryOpNode} - arithmetic and bitwise operators</li>
 *   <li>{@link CompareNode} - (possibly chained) comparisons</li>
 *   <li>{@link AssignNode} - {@code name = value}</li>
 *   <li>{@link ListComprehensionNode} - {@code [elt for x in iter]}</li>
 * </ul>
 *
 * <p>Nodes are immutable.</p>
 */
public abstract class ExpressionNode {

    ExpressionNode() {
    }

    /**
     * Dispatches to the {@code visitX} method matching this node kind.
     */
    public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
