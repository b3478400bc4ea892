package me.christianrobert.polyglotconv.transformer.ast;

import java.util.List;

/**
 * List, tuple or dict display.
 *
 * <p>For LIST and TUPLE the items are in {@link #getElements()}; for MAP the entries are
 * the parallel lists {@link #getKeys()} / {@link #getValues()} in source order.</p>
 */
public class CollectionNode extends ExpressionNode {

    public enum Kind {
        LIST,
        TUPLE,
        MAP
    }

    private final Kind kind;
    private final List<ExpressionNode> elements;
    private final List<ExpressionNode> keys;
    private final List<ExpressionNode> values;

    private CollectionNode(Kind kind, List<ExpressionNode> elements, List<ExpressionNode> keys,
                           List<ExpressionNode> values) {
        this.kind = kind;
        this.elements = List.copyOf(elements);
        this.keys = List.copyOf(keys);
        this.values = List.copyOf(values);
    }

    public static CollectionNode list(List<ExpressionNode> elements) {
        return new CollectionNode(Kind.LIST, elements, List.of(), List.of());
    }

    public static CollectionNode tuple(List<ExpressionNode> elements) {
        return new CollectionNode(Kind.TUPLE, elements, List.of(), List.of());
    }

    public static CollectionNode map(List<ExpressionNode> keys, List<ExpressionNode> values) {
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException(
                    "Map display needs one value per key: " + keys.size() + " keys, " + values.size() + " values");
        }
        return new CollectionNode(Kind.MAP, List.of(), keys, values);
    }

    public Kind getKind() {
        return kind;
    }

    public List<ExpressionNode> getElements() {
        return elements;
    }

    public List<ExpressionNode> getKeys() {
        return keys;
    }

    public List<ExpressionNode> getValues() {
        return values;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCollection(this);
    }

    @Override
    public String toString() {
        if (kind == Kind.MAP) {
            return "CollectionNode{kind=MAP, keys=" + keys + ", values=" + values + "}";
        }
        return "CollectionNode{kind=" + kind + ", elements=" + elements + "}";
    }
}
