package me.christianrobert.polyglotconv.transformer.ast;

import java.util.List;
import java.util.Objects;

/**
 * Subscript {@code value[...]}.
 *
 * <p>Three shapes, distinguished by {@link SliceKind}:
 * <ul>
 *   <li>INDEX - {@code a[i]}: {@link #getIndex()} is set</li>
 *   <li>SLICE - {@code a[lower:upper]} or {@code a[lower:upper:step]}: bounds may be null,
 *       {@link #hasStep()} is true when a second colon was written</li>
 *   <li>EXTENDED - {@code a[1:2, 3]}: {@link #getDimensions()} holds one subscript per dimension</li>
 * </ul>
 */
public class SubscriptNode extends ExpressionNode {

    public enum SliceKind {
        INDEX,
        SLICE,
        EXTENDED
    }

    private final ExpressionNode value;
    private final SliceKind sliceKind;
    private final ExpressionNode index;
    private final ExpressionNode lower;
    private final ExpressionNode upper;
    private final ExpressionNode step;
    private final boolean hasStep;
    private final List<SubscriptNode> dimensions;

    private SubscriptNode(ExpressionNode value, SliceKind sliceKind, ExpressionNode index,
                          ExpressionNode lower, ExpressionNode upper, ExpressionNode step, boolean hasStep,
                          List<SubscriptNode> dimensions) {
        this.value = Objects.requireNonNull(value, "value");
        this.sliceKind = sliceKind;
        this.index = index;
        this.lower = lower;
        this.upper = upper;
        this.step = step;
        this.hasStep = hasStep;
        this.dimensions = dimensions;
    }

    public static SubscriptNode index(ExpressionNode value, ExpressionNode index) {
        return new SubscriptNode(value, SliceKind.INDEX, Objects.requireNonNull(index, "index"),
                null, null, null, false, List.of());
    }

    public static SubscriptNode slice(ExpressionNode value, ExpressionNode lower, ExpressionNode upper) {
        return new SubscriptNode(value, SliceKind.SLICE, null, lower, upper, null, false, List.of());
    }

    public static SubscriptNode slice(ExpressionNode value, ExpressionNode lower, ExpressionNode upper,
                                      ExpressionNode step, boolean hasStep) {
        return new SubscriptNode(value, SliceKind.SLICE, null, lower, upper, step, hasStep || step != null, List.of());
    }

    /**
     * Multi-dimensional subscript. Each dimension is an INDEX or SLICE subscript of {@code value}.
     */
    public static SubscriptNode extended(ExpressionNode value, List<SubscriptNode> dimensions) {
        return new SubscriptNode(value, SliceKind.EXTENDED, null, null, null, null, false, List.copyOf(dimensions));
    }

    public ExpressionNode getValue() {
        return value;
    }

    public SliceKind getSliceKind() {
        return sliceKind;
    }

    public ExpressionNode getIndex() {
        return index;
    }

    public ExpressionNode getLower() {
        return lower;
    }

    public ExpressionNode getUpper() {
        return upper;
    }

    public ExpressionNode getStep() {
        return step;
    }

    public boolean hasStep() {
        return hasStep;
    }

    public List<SubscriptNode> getDimensions() {
        return dimensions;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }

    @Override
    public String toString() {
        switch (sliceKind) {
            case INDEX:
                return "SubscriptNode{value=" + value + ", index=" + index + "}";
            case SLICE:
                return "SubscriptNode{value=" + value + ", lower=" + lower + ", upper=" + upper
                        + (hasStep ? ", step=" + step : "") + "}";
            default:
                return "SubscriptNode{value=" + value + ", dimensions=" + dimensions.size() + "}";
        }
    }
}
