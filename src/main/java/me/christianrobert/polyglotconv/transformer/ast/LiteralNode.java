package me.christianrobert.polyglotconv.transformer.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Literal constant: string, bytes, integer, float, boolean or None.
 *
 * <p>Bytes payloads are kept as a string with one char per byte (ISO-8859-1).
 * Integers are arbitrary precision, as in the host language.</p>
 */
public class LiteralNode extends ExpressionNode {

    public enum Kind {
        STRING,
        BYTES,
        INTEGER,
        FLOAT,
        BOOLEAN,
        NONE
    }

    private static final LiteralNode TRUE = new LiteralNode(Kind.BOOLEAN, Boolean.TRUE);
    private static final LiteralNode FALSE = new LiteralNode(Kind.BOOLEAN, Boolean.FALSE);
    private static final LiteralNode NONE = new LiteralNode(Kind.NONE, null);

    private final Kind kind;
    private final Object value;

    private LiteralNode(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static LiteralNode ofString(String value) {
        return new LiteralNode(Kind.STRING, Objects.requireNonNull(value, "value"));
    }

    public static LiteralNode ofBytes(String latin1Value) {
        return new LiteralNode(Kind.BYTES, Objects.requireNonNull(latin1Value, "latin1Value"));
    }

    public static LiteralNode ofInteger(BigInteger value) {
        return new LiteralNode(Kind.INTEGER, Objects.requireNonNull(value, "value"));
    }

    public static LiteralNode ofInteger(long value) {
        return ofInteger(BigInteger.valueOf(value));
    }

    public static LiteralNode ofFloat(double value) {
        return new LiteralNode(Kind.FLOAT, value);
    }

    public static LiteralNode ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static LiteralNode none() {
        return NONE;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isInteger() {
        return kind == Kind.INTEGER;
    }

    public String getStringValue() {
        if (kind != Kind.STRING && kind != Kind.BYTES) {
            throw new IllegalStateException("Not a string literal: " + kind);
        }
        return (String) value;
    }

    public BigInteger getIntegerValue() {
        if (kind != Kind.INTEGER) {
            throw new IllegalStateException("Not an integer literal: " + kind);
        }
        return (BigInteger) value;
    }

    public double getFloatValue() {
        if (kind != Kind.FLOAT) {
            throw new IllegalStateException("Not a float literal: " + kind);
        }
        return (Double) value;
    }

    public boolean getBooleanValue() {
        if (kind != Kind.BOOLEAN) {
            throw new IllegalStateException("Not a boolean literal: " + kind);
        }
        return (Boolean) value;
    }

    /**
     * Raw payload (String, BigInteger, Double, Boolean or null).
     */
    public Object getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return "LiteralNode{kind=" + kind + ", value=" + value + "}";
    }
}
