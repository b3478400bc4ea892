package me.christianrobert.polyglotconv.testgen.model;

import me.christianrobert.polyglotconv.transformer.ast.CollectionNode;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.ast.LiteralNode;

import java.util.Locale;

/**
 * Java type a query's expected result is declared with in the generated test.
 */
public enum ExpectedType {
    INTEGER("Integer"),
    DOUBLE("Double"),
    STRING("String"),
    MAP("Map"),
    LIST("List"),
    OBJECT("Object");

    private final String javaType;

    ExpectedType(String javaType) {
        this.javaType = javaType;
    }

    public String getJavaType() {
        return javaType;
    }

    /**
     * Maps the host-language type name of an evaluated expected value
     * ({@code int}, {@code float}, {@code str}, {@code dict}, {@code list}).
     * Any other type name maps to {@link #OBJECT}.
     */
    public static ExpectedType fromHostTypeName(String typeName) {
        if (typeName == null) {
            return OBJECT;
        }
        switch (typeName.toLowerCase(Locale.ROOT)) {
            case "int":
            case "long":
                return INTEGER;
            case "float":
                return DOUBLE;
            case "str":
            case "unicode":
                return STRING;
            case "dict":
                return MAP;
            case "list":
                return LIST;
            default:
                return OBJECT;
        }
    }

    /**
     * Infers the type from the shape of an expected result expression, for test file parsers
     * that do not evaluate it.
     */
    public static ExpectedType of(ExpressionNode expected) {
        if (expected instanceof LiteralNode) {
            switch (((LiteralNode) expected).getKind()) {
                case INTEGER:
                    return INTEGER;
                case FLOAT:
                    return DOUBLE;
                case STRING:
                    return STRING;
                default:
                    return OBJECT;
            }
        }
        if (expected instanceof CollectionNode) {
            switch (((CollectionNode) expected).getKind()) {
                case MAP:
                    return MAP;
                case LIST:
                    return LIST;
                default:
                    return OBJECT;
            }
        }
        return OBJECT;
    }
}
