package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.AssignNode;
import me.christianrobert.polyglotconv.transformer.ast.AttributeNode;
import me.christianrobert.polyglotconv.transformer.ast.BinaryOpNode;
import me.christianrobert.polyglotconv.transformer.ast.BinaryOperator;
import me.christianrobert.polyglotconv.transformer.ast.CompareNode;
import me.christianrobert.polyglotconv.transformer.ast.CompareOperator;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.ast.LambdaNode;
import me.christianrobert.polyglotconv.transformer.ast.LiteralNode;
import me.christianrobert.polyglotconv.transformer.ast.SubscriptNode;
import me.christianrobert.polyglotconv.transformer.ast.UnaryOpNode;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import me.christianrobert.polyglotconv.transformer.util.ExpressionTreeFormatter;

import java.util.EnumMap;
import java.util.Map;

/**
 * Emission for values that are not ReQL terms: Java infix operators, field access and
 * array indexing.
 */
public class PlainEmission implements EmissionMode {

    private static final Map<BinaryOperator, String> BINARY_OPERATORS = new EnumMap<>(BinaryOperator.class);
    private static final Map<CompareOperator, String> COMPARE_OPERATORS = new EnumMap<>(CompareOperator.class);

    static {
        BINARY_OPERATORS.put(BinaryOperator.ADD, "+");
        BINARY_OPERATORS.put(BinaryOperator.SUBTRACT, "-");
        BINARY_OPERATORS.put(BinaryOperator.MULTIPLY, "*");
        BINARY_OPERATORS.put(BinaryOperator.DIVIDE, "/");
        BINARY_OPERATORS.put(BinaryOperator.MODULO, "%");

        COMPARE_OPERATORS.put(CompareOperator.LESS_THAN, "<");
        COMPARE_OPERATORS.put(CompareOperator.GREATER_THAN, ">");
        COMPARE_OPERATORS.put(CompareOperator.GREATER_EQUAL, ">=");
        COMPARE_OPERATORS.put(CompareOperator.LESS_EQUAL, "<=");
        COMPARE_OPERATORS.put(CompareOperator.EQUAL, "==");
        COMPARE_OPERATORS.put(CompareOperator.NOT_EQUAL, "!=");
    }

    PlainEmission() {
    }

    @Override
    public String getName() {
        return "plain";
    }

    @Override
    public boolean isReql() {
        return false;
    }

    @Override
    public String visitAttribute(AttributeNode node, JavaCodeBuilder b) {
        return b.parenthesize(node.getOwner(), PRECEDENCE_PRIMARY) + "." + node.getMember();
    }

    @Override
    public String visitSubscript(SubscriptNode node, JavaCodeBuilder b) {
        ExpressionNode index = node.getIndex();
        boolean integerIndex = node.getSliceKind() == SubscriptNode.SliceKind.INDEX
                && index instanceof LiteralNode
                && ((LiteralNode) index).isInteger();
        if (!integerIndex) {
            throw new UnhandledConstructException(
                    "Only integer subscripts can be converted outside a ReQL term",
                    ExpressionTreeFormatter.dump(node), "subscript");
        }
        return b.parenthesize(node.getValue(), PRECEDENCE_PRIMARY) + "[" + b.visit(index) + "]";
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node, JavaCodeBuilder b) {
        if (node.getOperator() == BinaryOperator.POWER) {
            return "Math.pow(" + b.visit(node.getLeft()) + ", " + b.visit(node.getRight()) + ")";
        }

        String symbol = BINARY_OPERATORS.get(node.getOperator());
        if (symbol == null) {
            throw new UnhandledConstructException(
                    "No Java operator for '" + node.getOperator().getSymbol() + "'",
                    ExpressionTreeFormatter.dump(node), "binary operator");
        }

        // Left associative: the right operand needs parentheses at equal precedence
        int precedence = binaryPrecedence(node.getOperator());
        String left = b.parenthesize(node.getLeft(), precedence);
        String right = b.parenthesize(node.getRight(), precedence + 1);
        return left + " " + symbol + " " + right;
    }

    @Override
    public String visitCompare(CompareNode node, JavaCodeBuilder b) {
        if (node.isChained()) {
            throw new UnhandledConstructException(
                    "Chained comparisons have no Java form",
                    ExpressionTreeFormatter.dump(node), "comparison");
        }

        CompareOperator operator = node.getOperators().get(0);
        String symbol = COMPARE_OPERATORS.get(operator);
        if (symbol == null) {
            throw new UnhandledConstructException(
                    "No Java operator for '" + operator.getSymbol() + "'",
                    ExpressionTreeFormatter.dump(node), "comparison");
        }

        int precedence = comparePrecedence(operator);
        String left = b.parenthesize(node.getLeft(), precedence + 1);
        String right = b.parenthesize(node.getComparators().get(0), precedence + 1);
        return left + " " + symbol + " " + right;
    }

    @Override
    public int precedence(ExpressionNode node) {
        if (node instanceof BinaryOpNode) {
            BinaryOperator operator = ((BinaryOpNode) node).getOperator();
            return BINARY_OPERATORS.containsKey(operator) ? binaryPrecedence(operator) : PRECEDENCE_PRIMARY;
        }
        if (node instanceof CompareNode) {
            return comparePrecedence(((CompareNode) node).getOperators().get(0));
        }
        if (node instanceof UnaryOpNode) {
            return PRECEDENCE_UNARY;
        }
        if (node instanceof LambdaNode || node instanceof AssignNode) {
            return PRECEDENCE_LAMBDA;
        }
        return PRECEDENCE_PRIMARY;
    }

    private static int binaryPrecedence(BinaryOperator operator) {
        switch (operator) {
            case ADD:
            case SUBTRACT:
                return PRECEDENCE_ADDITIVE;
            case MULTIPLY:
            case DIVIDE:
            case MODULO:
                return PRECEDENCE_MULTIPLICATIVE;
            default:
                return PRECEDENCE_PRIMARY;
        }
    }

    private static int comparePrecedence(CompareOperator operator) {
        if (operator == CompareOperator.EQUAL || operator == CompareOperator.NOT_EQUAL) {
            return PRECEDENCE_EQUALITY;
        }
        return PRECEDENCE_RELATIONAL;
    }
}
