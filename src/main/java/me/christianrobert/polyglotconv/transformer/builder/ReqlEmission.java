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
import me.christianrobert.polyglotconv.transformer.ast.NameNode;
import me.christianrobert.polyglotconv.transformer.ast.SubscriptNode;
import me.christianrobert.polyglotconv.transformer.ast.UnaryOpNode;
import me.christianrobert.polyglotconv.transformer.ast.UnaryOperator;
import me.christianrobert.polyglotconv.transformer.context.SkippedConstructException;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import me.christianrobert.polyglotconv.transformer.util.ExpressionTreeFormatter;
import me.christianrobert.polyglotconv.transformer.util.NameConverter;

import java.util.EnumMap;
import java.util.Map;

import static me.christianrobert.polyglotconv.transformer.util.JavaLiteralFormatter.integerLiteral;

/**
 * Emission for ReQL terms.
 *
 * <p>Operators become static calls on the root ({@code a + b -> r.add(a, b)}), attributes
 * become driver method names ({@code get_field -> getField}), and subscripts become
 * {@code bracket}/{@code slice} calls.</p>
 */
public class ReqlEmission implements EmissionMode {

    public static final String REQL_ROOT = "r";

    private static final String ROW_ATTRIBUTE = "row";

    private static final Map<BinaryOperator, String> BINARY_METHODS = new EnumMap<>(BinaryOperator.class);
    private static final Map<CompareOperator, String> COMPARE_METHODS = new EnumMap<>(CompareOperator.class);

    static {
        BINARY_METHODS.put(BinaryOperator.ADD, "add");
        BINARY_METHODS.put(BinaryOperator.SUBTRACT, "sub");
        BINARY_METHODS.put(BinaryOperator.MULTIPLY, "mul");
        BINARY_METHODS.put(BinaryOperator.DIVIDE, "div");
        BINARY_METHODS.put(BinaryOperator.MODULO, "mod");
        BINARY_METHODS.put(BinaryOperator.BIT_AND, "and");
        BINARY_METHODS.put(BinaryOperator.BIT_OR, "or");

        COMPARE_METHODS.put(CompareOperator.LESS_THAN, "lt");
        COMPARE_METHODS.put(CompareOperator.GREATER_THAN, "gt");
        COMPARE_METHODS.put(CompareOperator.GREATER_EQUAL, "ge");
        COMPARE_METHODS.put(CompareOperator.LESS_EQUAL, "le");
        COMPARE_METHODS.put(CompareOperator.EQUAL, "eq");
        COMPARE_METHODS.put(CompareOperator.NOT_EQUAL, "ne");
    }

    ReqlEmission() {
    }

    @Override
    public String getName() {
        return "reql";
    }

    @Override
    public boolean isReql() {
        return true;
    }

    @Override
    public String visitAttribute(AttributeNode node, JavaCodeBuilder b) {
        ExpressionNode owner = node.getOwner();
        if (ROW_ATTRIBUTE.equals(node.getMember())
                && owner instanceof NameNode
                && REQL_ROOT.equals(((NameNode) owner).getId())) {
            throw new SkippedConstructException("Java driver doesn't support r.row");
        }
        return b.parenthesize(owner, PRECEDENCE_PRIMARY) + "." + NameConverter.reqlMethodName(node.getMember());
    }

    @Override
    public String visitSubscript(SubscriptNode node, JavaCodeBuilder b) {
        String value = b.parenthesize(node.getValue(), PRECEDENCE_PRIMARY);
        switch (node.getSliceKind()) {
            case INDEX:
                return value + ".bracket(" + b.visit(node.getIndex()) + ")";
            case SLICE:
                // An empty step (a[1:2:]) means the default step of one
                if (node.getStep() != null) {
                    throw new UnhandledConstructException(
                            "Slices with a step are not supported",
                            ExpressionTreeFormatter.dump(node), "slice");
                }
                // Open bounds default to the whole sequence
                String lower = sliceBound(node.getLower(), "0");
                String upper = sliceBound(node.getUpper(), "-1");
                return value + ".slice(" + lower + ", " + upper + ")";
            default:
                throw new UnhandledConstructException(
                        "No translation for extended slices",
                        ExpressionTreeFormatter.dump(node), "slice");
        }
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node, JavaCodeBuilder b) {
        String method = BINARY_METHODS.get(node.getOperator());
        if (method == null) {
            throw new UnhandledConstructException(
                    "No ReQL method for operator '" + node.getOperator().getSymbol() + "'",
                    ExpressionTreeFormatter.dump(node), "binary operator");
        }
        return REQL_ROOT + "." + method + "(" + b.visit(node.getLeft()) + ", " + b.visit(node.getRight()) + ")";
    }

    @Override
    public String visitCompare(CompareNode node, JavaCodeBuilder b) {
        if (node.isChained()) {
            throw new UnhandledConstructException(
                    "Chained comparisons are not supported",
                    ExpressionTreeFormatter.dump(node), "comparison");
        }

        CompareOperator operator = node.getOperators().get(0);
        String method = COMPARE_METHODS.get(operator);
        if (method == null) {
            throw new UnhandledConstructException(
                    "No ReQL method for comparison '" + operator.getSymbol() + "'",
                    ExpressionTreeFormatter.dump(node), "comparison");
        }
        return REQL_ROOT + "." + method + "(" + b.visit(node.getLeft()) + ", "
                + b.visit(node.getComparators().get(0)) + ")";
    }

    @Override
    public int precedence(ExpressionNode node) {
        if (node instanceof UnaryOpNode) {
            return PRECEDENCE_UNARY;
        }
        if (node instanceof LambdaNode || node instanceof AssignNode) {
            return PRECEDENCE_LAMBDA;
        }
        return PRECEDENCE_PRIMARY;
    }

    /**
     * Slice bounds must be integer literals, optionally negated.
     */
    private static String sliceBound(ExpressionNode bound, String defaultValue) {
        if (bound == null) {
            return defaultValue;
        }
        if (isIntegerLiteral(bound)) {
            return integerLiteral(((LiteralNode) bound).getIntegerValue());
        }
        if (bound instanceof UnaryOpNode) {
            UnaryOpNode unary = (UnaryOpNode) bound;
            if (unary.getOperator() == UnaryOperator.NEGATE && isIntegerLiteral(unary.getOperand())) {
                return integerLiteral(((LiteralNode) unary.getOperand()).getIntegerValue().negate());
            }
        }
        throw new UnhandledConstructException(
                "Not handling slice bound", ExpressionTreeFormatter.dump(bound), "slice bound");
    }

    private static boolean isIntegerLiteral(ExpressionNode node) {
        return node instanceof LiteralNode && ((LiteralNode) node).isInteger();
    }
}
