package me.christianrobert.polyglotconv.transformer.parser;

import me.christianrobert.polyglotconv.antlr.PyExpressionBaseVisitor;
import me.christianrobert.polyglotconv.antlr.PyExpressionParser;
import me.christianrobert.polyglotconv.transformer.ast.AssignNode;
import me.christianrobert.polyglotconv.transformer.ast.AttributeNode;
import me.christianrobert.polyglotconv.transformer.ast.BinaryOpNode;
import me.christianrobert.polyglotconv.transformer.ast.BinaryOperator;
import me.christianrobert.polyglotconv.transformer.ast.CallNode;
import me.christianrobert.polyglotconv.transformer.ast.CollectionNode;
import me.christianrobert.polyglotconv.transformer.ast.CompareNode;
import me.christianrobert.polyglotconv.transformer.ast.CompareOperator;
import me.christianrobert.polyglotconv.transformer.ast.ComprehensionGenerator;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.ast.KeywordArgument;
import me.christianrobert.polyglotconv.transformer.ast.LambdaNode;
import me.christianrobert.polyglotconv.transformer.ast.ListComprehensionNode;
import me.christianrobert.polyglotconv.transformer.ast.LiteralNode;
import me.christianrobert.polyglotconv.transformer.ast.NameNode;
import me.christianrobert.polyglotconv.transformer.ast.SubscriptNode;
import me.christianrobert.polyglotconv.transformer.ast.UnaryOpNode;
import me.christianrobert.polyglotconv.transformer.ast.UnaryOperator;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the expression tree from a PyExpression parse tree.
 *
 * <p>Mirrors the host language's own tree: operator chains are left associative,
 * {@code -1} stays a negation of the literal {@code 1}, adjacent string literals are
 * concatenated, and {@code a = b = v} becomes one assignment with two targets.</p>
 */
public class AstBuilder extends PyExpressionBaseVisitor<ExpressionNode> {

    // ========== Statements and expressions ==========

    @Override
    public ExpressionNode visitStatement(PyExpressionParser.StatementContext ctx) {
        List<PyExpressionParser.ExpressionContext> expressions = ctx.expression();
        if (expressions.size() == 1) {
            return visit(expressions.get(0));
        }

        List<ExpressionNode> targets = new ArrayList<>();
        for (int i = 0; i < expressions.size() - 1; i++) {
            targets.add(visit(expressions.get(i)));
        }
        return new AssignNode(targets, visit(expressions.get(expressions.size() - 1)));
    }

    @Override
    public ExpressionNode visitLambdaExpression(PyExpressionParser.LambdaExpressionContext ctx) {
        List<String> parameters = new ArrayList<>();
        if (ctx.parameterList() != null) {
            for (TerminalNode name : ctx.parameterList().NAME()) {
                parameters.add(name.getText());
            }
        }
        return new LambdaNode(parameters, visit(ctx.expression()));
    }

    @Override
    public ExpressionNode visitTestExpression(PyExpressionParser.TestExpressionContext ctx) {
        return visit(ctx.notTest());
    }

    @Override
    public ExpressionNode visitNotExpression(PyExpressionParser.NotExpressionContext ctx) {
        return new UnaryOpNode(UnaryOperator.NOT, visit(ctx.notTest()));
    }

    @Override
    public ExpressionNode visitComparisonExpression(PyExpressionParser.ComparisonExpressionContext ctx) {
        return visit(ctx.comparison());
    }

    @Override
    public ExpressionNode visitComparison(PyExpressionParser.ComparisonContext ctx) {
        ExpressionNode left = visit(ctx.bitOr(0));
        if (ctx.compOp().isEmpty()) {
            return left;
        }

        List<CompareOperator> operators = new ArrayList<>();
        List<ExpressionNode> comparators = new ArrayList<>();
        for (int i = 0; i < ctx.compOp().size(); i++) {
            operators.add(compareOperator(ctx.compOp(i)));
            comparators.add(visit(ctx.bitOr(i + 1)));
        }
        return new CompareNode(left, operators, comparators);
    }

    // ========== Operator chains ==========

    @Override
    public ExpressionNode visitBitOr(PyExpressionParser.BitOrContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public ExpressionNode visitBitXor(PyExpressionParser.BitXorContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public ExpressionNode visitBitAnd(PyExpressionParser.BitAndContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public ExpressionNode visitShift(PyExpressionParser.ShiftContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public ExpressionNode visitArith(PyExpressionParser.ArithContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public ExpressionNode visitTerm(PyExpressionParser.TermContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public ExpressionNode visitUnaryFactor(PyExpressionParser.UnaryFactorContext ctx) {
        UnaryOperator operator;
        if (ctx.MINUS() != null) {
            operator = UnaryOperator.NEGATE;
        } else if (ctx.PLUS() != null) {
            operator = UnaryOperator.PLUS;
        } else {
            operator = UnaryOperator.INVERT;
        }
        return new UnaryOpNode(operator, visit(ctx.factor()));
    }

    @Override
    public ExpressionNode visitPowerFactor(PyExpressionParser.PowerFactorContext ctx) {
        return visit(ctx.power());
    }

    @Override
    public ExpressionNode visitPower(PyExpressionParser.PowerContext ctx) {
        ExpressionNode base = visit(ctx.atomExpr());
        if (ctx.factor() == null) {
            return base;
        }
        // right associative: 2 ** -1 ** 2 nests through factor
        return new BinaryOpNode(base, BinaryOperator.POWER, visit(ctx.factor()));
    }

    // ========== Trailers ==========

    @Override
    public ExpressionNode visitAtomExpr(PyExpressionParser.AtomExprContext ctx) {
        ExpressionNode result = visit(ctx.atom());
        for (PyExpressionParser.TrailerContext trailer : ctx.trailer()) {
            if (trailer instanceof PyExpressionParser.CallTrailerContext) {
                result = buildCall(result, ((PyExpressionParser.CallTrailerContext) trailer).argumentList());
            } else if (trailer instanceof PyExpressionParser.SubscriptTrailerContext) {
                result = buildSubscript(result, ((PyExpressionParser.SubscriptTrailerContext) trailer).subscriptList());
            } else {
                String member = ((PyExpressionParser.AttributeTrailerContext) trailer).NAME().getText();
                result = new AttributeNode(result, member);
            }
        }
        return result;
    }

    private CallNode buildCall(ExpressionNode function, PyExpressionParser.ArgumentListContext argumentList) {
        List<ExpressionNode> arguments = new ArrayList<>();
        List<KeywordArgument> keywords = new ArrayList<>();
        List<ExpressionNode> starArguments = new ArrayList<>();
        List<ExpressionNode> doubleStarArguments = new ArrayList<>();

        if (argumentList != null) {
            for (PyExpressionParser.ArgumentContext argument : argumentList.argument()) {
                if (argument instanceof PyExpressionParser.KeywordArgumentContext) {
                    PyExpressionParser.KeywordArgumentContext keyword = (PyExpressionParser.KeywordArgumentContext) argument;
                    keywords.add(new KeywordArgument(keyword.NAME().getText(), visit(keyword.expression())));
                } else if (argument instanceof PyExpressionParser.StarArgumentContext) {
                    starArguments.add(visit(((PyExpressionParser.StarArgumentContext) argument).expression()));
                } else if (argument instanceof PyExpressionParser.DoubleStarArgumentContext) {
                    doubleStarArguments.add(visit(((PyExpressionParser.DoubleStarArgumentContext) argument).expression()));
                } else {
                    arguments.add(visit(((PyExpressionParser.PositionalArgumentContext) argument).expression()));
                }
            }
        }
        return new CallNode(function, arguments, keywords, starArguments, doubleStarArguments);
    }

    private SubscriptNode buildSubscript(ExpressionNode value, PyExpressionParser.SubscriptListContext list) {
        List<PyExpressionParser.SubscriptContext> subscripts = list.subscript();
        if (subscripts.size() == 1 && list.trailingComma == null) {
            return buildDimension(value, subscripts.get(0));
        }

        // a[1, 2] indexes with a tuple, a[1:2, 3] is an extended slice
        boolean allIndexes = subscripts.stream().allMatch(s -> s instanceof PyExpressionParser.IndexSubscriptContext);
        if (allIndexes) {
            List<ExpressionNode> elements = new ArrayList<>();
            for (PyExpressionParser.SubscriptContext subscript : subscripts) {
                elements.add(visit(((PyExpressionParser.IndexSubscriptContext) subscript).expression()));
            }
            return SubscriptNode.index(value, CollectionNode.tuple(elements));
        }

        List<SubscriptNode> dimensions = new ArrayList<>();
        for (PyExpressionParser.SubscriptContext subscript : subscripts) {
            dimensions.add(buildDimension(value, subscript));
        }
        return SubscriptNode.extended(value, dimensions);
    }

    private SubscriptNode buildDimension(ExpressionNode value, PyExpressionParser.SubscriptContext subscript) {
        if (subscript instanceof PyExpressionParser.IndexSubscriptContext) {
            return SubscriptNode.index(value, visit(((PyExpressionParser.IndexSubscriptContext) subscript).expression()));
        }
        PyExpressionParser.SliceSubscriptContext slice = (PyExpressionParser.SliceSubscriptContext) subscript;
        return SubscriptNode.slice(value,
                visitOptional(slice.lower),
                visitOptional(slice.upper),
                visitOptional(slice.step),
                slice.stepColon != null);
    }

    // ========== Atoms ==========

    @Override
    public ExpressionNode visitEmptyTupleAtom(PyExpressionParser.EmptyTupleAtomContext ctx) {
        return CollectionNode.tuple(List.of());
    }

    @Override
    public ExpressionNode visitParenAtom(PyExpressionParser.ParenAtomContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public ExpressionNode visitTupleAtom(PyExpressionParser.TupleAtomContext ctx) {
        return CollectionNode.tuple(visitAll(ctx.expression()));
    }

    @Override
    public ExpressionNode visitListAtom(PyExpressionParser.ListAtomContext ctx) {
        return CollectionNode.list(visitAll(ctx.expression()));
    }

    @Override
    public ExpressionNode visitDictAtom(PyExpressionParser.DictAtomContext ctx) {
        List<ExpressionNode> keys = new ArrayList<>();
        List<ExpressionNode> values = new ArrayList<>();
        for (PyExpressionParser.DictEntryContext entry : ctx.dictEntry()) {
            keys.add(visit(entry.key));
            values.add(visit(entry.value));
        }
        return CollectionNode.map(keys, values);
    }

    @Override
    public ExpressionNode visitListCompAtom(PyExpressionParser.ListCompAtomContext ctx) {
        List<ComprehensionGenerator> generators = new ArrayList<>();
        for (PyExpressionParser.CompForContext compFor : ctx.compFor()) {
            List<ExpressionNode> conditions = new ArrayList<>();
            for (PyExpressionParser.CompIfContext compIf : compFor.compIf()) {
                conditions.add(visit(compIf.notTest()));
            }
            generators.add(new ComprehensionGenerator(
                    comprehensionTarget(compFor.compTarget()), visit(compFor.notTest()), conditions));
        }
        return new ListComprehensionNode(visit(ctx.expression()), generators);
    }

    private ExpressionNode comprehensionTarget(PyExpressionParser.CompTargetContext ctx) {
        List<ExpressionNode> names = new ArrayList<>();
        for (TerminalNode name : ctx.NAME()) {
            names.add(new NameNode(name.getText()));
        }
        if (names.size() == 1 && ctx.OPEN_PAREN() == null) {
            return names.get(0);
        }
        return CollectionNode.tuple(names);
    }

    @Override
    public ExpressionNode visitNameAtom(PyExpressionParser.NameAtomContext ctx) {
        return new NameNode(ctx.NAME().getText());
    }

    @Override
    public ExpressionNode visitIntegerAtom(PyExpressionParser.IntegerAtomContext ctx) {
        return LiteralNode.ofInteger(parseInteger(ctx.INTEGER().getText()));
    }

    @Override
    public ExpressionNode visitFloatAtom(PyExpressionParser.FloatAtomContext ctx) {
        return LiteralNode.ofFloat(Double.parseDouble(ctx.FLOAT().getText().replace("_", "")));
    }

    @Override
    public ExpressionNode visitStringAtom(PyExpressionParser.StringAtomContext ctx) {
        StringBuilder value = new StringBuilder();
        Boolean bytes = null;
        for (TerminalNode token : ctx.STRING()) {
            PythonStringDecoder.DecodedString decoded = PythonStringDecoder.decode(token.getText());
            if (bytes != null && bytes != decoded.isBytes()) {
                throw new UnhandledConstructException(
                        "Cannot mix bytes and nonbytes literals", ctx.getText(), "string literal");
            }
            bytes = decoded.isBytes();
            value.append(decoded.getValue());
        }
        return Boolean.TRUE.equals(bytes)
                ? LiteralNode.ofBytes(value.toString())
                : LiteralNode.ofString(value.toString());
    }

    @Override
    public ExpressionNode visitNoneAtom(PyExpressionParser.NoneAtomContext ctx) {
        return LiteralNode.none();
    }

    @Override
    public ExpressionNode visitTrueAtom(PyExpressionParser.TrueAtomContext ctx) {
        return LiteralNode.ofBoolean(true);
    }

    @Override
    public ExpressionNode visitFalseAtom(PyExpressionParser.FalseAtomContext ctx) {
        return LiteralNode.ofBoolean(false);
    }

    // ========== Helpers ==========

    /**
     * Folds {@code operand (op operand)*} children into a left associative chain.
     */
    private ExpressionNode binaryChain(ParserRuleContext ctx) {
        ExpressionNode result = visit(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            BinaryOperator operator = BinaryOperator.fromSymbol(ctx.getChild(i).getText());
            result = new BinaryOpNode(result, operator, visit(ctx.getChild(i + 1)));
        }
        return result;
    }

    private static CompareOperator compareOperator(PyExpressionParser.CompOpContext ctx) {
        // getText() drops the whitespace of two-token operators
        switch (ctx.getText()) {
            case "<":
                return CompareOperator.LESS_THAN;
            case ">":
                return CompareOperator.GREATER_THAN;
            case ">=":
                return CompareOperator.GREATER_EQUAL;
            case "<=":
                return CompareOperator.LESS_EQUAL;
            case "==":
                return CompareOperator.EQUAL;
            case "!=":
            case "<>":
                return CompareOperator.NOT_EQUAL;
            case "in":
                return CompareOperator.IN;
            case "notin":
                return CompareOperator.NOT_IN;
            case "is":
                return CompareOperator.IS;
            case "isnot":
                return CompareOperator.IS_NOT;
            default:
                throw new UnhandledConstructException("Unknown comparison operator: " + ctx.getText());
        }
    }

    static BigInteger parseInteger(String text) {
        String digits = text.replace("_", "");
        if (digits.endsWith("l") || digits.endsWith("L")) {
            digits = digits.substring(0, digits.length() - 1);
        }

        String lower = digits.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) {
            return new BigInteger(digits.substring(2), 16);
        }
        if (lower.startsWith("0o")) {
            return new BigInteger(digits.substring(2), 8);
        }
        if (lower.startsWith("0b")) {
            return new BigInteger(digits.substring(2), 2);
        }
        return new BigInteger(digits);
    }

    private ExpressionNode visitOptional(ParserRuleContext ctx) {
        return ctx == null ? null : visit(ctx);
    }

    private List<ExpressionNode> visitAll(List<? extends ParserRuleContext> contexts) {
        List<ExpressionNode> nodes = new ArrayList<>(contexts.size());
        for (ParserRuleContext ctx : contexts) {
            nodes.add(visit(ctx));
        }
        return nodes;
    }
}
