package me.christianrobert.polyglotconv.transformer.parser;

import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.ast.LiteralNode;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import me.christianrobert.polyglotconv.transformer.util.ExpressionTreeFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parse tree to expression tree construction.
 * Trees are compared through their single-line dump.
 */
class AstBuilderTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    private String dump(String source) {
        return ExpressionTreeFormatter.dump(parser.parseExpression(source));
    }

    private LiteralNode literal(String source) {
        ExpressionNode node = parser.parseExpression(source);
        assertInstanceOf(LiteralNode.class, node);
        return (LiteralNode) node;
    }

    // ========== Operators ==========

    @Test
    void multiplicationBindsTighterThanAddition() {
        assertEquals("BinaryOp(Name(a), +, BinaryOp(Name(b), *, Name(c)))", dump("a + b * c"));
    }

    @Test
    void subtractionIsLeftAssociative() {
        assertEquals("BinaryOp(BinaryOp(Name(a), -, Name(b)), -, Name(c))", dump("a - b - c"));
    }

    @Test
    void parenthesesOverridePrecedence() {
        assertEquals("BinaryOp(BinaryOp(Name(a), +, Name(b)), *, Name(c))", dump("(a + b) * c"));
    }

    @Test
    void powerIsRightAssociative() {
        assertEquals("BinaryOp(Literal(2), **, BinaryOp(Literal(3), **, Literal(2)))", dump("2 ** 3 ** 2"));
    }

    @Test
    void bitwiseAndShiftOperators() {
        assertEquals("BinaryOp(Name(a), |, BinaryOp(Name(b), &, Name(c)))", dump("a | b & c"));
        assertEquals("BinaryOp(Name(a), <<, Literal(2))", dump("a << 2"));
        assertEquals("BinaryOp(Name(a), //, Name(b))", dump("a // b"));
    }

    @Test
    void negativeNumberIsNegatedLiteral() {
        assertEquals("UnaryOp(-, Literal(1))", dump("-1"));
    }

    @Test
    void notAndInvert() {
        assertEquals("UnaryOp(not, Name(x))", dump("not x"));
        assertEquals("UnaryOp(~, Name(x))", dump("~x"));
    }

    // ========== Comparisons ==========

    @Test
    void singleComparison() {
        assertEquals("Compare(Name(a), [<], [Name(b)])", dump("a < b"));
        assertEquals("Compare(Name(a), [!=], [Name(b)])", dump("a <> b"));
    }

    @Test
    void chainedComparison() {
        assertEquals("Compare(Name(a), [<, <=], [Name(b), Name(c)])", dump("a < b <= c"));
    }

    @Test
    void twoTokenComparisonOperators() {
        assertEquals("Compare(Name(x), [not in], [Name(y)])", dump("x not in y"));
        assertEquals("Compare(Name(x), [is not], [Literal(null)])", dump("x is not None"));
    }

    // ========== Calls and attributes ==========

    @Test
    void methodChain() {
        assertEquals("Call(Attribute(Call(Attribute(Name(r), table), [Literal(\"x\")]), count), [])",
                dump("r.table('x').count()"));
    }

    @Test
    void allArgumentKinds() {
        assertEquals("Call(Name(f), [Literal(1)], x=Literal(2), *Name(a), **Name(k))",
                dump("f(1, x=2, *a, **k)"));
    }

    @Test
    void trailingCommaInArguments() {
        assertEquals("Call(Name(f), [Literal(1), Literal(2)])", dump("f(1, 2,)"));
    }

    // ========== Subscripts ==========

    @Test
    void indexSubscript() {
        assertEquals("Subscript(Name(a), Index(Literal(\"b\")))", dump("a['b']"));
    }

    @Test
    void sliceSubscripts() {
        assertEquals("Subscript(Name(a), Slice(Literal(1), None))", dump("a[1:]"));
        assertEquals("Subscript(Name(a), Slice(None, Literal(2)))", dump("a[:2]"));
        assertEquals("Subscript(Name(a), Slice(UnaryOp(-, Literal(1)), None))", dump("a[-1:]"));
        assertEquals("Subscript(Name(a), Slice(None, None, Literal(2)))", dump("a[::2]"));
    }

    @Test
    void tupleIndexAndExtendedSlice() {
        assertEquals("Subscript(Name(a), Index(Tuple([Literal(1), Literal(2)])))", dump("a[1, 2]"));
        assertEquals("Subscript(Name(a), ExtSlice(2 dims))", dump("a[1:2, 3]"));
    }

    // ========== Collections ==========

    @Test
    void listTupleAndDict() {
        assertEquals("List([Literal(1), Literal(2)])", dump("[1, 2]"));
        assertEquals("List([])", dump("[]"));
        assertEquals("Tuple([Literal(1)])", dump("(1,)"));
        assertEquals("Tuple([])", dump("()"));
        assertEquals("Literal(1)", dump("(1)"));
        assertEquals("Map([Literal(\"a\")], [Literal(1)])", dump("{'a': 1}"));
        assertEquals("Map([], [])", dump("{}"));
    }

    @Test
    void listComprehension() {
        assertEquals("ListComp(BinaryOp(Name(i), *, Literal(2)), for Name(i) in Call(Name(range), [Literal(3)]))",
                dump("[i * 2 for i in range(3)]"));
    }

    @Test
    void listComprehensionWithCondition() {
        assertEquals("ListComp(Name(i), for Name(i) in Name(xs) if Compare(Name(i), [>], [Literal(0)]))",
                dump("[i for i in xs if i > 0]"));
    }

    // ========== Lambdas and assignments ==========

    @Test
    void lambdas() {
        assertEquals("Lambda([x], Name(x))", dump("lambda x: x"));
        assertEquals("Lambda([x, y], BinaryOp(Name(x), +, Name(y)))", dump("lambda x, y: x + y"));
        assertEquals("Lambda([], Literal(1))", dump("lambda: 1"));
    }

    @Test
    void assignments() {
        assertEquals("Assign([Name(t)], Call(Attribute(Name(r), table), [Literal(\"x\")]))",
                dump("t = r.table('x')"));
        assertEquals("Assign([Name(a), Name(b)], Literal(1))", dump("a = b = 1"));
    }

    // ========== Literals ==========

    @Test
    void integerLiterals() {
        assertEquals(BigInteger.valueOf(42), literal("42").getIntegerValue());
        assertEquals(BigInteger.valueOf(31), literal("0x1F").getIntegerValue());
        assertEquals(BigInteger.valueOf(8), literal("0o10").getIntegerValue());
        assertEquals(BigInteger.valueOf(5), literal("0b101").getIntegerValue());
        assertEquals(BigInteger.valueOf(1000000), literal("1_000_000").getIntegerValue());
        assertEquals(BigInteger.valueOf(10), literal("10L").getIntegerValue());
        assertEquals(new BigInteger("123456789012345678901234567890"),
                literal("123456789012345678901234567890").getIntegerValue());
    }

    @Test
    void floatLiterals() {
        assertEquals(1.5, literal("1.5").getFloatValue());
        assertEquals(1000.0, literal("1e3").getFloatValue());
        assertEquals(0.5, literal(".5").getFloatValue());
        assertEquals(2.0, literal("2.").getFloatValue());
    }

    @Test
    void constants() {
        assertEquals(LiteralNode.Kind.NONE, literal("None").getKind());
        assertTrue(literal("True").getBooleanValue());
        assertFalse(literal("False").getBooleanValue());
    }

    @Test
    void adjacentStringsAreConcatenated() {
        LiteralNode node = literal("'ab' \"cd\"");

        assertEquals(LiteralNode.Kind.STRING, node.getKind());
        assertEquals("abcd", node.getStringValue());
    }

    @Test
    void bytesLiteral() {
        LiteralNode node = literal("b'abc'");

        assertEquals(LiteralNode.Kind.BYTES, node.getKind());
        assertEquals("abc", node.getStringValue());
    }

    @Test
    void mixingBytesAndTextFails() {
        assertThrows(UnhandledConstructException.class, () -> parser.parseExpression("'a' b'b'"));
    }
}
