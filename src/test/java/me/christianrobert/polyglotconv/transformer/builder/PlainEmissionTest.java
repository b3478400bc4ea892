package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.context.ConversionContext;
import me.christianrobert.polyglotconv.transformer.context.ConversionResult;
import me.christianrobert.polyglotconv.transformer.context.ReqlVariables;
import me.christianrobert.polyglotconv.transformer.parser.AntlrParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for plain (non-ReQL) emission: Java operators, literals and collections.
 */
class PlainEmissionTest {

    private AntlrParser parser;
    private JavaCodeBuilder builder;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
        builder = new JavaCodeBuilder(new ConversionContext(ReqlVariables.of("r")), EmissionMode.PLAIN);
    }

    private String convert(String source) {
        ConversionResult result = builder.convert(parser.parseExpression(source));
        assertTrue(result.isSuccess(), "Expected success for " + source + " but got " + result);
        return result.getJavaCode();
    }

    private ConversionResult fail(String source) {
        ConversionResult result = builder.convert(parser.parseExpression(source));
        assertTrue(result.isUnhandled(), "Expected unhandled for " + source + " but got " + result);
        return result;
    }

    // ========== Arithmetic ==========

    @Test
    void precedenceNeedsNoParentheses() {
        assertEquals("1 + 2 * 3", convert("1 + 2 * 3"));
    }

    @Test
    void parenthesesAreKeptWhereJavaNeedsThem() {
        assertEquals("(1 + 2) * 3", convert("(1 + 2) * 3"));
        assertEquals("1 - (2 - 3)", convert("1 - (2 - 3)"));
        assertEquals("1 - 2 - 3", convert("(1 - 2) - 3"));
        assertEquals("8 / (2 * 2)", convert("8 / (2 * 2)"));
    }

    @Test
    void powerBecomesMathPow() {
        assertEquals("Math.pow(2, 8)", convert("2 ** 8"));
        assertEquals("Math.pow(2, 8) + 1", convert("2 ** 8 + 1"));
    }

    @Test
    void operatorsWithoutJavaFormAreUnhandled() {
        assertEquals("No Java operator for '//'", fail("7 // 2").getReason());
        fail("1 << 2");
        fail("1 ^ 2");
    }

    // ========== Unary ==========

    @Test
    void unaryOperators() {
        assertEquals("-1", convert("-1"));
        assertEquals("-(-1)", convert("-(-1)"));
        assertEquals("!x", convert("not x"));
        assertEquals("~x", convert("~x"));
        assertEquals("-(1 + 2)", convert("-(1 + 2)"));
    }

    // ========== Comparisons ==========

    @Test
    void comparisons() {
        assertEquals("a < b", convert("a < b"));
        assertEquals("a != b", convert("a != b"));
        assertEquals("a + 1 == b", convert("a + 1 == b"));
    }

    @Test
    void chainedAndMembershipComparisonsAreUnhandled() {
        assertEquals("Chained comparisons have no Java form", fail("a < b < c").getReason());
        fail("a in b");
        fail("a is None");
    }

    // ========== Attributes and subscripts ==========

    @Test
    void attributeAccess() {
        assertEquals("a.b", convert("a.b"));
    }

    @Test
    void integerSubscript() {
        assertEquals("a[0]", convert("a[0]"));
    }

    @Test
    void otherSubscriptsAreUnhandled() {
        assertEquals("Only integer subscripts can be converted outside a ReQL term", fail("a['x']").getReason());
        fail("a[1:2]");
    }

    // ========== Literals ==========

    @Test
    void literals() {
        assertEquals("\"abc\"", convert("'abc'"));
        assertEquals("\"it's\"", convert("\"it's\""));
        assertEquals("1.5", convert("1.5"));
        assertEquals("true", convert("True"));
        assertEquals("null", convert("None"));
    }

    @Test
    void largeIntegersBecomeDoubles() {
        assertEquals("2147483647", convert("2147483647"));
        assertEquals("2147483648.0", convert("2147483648"));
    }

    @Test
    void bytesLiteral() {
        assertEquals("\"abc\".getBytes(StandardCharsets.UTF_8)", convert("b'abc'"));
    }

    @Test
    void nonAsciiBytesKeepTheirByteValues() {
        assertEquals("\"\\u00ff\".getBytes(StandardCharsets.ISO_8859_1)", convert("b'\\xff'"));
        assertEquals("\"a\\u0080\".getBytes(StandardCharsets.ISO_8859_1)", convert("b'a\\x80'"));
    }

    // ========== Collections ==========

    @Test
    void listsAndTuples() {
        assertEquals("Arrays.asList(1, 2)", convert("[1, 2]"));
        assertEquals("Arrays.asList(1, 2)", convert("(1, 2)"));
        assertEquals("Arrays.asList()", convert("[]"));
    }

    @Test
    void dictionaries() {
        assertEquals("new MapObject().with(\"a\", 1).with(\"b\", Arrays.asList(2))", convert("{'a': 1, 'b': [2]}"));
        assertEquals("new MapObject()", convert("{}"));
    }

    // ========== Calls and lambdas ==========

    @Test
    void callWithKeywordArguments() {
        assertEquals("f(1).optArg(\"left_bound\", \"open\")", convert("f(1, left_bound='open')"));
    }

    @Test
    void splatArgumentsAreUnhandled() {
        assertEquals("Variadic (*args) and keyword splat (**kwargs) arguments are not supported",
                fail("f(*args)").getReason());
        fail("f(**kwargs)");
    }

    @Test
    void lambdas() {
        assertEquals("x -> x", convert("lambda x: x"));
        assertEquals("(x, y) -> x", convert("lambda x, y: x"));
        assertEquals("() -> 1", convert("lambda: 1"));
    }

    @Test
    void lambdaAsCallArgumentNeedsNoParentheses() {
        assertEquals("f(x -> x + 1)", convert("f(lambda x: x + 1)"));
    }

    // ========== List comprehensions ==========

    @Test
    void rangeComprehension() {
        assertEquals("IntStream.range(0, 3).boxed().map(i -> i).collect(Collectors.toList())",
                convert("[i for i in range(3)]"));
        assertEquals("IntStream.range(1, 4).boxed().map(i -> i * 2).collect(Collectors.toList())",
                convert("[i * 2 for i in xrange(1, 4)]"));
    }

    @Test
    void otherComprehensionsAreUnhandled() {
        assertEquals("List comprehensions can only iterate over range()", fail("[i for i in xs]").getReason());
        fail("[i for i in range(3) if i > 1]");
        fail("[i for i in range(3) for j in range(2)]");
        fail("[i for i, j in range(3)]");
    }

    // ========== Assignments ==========

    @Test
    void plainAssignment() {
        assertEquals("Object x = 1;", convert("x = 1"));
    }

    @Test
    void reqlAssignmentSwitchesMode() {
        assertEquals("ReqlAst t = r.table(\"x\");", convert("t = r.table('x')"));
        assertEquals("ReqlAst t = r.add(r.expr(1), 2);", convert("t = r.expr(1) + 2"));
    }

    @Test
    void multipleTargetsAreUnhandled() {
        assertEquals("We only support assigning to one variable at a time, got 2 targets",
                fail("a = b = 1").getReason());
    }

    @Test
    void nonNameTargetIsUnhandled() {
        assertEquals("Only simple names can be assigned to", fail("a.b = 1").getReason());
    }

    @Test
    void customDeclarationTypes() {
        JavaCodeBuilder custom = new JavaCodeBuilder(
                new ConversionContext(ReqlVariables.of("r"), "ReqlExpr", "var"));

        assertEquals("var x = 1;", custom.convert(parser.parseExpression("x = 1")).getJavaCode());
        assertEquals("ReqlExpr t = r.db(\"d\");", custom.convert(parser.parseExpression("t = r.db('d')")).getJavaCode());
    }
}
