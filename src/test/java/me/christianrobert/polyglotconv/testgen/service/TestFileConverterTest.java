package me.christianrobert.polyglotconv.testgen.service;

import me.christianrobert.polyglotconv.config.service.ConfigService;
import me.christianrobert.polyglotconv.testgen.model.ConvertedDefinition;
import me.christianrobert.polyglotconv.testgen.model.ConvertedItem;
import me.christianrobert.polyglotconv.testgen.model.ConvertedQuery;
import me.christianrobert.polyglotconv.testgen.model.Definition;
import me.christianrobert.polyglotconv.testgen.model.ExpectedType;
import me.christianrobert.polyglotconv.testgen.model.Query;
import me.christianrobert.polyglotconv.testgen.model.SkippedTest;
import me.christianrobert.polyglotconv.testgen.model.Term;
import me.christianrobert.polyglotconv.testgen.model.TestItem;
import me.christianrobert.polyglotconv.testgen.model.Version;
import me.christianrobert.polyglotconv.transformer.context.ReqlVariables;
import me.christianrobert.polyglotconv.transformer.parser.AntlrParser;
import me.christianrobert.polyglotconv.transformer.service.ExpressionConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for converting a test file's item sequence with a real expression service.
 */
class TestFileConverterTest {

    private static final String FILE = "math_logic/add.yaml";

    private TestFileConverter converter;
    private ReqlVariables initial;

    @BeforeEach
    void setUp() throws Exception {
        ExpressionConversionService expressionService = new ExpressionConversionService();
        injectDependency(expressionService, "parser", new AntlrParser());
        injectDependency(expressionService, "configService", new ConfigService());

        converter = new TestFileConverter(expressionService, FILE);
        initial = ReqlVariables.of("r", "tbl");
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = null;
        Class<?> clazz = target.getClass();

        // Look through the class hierarchy to find the field
        while (clazz != null && field == null) {
            try {
                field = clazz.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                clazz = clazz.getSuperclass();
            }
        }

        if (field != null) {
            field.setAccessible(true);
            field.set(target, dependency);
        } else {
            throw new NoSuchFieldException("Field " + fieldName + " not found in class hierarchy");
        }
    }

    private List<ConvertedItem> convertAll(TestItem... items) {
        List<ConvertedItem> result = new ArrayList<>();
        Iterator<ConvertedItem> iterator = converter.convert(List.of(items).iterator(), initial);
        while (iterator.hasNext()) {
            result.add(iterator.next());
        }
        return result;
    }

    private static Definition definition(String varName, String line, int testNum) {
        return new Definition(varName, new Term(line), FILE, testNum);
    }

    private static Query query(String line, String expected, int testNum) {
        return new Query(new Term(line), new Term(expected), ExpectedType.OBJECT, FILE, testNum);
    }

    // ========== Definitions ==========

    @Test
    void reqlDefinitionIsDeclaredWithReqlType() {
        TestFileConverter.Step step = converter.convertItem(definition("t", "t = r.table('x')", 1), initial);

        ConvertedDefinition converted = assertInstanceOf(ConvertedDefinition.class, step.getItem());
        assertEquals(new Version("t = r.table('x')", "ReqlAst t = r.table(\"x\");"), converted.getLine());
        assertEquals(FILE, converted.getTestFile());
        assertEquals(1, converted.getTestNum());
        assertTrue(step.getReqlVariables().contains("t"));
    }

    @Test
    void plainDefinitionLeavesVariablesUnchanged() {
        TestFileConverter.Step step = converter.convertItem(definition("x", "x = [1, 2]", 1), initial);

        ConvertedDefinition converted = assertInstanceOf(ConvertedDefinition.class, step.getItem());
        assertEquals("Object x = Arrays.asList(1, 2);", converted.getLine().getJava());
        assertSame(initial, step.getReqlVariables());
    }

    @Test
    void bareExpressionDefinitionIsAssignedToItsVariable() {
        TestFileConverter.Step step = converter.convertItem(definition("y", "r.expr(1)", 1), initial);

        ConvertedDefinition converted = assertInstanceOf(ConvertedDefinition.class, step.getItem());
        assertEquals("ReqlAst y = r.expr(1);", converted.getLine().getJava());
        assertTrue(step.getReqlVariables().contains("y"));
    }

    @Test
    void definedVariableIsReqlForLaterItems() {
        List<ConvertedItem> items = convertAll(
                definition("t", "t = r.table('x')", 1),
                query("t.filter(lambda x: x['a'] > 1).count()", "2", 2),
                query("t['a'] + 1", "[2]", 3));

        assertEquals(3, items.size());
        ConvertedQuery filter = assertInstanceOf(ConvertedQuery.class, items.get(1));
        assertEquals("t.filter(x -> r.gt(x.bracket(\"a\"), 1)).count()", filter.getLine().getJava());
        assertEquals("2", filter.getExpectedLine().getJava());

        ConvertedQuery add = assertInstanceOf(ConvertedQuery.class, items.get(2));
        assertEquals("r.add(t.bracket(\"a\"), 1)", add.getLine().getJava());
        assertEquals("Arrays.asList(2)", add.getExpectedLine().getJava());
    }

    @Test
    void failedDefinitionIsSkippedAndDoesNotBindVariable() {
        List<ConvertedItem> items = convertAll(
                definition("f", "f = r.row['a']", 1),
                query("f['b']", "1", 2));

        assertEquals(new SkippedTest("f = r.row['a']", "Java driver doesn't support r.row"), items.get(0));

        // f is unknown afterwards, but queries are always emitted as ReQL terms
        ConvertedQuery converted = assertInstanceOf(ConvertedQuery.class, items.get(1));
        assertEquals("f.bracket(\"b\")", converted.getLine().getJava());
    }

    @Test
    void unparseableDefinitionIsSkipped() {
        TestFileConverter.Step step = converter.convertItem(definition("t", "t = r.table(", 1), initial);

        SkippedTest skipped = assertInstanceOf(SkippedTest.class, step.getItem());
        assertEquals("t = r.table(", skipped.getLine());
        assertTrue(skipped.getReason().startsWith("Failed to parse"), skipped.getReason());
    }

    // ========== Queries ==========

    @Test
    void queryIsAlwaysEmittedAsReql() {
        TestFileConverter.Step step = converter.convertItem(query("x + 1", "2", 1), initial);

        ConvertedQuery converted = assertInstanceOf(ConvertedQuery.class, step.getItem());
        assertEquals("r.add(x, 1)", converted.getLine().getJava());
        assertEquals("x + 1", converted.getLine().getOriginal());
    }

    @Test
    void expectedResultIsClassifiedOnItsOwn() {
        TestFileConverter.Step step = converter.convertItem(
                query("tbl.count()", "err('ReqlOpFailedError', 'Oops', [0])", 1), initial);

        ConvertedQuery converted = assertInstanceOf(ConvertedQuery.class, step.getItem());
        assertEquals("err(\"ReqlOpFailedError\", \"Oops\", Arrays.asList(0))", converted.getExpectedLine().getJava());
    }

    @Test
    void unconvertibleQueryIsSkippedWithQueryLine() {
        TestFileConverter.Step step = converter.convertItem(query("tbl[::2]", "1", 1), initial);

        assertEquals(new SkippedTest("tbl[::2]", "Slices with a step are not supported"), step.getItem());
    }

    @Test
    void unconvertibleExpectedResultSkipsTheQuery() {
        TestFileConverter.Step step = converter.convertItem(query("tbl.count()", "a // b", 1), initial);

        assertEquals(new SkippedTest("tbl.count()", "No Java operator for '//'"), step.getItem());
    }

    @Test
    void runOptionsAreConvertedAsPlainValues() {
        Map<String, Term> options = new LinkedHashMap<>();
        options.put("profile", new Term("True"));
        options.put("durability", new Term("'soft'"));
        Query query = new Query(new Term("tbl.count()"), new Term("0"), ExpectedType.INTEGER, options, FILE, 1);

        ConvertedQuery converted = assertInstanceOf(ConvertedQuery.class, converter.convertItem(query, initial).getItem());

        assertTrue(converted.hasRunOptions());
        assertEquals("true", converted.getRunOptions().get("profile"));
        assertEquals("\"soft\"", converted.getRunOptions().get("durability"));
        assertEquals(List.of("profile", "durability"), new ArrayList<>(converted.getRunOptions().keySet()));
        assertEquals(ExpectedType.INTEGER, converted.getExpectedType());
    }

    @Test
    void expectedBuiltinNameIsCarriedOver() {
        Query query = new Query(new Term("tbl.count()"), new Term("[1, 2]"), "bag", ExpectedType.OBJECT,
                null, FILE, 3);

        ConvertedQuery converted = assertInstanceOf(ConvertedQuery.class, converter.convertItem(query, initial).getItem());

        assertTrue(converted.hasExpectedBif());
        assertEquals("bag", converted.getExpectedBif());
        assertEquals(3, converted.getTestNum());
    }

    @Test
    void bareExpectedValueHasNoBuiltinName() {
        ConvertedQuery converted = assertInstanceOf(ConvertedQuery.class,
                converter.convertItem(query("tbl.count()", "0", 1), initial).getItem());

        assertFalse(converted.hasExpectedBif());
        assertNull(converted.getExpectedBif());
    }

    @Test
    void failingRunOptionSkipsTheQuery() {
        Map<String, Term> options = new LinkedHashMap<>();
        options.put("durability", new Term("a['x']"));
        Query query = new Query(new Term("tbl.count()"), new Term("0"), ExpectedType.INTEGER, options, FILE, 1);

        TestFileConverter.Step step = converter.convertItem(query, initial);

        assertEquals(new SkippedTest("tbl.count()",
                        "Run option 'durability': Only integer subscripts can be converted outside a ReQL term"),
                step.getItem());
    }

    // ========== Other items ==========

    @Test
    void skippedTestPassesThrough() {
        SkippedTest skipped = new SkippedTest("r.js('1')", "Not translatable");

        TestFileConverter.Step step = converter.convertItem(skipped, initial);

        assertSame(skipped, step.getItem());
        assertSame(initial, step.getReqlVariables());
    }

    @Test
    void unknownItemShapeFails() {
        TestItem unknown = new TestItem() {
        };

        TestItemShapeException e = assertThrows(TestItemShapeException.class,
                () -> converter.convertItem(unknown, initial));
        assertEquals(FILE, e.getTestFile());
        assertTrue(e.getMessage().contains(FILE), e.getMessage());
    }

    @Test
    void conversionIsLazy() {
        Iterator<TestItem> items = List.<TestItem>of(
                definition("t", "t = r.table('x')", 1),
                new TestItem() {
                }).iterator();

        Iterator<ConvertedItem> converted = converter.convert(items, initial);

        assertInstanceOf(ConvertedDefinition.class, converted.next());
        assertThrows(TestItemShapeException.class, converted::next);
    }
}
