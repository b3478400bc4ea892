package me.christianrobert.polyglotconv.testgen.service;

import me.christianrobert.polyglotconv.testgen.model.ConvertedDefinition;
import me.christianrobert.polyglotconv.testgen.model.ConvertedItem;
import me.christianrobert.polyglotconv.testgen.model.ConvertedQuery;
import me.christianrobert.polyglotconv.testgen.model.Definition;
import me.christianrobert.polyglotconv.testgen.model.Query;
import me.christianrobert.polyglotconv.testgen.model.SkippedTest;
import me.christianrobert.polyglotconv.testgen.model.Term;
import me.christianrobert.polyglotconv.testgen.model.TestItem;
import me.christianrobert.polyglotconv.testgen.model.Version;
import me.christianrobert.polyglotconv.transformer.ast.AssignNode;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.builder.EmissionMode;
import me.christianrobert.polyglotconv.transformer.context.ConversionResult;
import me.christianrobert.polyglotconv.transformer.context.ReqlVariables;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import me.christianrobert.polyglotconv.transformer.service.ExpressionConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Converts the item sequence of one test file, one item at a time.
 *
 * <p>Definitions whose value is a ReQL term add their variable to the set of ReQL variables
 * seen by every later item. Queries are always converted as ReQL terms; their expected
 * result is classified on its own and run options are converted as plain values.</p>
 *
 * <p>Any item that cannot be converted becomes a {@link SkippedTest}; only an item of
 * unknown shape ends the file with a {@link TestItemShapeException}.</p>
 */
public class TestFileConverter {

    private static final Logger log = LoggerFactory.getLogger(TestFileConverter.class);

    private final ExpressionConversionService expressionService;
    private final String testFile;

    public TestFileConverter(ExpressionConversionService expressionService, String testFile) {
        this.expressionService = Objects.requireNonNull(expressionService, "expressionService");
        this.testFile = testFile;
    }

    /**
     * Result of converting one item: the record to emit and the ReQL variables for the next item.
     */
    public static class Step {
        private final ConvertedItem item;
        private final ReqlVariables reqlVariables;

        Step(ConvertedItem item, ReqlVariables reqlVariables) {
            this.item = item;
            this.reqlVariables = reqlVariables;
        }

        public ConvertedItem getItem() {
            return item;
        }

        public ReqlVariables getReqlVariables() {
            return reqlVariables;
        }
    }

    /**
     * Lazily converts {@code items}, threading the ReQL variables from item to item.
     * Each call to {@code next()} converts exactly one input item.
     */
    public Iterator<ConvertedItem> convert(Iterator<? extends TestItem> items, ReqlVariables initialVariables) {
        return new Iterator<ConvertedItem>() {
            private ReqlVariables reqlVariables = initialVariables;

            @Override
            public boolean hasNext() {
                return items.hasNext();
            }

            @Override
            public ConvertedItem next() {
                if (!items.hasNext()) {
                    throw new NoSuchElementException();
                }
                Step step = convertItem(items.next(), reqlVariables);
                reqlVariables = step.getReqlVariables();
                return step.getItem();
            }
        };
    }

    /**
     * Converts one item.
     *
     * @throws TestItemShapeException if the item is not a definition, query or skipped test
     */
    public Step convertItem(TestItem item, ReqlVariables reqlVariables) {
        if (item instanceof Definition) {
            return convertDefinition((Definition) item, reqlVariables);
        }
        if (item instanceof Query) {
            return new Step(convertQuery((Query) item, reqlVariables), reqlVariables);
        }
        if (item instanceof SkippedTest) {
            return new Step((SkippedTest) item, reqlVariables);
        }
        String shape = item == null ? "null" : item.getClass().getName();
        throw new TestItemShapeException("Unexpected test item " + shape + " in " + testFile, testFile);
    }

    // ========== Definitions ==========

    private Step convertDefinition(Definition definition, ReqlVariables reqlVariables) {
        Term term = definition.getTerm();

        ExpressionNode node;
        try {
            node = asAssignment(definition.getVarName(), parse(term));
        } catch (UnhandledConstructException e) {
            log.warn("Parse failed in {}: {}", testFile, e.getDetailedMessage());
            return new Step(new SkippedTest(term.getLine(), e.getMessage()), reqlVariables);
        }

        boolean reql = expressionService.isReql(((AssignNode) node).getValue(), reqlVariables);
        EmissionMode mode = reql ? EmissionMode.REQL : EmissionMode.PLAIN;

        ConversionResult result = expressionService.convert(node, term.getLine(), reqlVariables, mode);
        if (result.isFailure()) {
            return new Step(new SkippedTest(term.getLine(), result.getReason()), reqlVariables);
        }

        ReqlVariables next = reql ? reqlVariables.with(definition.getVarName()) : reqlVariables;
        ConvertedDefinition converted = new ConvertedDefinition(
                new Version(term.getLine(), result.getJavaCode()),
                definition.getTestFile(),
                definition.getTestNum());
        return new Step(converted, next);
    }

    /**
     * Definitions written as a bare expression are treated as {@code varName = expression}.
     */
    private static ExpressionNode asAssignment(String varName, ExpressionNode node) {
        if (node instanceof AssignNode) {
            return node;
        }
        return new AssignNode(varName, node);
    }

    // ========== Queries ==========

    private ConvertedItem convertQuery(Query query, ReqlVariables reqlVariables) {
        String line = query.getQuery().getLine();

        ConversionResult converted = convertTerm(query.getQuery(), reqlVariables, EmissionMode.REQL);
        if (converted.isFailure()) {
            return new SkippedTest(line, converted.getReason());
        }

        // Expected results can be plain values (errors, literals) or ReQL terms
        ConversionResult expected = convertTerm(query.getExpected(), reqlVariables, null);
        if (expected.isFailure()) {
            return new SkippedTest(line, expected.getReason());
        }

        Map<String, String> runOptions = new LinkedHashMap<>();
        for (Map.Entry<String, Term> option : query.getRunOptions().entrySet()) {
            ConversionResult value = convertTerm(option.getValue(), reqlVariables, EmissionMode.PLAIN);
            if (value.isFailure()) {
                ConversionResult failed = value.withReasonPrefix("Run option '" + option.getKey() + "': ");
                return new SkippedTest(line, failed.getReason());
            }
            runOptions.put(option.getKey(), value.getJavaCode());
        }

        return new ConvertedQuery(
                new Version(line, converted.getJavaCode()),
                new Version(query.getExpected().getLine(), expected.getJavaCode()),
                query.getExpectedBif(),
                query.getExpectedType(),
                runOptions,
                query.getTestFile(),
                query.getTestNum());
    }

    private ConversionResult convertTerm(Term term, ReqlVariables reqlVariables, EmissionMode mode) {
        ExpressionNode node;
        try {
            node = parse(term);
        } catch (UnhandledConstructException e) {
            log.warn("Parse failed in {}: {}", testFile, e.getDetailedMessage());
            return ConversionResult.unhandled(e.getMessage());
        }
        return expressionService.convert(node, term.getLine(), reqlVariables, mode);
    }

    private ExpressionNode parse(Term term) {
        if (term.isParsed()) {
            return term.getAst();
        }
        return expressionService.parseTerm(term.getLine());
    }
}
