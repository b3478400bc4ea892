package me.christianrobert.polyglotconv.testgen.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A query with its expected result and optional run options ({@code {"time_format": "raw"}}).
 * The expected result may name the builtin that wraps it in the test file ({@code bag}, {@code err}).
 */
public class Query implements TestItem {

    private final Term query;
    private final Term expected;
    private final String expectedBif;
    private final ExpectedType expectedType;
    private final Map<String, Term> runOptions;
    private final String testFile;
    private final int testNum;

    public Query(Term query, Term expected, String expectedBif, ExpectedType expectedType,
                 Map<String, Term> runOptions, String testFile, int testNum) {
        this.query = Objects.requireNonNull(query, "query");
        this.expected = Objects.requireNonNull(expected, "expected");
        this.expectedBif = expectedBif;
        this.expectedType = expectedType != null ? expectedType : ExpectedType.OBJECT;
        this.runOptions = runOptions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(runOptions))
                : Collections.emptyMap();
        this.testFile = testFile;
        this.testNum = testNum;
    }

    public Query(Term query, Term expected, ExpectedType expectedType, Map<String, Term> runOptions,
                 String testFile, int testNum) {
        this(query, expected, null, expectedType, runOptions, testFile, testNum);
    }

    public Query(Term query, Term expected, ExpectedType expectedType, String testFile, int testNum) {
        this(query, expected, expectedType, null, testFile, testNum);
    }

    public Term getQuery() {
        return query;
    }

    public Term getExpected() {
        return expected;
    }

    /**
     * Name of the builtin wrapping the expected value, or null when it is a bare value.
     */
    public String getExpectedBif() {
        return expectedBif;
    }

    public ExpectedType getExpectedType() {
        return expectedType;
    }

    /**
     * Run options in source order; empty when the query has none.
     */
    public Map<String, Term> getRunOptions() {
        return runOptions;
    }

    public String getTestFile() {
        return testFile;
    }

    public int getTestNum() {
        return testNum;
    }

    @Override
    public String toString() {
        return "Query{query='" + query.getLine() + "', expected='" + expected.getLine() + "', testFile='"
                + testFile + "', testNum=" + testNum + "}";
    }
}
