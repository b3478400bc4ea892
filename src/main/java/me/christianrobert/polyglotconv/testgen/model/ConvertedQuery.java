package me.christianrobert.polyglotconv.testgen.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converted query with its converted expected result.
 * Run options map each option name to its Java value expression.
 */
public class ConvertedQuery implements ConvertedItem {

    private final Version line;
    private final Version expectedLine;
    private final String expectedBif;
    private final ExpectedType expectedType;
    private final Map<String, String> runOptions;
    private final String testFile;
    private final int testNum;

    public ConvertedQuery(Version line, Version expectedLine, String expectedBif, ExpectedType expectedType,
                          Map<String, String> runOptions, String testFile, int testNum) {
        this.line = Objects.requireNonNull(line, "line");
        this.expectedLine = Objects.requireNonNull(expectedLine, "expectedLine");
        this.expectedBif = expectedBif;
        this.expectedType = Objects.requireNonNull(expectedType, "expectedType");
        this.runOptions = Collections.unmodifiableMap(new LinkedHashMap<>(runOptions));
        this.testFile = testFile;
        this.testNum = testNum;
    }

    public ConvertedQuery(Version line, Version expectedLine, ExpectedType expectedType,
                          Map<String, String> runOptions, String testFile, int testNum) {
        this(line, expectedLine, null, expectedType, runOptions, testFile, testNum);
    }

    public Version getLine() {
        return line;
    }

    public Version getExpectedLine() {
        return expectedLine;
    }

    public String getExpectedBif() {
        return expectedBif;
    }

    public boolean hasExpectedBif() {
        return expectedBif != null;
    }

    public ExpectedType getExpectedType() {
        return expectedType;
    }

    public Map<String, String> getRunOptions() {
        return runOptions;
    }

    public boolean hasRunOptions() {
        return !runOptions.isEmpty();
    }

    public String getTestFile() {
        return testFile;
    }

    public int getTestNum() {
        return testNum;
    }

    @Override
    public String toString() {
        return "ConvertedQuery{java='" + line.getJava() + "', expected='" + expectedLine.getJava()
                + "', expectedBif=" + expectedBif + ", expectedType=" + expectedType + ", runOptions=" + runOptions + ", testFile='" + testFile
                + "', testNum=" + testNum + "}";
    }
}
