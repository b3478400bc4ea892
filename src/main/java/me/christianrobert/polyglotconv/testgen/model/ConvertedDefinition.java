package me.christianrobert.polyglotconv.testgen.model;

import java.util.Objects;

public class ConvertedDefinition implements ConvertedItem {

    private final Version line;
    private final String testFile;
    private final int testNum;

    public ConvertedDefinition(Version line, String testFile, int testNum) {
        this.line = Objects.requireNonNull(line, "line");
        this.testFile = testFile;
        this.testNum = testNum;
    }

    public Version getLine() {
        return line;
    }

    public String getTestFile() {
        return testFile;
    }

    public int getTestNum() {
        return testNum;
    }

    @Override
    public String toString() {
        return "ConvertedDefinition{java='" + line.getJava() + "', testFile='" + testFile + "', testNum=" + testNum + "}";
    }
}
