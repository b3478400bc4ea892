package me.christianrobert.polyglotconv.testgen.model;

import java.util.Objects;

/**
 * Variable definition ({@code tbl = r.table('test')}) made available to later items of the
 * same test file.
 */
public class Definition implements TestItem {

    private final String varName;
    private final Term term;
    private final String testFile;
    private final int testNum;

    public Definition(String varName, Term term, String testFile, int testNum) {
        this.varName = Objects.requireNonNull(varName, "varName");
        this.term = Objects.requireNonNull(term, "term");
        this.testFile = testFile;
        this.testNum = testNum;
    }

    public String getVarName() {
        return varName;
    }

    public Term getTerm() {
        return term;
    }

    public String getTestFile() {
        return testFile;
    }

    public int getTestNum() {
        return testNum;
    }

    @Override
    public String toString() {
        return "Definition{varName='" + varName + "', line='" + term.getLine() + "', testFile='" + testFile
                + "', testNum=" + testNum + "}";
    }
}
