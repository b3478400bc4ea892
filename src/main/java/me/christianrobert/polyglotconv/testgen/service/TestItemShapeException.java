package me.christianrobert.polyglotconv.testgen.service;

/**
 * A test file yielded an item that is neither a definition, a query nor a skipped test.
 * Aborts the conversion of the whole file.
 */
public class TestItemShapeException extends RuntimeException {

    private final String testFile;

    public TestItemShapeException(String message, String testFile) {
        super(message);
        this.testFile = testFile;
    }

    public String getTestFile() {
        return testFile;
    }
}
