package me.christianrobert.polyglotconv.testgen.model;

/**
 * One entry of a parsed test file: a {@link Definition}, a {@link Query}, or a
 * {@link SkippedTest} flagged by the test file parser.
 */
public interface TestItem {
}
