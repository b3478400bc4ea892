package me.christianrobert.polyglotconv.testgen.model;

/**
 * One converted entry, ready for rendering: a {@link ConvertedDefinition}, a
 * {@link ConvertedQuery}, or a {@link SkippedTest}.
 */
public interface ConvertedItem {
}
