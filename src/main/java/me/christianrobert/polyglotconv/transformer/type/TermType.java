package me.christianrobert.polyglotconv.transformer.type;

/**
 * What an expression evaluates to, as far as Java emission is concerned.
 */
public enum TermType {

    /**
     * A ReQL term: operators, comparisons, subscripts and attribute access become
     * method calls on the ReQL API.
     */
    REQL,

    /**
     * An ordinary host value (number, string, list, error description, ...).
     */
    PLAIN;

    public boolean isReql() {
        return this == REQL;
    }
}
