package me.christianrobert.polyglotconv.transformer.ast;

public enum CompareOperator {
    LESS_THAN("<"),
    GREATER_THAN(">"),
    GREATER_EQUAL(">="),
    LESS_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    IN("in"),
    NOT_IN("not in"),
    IS("is"),
    IS_NOT("is not");

    private final String symbol;

    CompareOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Host-language spelling of the operator.
     */
    public String getSymbol() {
        return symbol;
    }
}
