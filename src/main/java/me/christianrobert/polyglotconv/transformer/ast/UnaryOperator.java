package me.christianrobert.polyglotconv.transformer.ast;

public enum UnaryOperator {
    NEGATE("-"),
    NOT("not"),
    PLUS("+"),
    INVERT("~");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Host-language spelling of the operator.
     */
    public String getSymbol() {
        return symbol;
    }
}
