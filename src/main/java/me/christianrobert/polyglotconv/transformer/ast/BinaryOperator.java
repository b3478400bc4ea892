package me.christianrobert.polyglotconv.transformer.ast;

public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    FLOOR_DIVIDE("//"),
    MODULO("%"),
    POWER("**"),
    BIT_AND("&"),
    BIT_OR("|"),
    BIT_XOR("^"),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Host-language spelling of the operator.
     */
    public String getSymbol() {
        return symbol;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}
