package org.synphot.core;

/**
 * Elementwise operators between spectra and scalars.
 */
public enum ArithmeticOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    ArithmeticOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() { return symbol; }

    /**
     * Addition and subtraction work in the units of the left operand.
     */
    public boolean isAdditive() {
        return this == ADD || this == SUBTRACT;
    }

    public double apply(double a, double b) {
        switch (this) {
            case ADD: return a + b;
            case SUBTRACT: return a - b;
            case MULTIPLY: return a * b;
            case DIVIDE: return a / b;
            default: throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    public static ArithmeticOperator fromSymbol(String symbol) {
        for (ArithmeticOperator op : values()) {
            if (op.symbol.equals(symbol) || op.name().equalsIgnoreCase(symbol)) return op;
        }
        throw new SynphotException("Operation type " + symbol + " not supported");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
