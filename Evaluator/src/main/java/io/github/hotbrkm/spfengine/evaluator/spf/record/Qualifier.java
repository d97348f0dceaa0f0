package io.github.hotbrkm.spfengine.evaluator.spf.record;

import io.github.hotbrkm.spfengine.evaluator.spf.result.SpfResult;

/**
 * Directive prefix deciding the verdict of a matching mechanism.
 */
public enum Qualifier {

    PASS('+', SpfResult.Code.PASS),
    FAIL('-', SpfResult.Code.FAIL),
    SOFTFAIL('~', SpfResult.Code.SOFTFAIL),
    NEUTRAL('?', SpfResult.Code.NEUTRAL);

    private final char symbol;
    private final SpfResult.Code resultCode;

    Qualifier(char symbol, SpfResult.Code resultCode) {
        this.symbol = symbol;
        this.resultCode = resultCode;
    }

    public char getSymbol() {
        return symbol;
    }

    public SpfResult.Code getResultCode() {
        return resultCode;
    }

    /**
     * Resolves a qualifier symbol; an empty string means {@link #PASS}.
     */
    public static Qualifier of(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return PASS;
        }
        for (Qualifier qualifier : values()) {
            if (qualifier.symbol == symbol.charAt(0) && symbol.length() == 1) {
                return qualifier;
            }
        }
        throw new IllegalArgumentException("Unknown qualifier: " + symbol);
    }
}
