package org.termkit.core;

/**
 * 排序 (Sort) 的种类标签。
 */
public enum SortKind {
    BOOL("Bool"),
    INT("Int"),
    REAL("Real"),
    BV("BitVec"),
    FP("FloatingPoint"),
    ARRAY("Array"),
    ROUNDING_MODE("RoundingMode"),
    UNINTERPRETED("Uninterpreted");

    private final String symbol;

    SortKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
