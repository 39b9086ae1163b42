package org.termkit.core;

/**
 * 浮点舍入模式，对应 SMT-LIB 的 RoundingMode 常量。
 */
public enum RoundingModeKind {
    ROUND_NEAREST_TIES_TO_EVEN("RNE"),
    ROUND_NEAREST_TIES_TO_AWAY("RNA"),
    ROUND_TOWARD_POSITIVE("RTP"),
    ROUND_TOWARD_NEGATIVE("RTN"),
    ROUND_TOWARD_ZERO("RTZ");

    private final String symbol;

    RoundingModeKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
