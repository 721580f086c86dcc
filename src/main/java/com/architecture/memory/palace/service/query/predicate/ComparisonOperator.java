package com.architecture.memory.palace.service.query.predicate;

public enum ComparisonOperator {
    EQ("="),
    NE("<>"),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    CONTAINS("CONTAINS"),
    ENDS_WITH("ENDS WITH");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
