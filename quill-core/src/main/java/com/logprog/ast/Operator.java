package com.logprog.ast;

/**
 * Operator tokens carried by {@link BinaryExpr} and {@link UnaryExpr}.
 */
public enum Operator {
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    EQ("=="),
    NE("!="),
    SHL("<<"),
    SHR(">>"),
    AND("&"),
    OR("|"),
    XOR("^"),
    NOT("~"),
    PLUS("+"),
    MINUS("-"),
    MUL("*"),
    DIV("/"),
    POW("**"),
    ASSIGN("="),
    ADD_ASSIGN("+="),
    INC("++");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
