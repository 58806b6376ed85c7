package com.logprog.ast;

public record NumericExpr(
    SourceLocation loc,
    long value
) implements Node {
    public NumericExpr(long value) {
        this(null, value);
    }

    @Override
    public String type() {
        return "NumericExpr";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
