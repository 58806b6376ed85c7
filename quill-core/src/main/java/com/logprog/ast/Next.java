package com.logprog.ast;

public record Next(SourceLocation loc) implements Node {
    public Next() {
        this(null);
    }

    @Override
    public String type() {
        return "Next";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
