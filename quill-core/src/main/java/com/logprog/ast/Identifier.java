package com.logprog.ast;

public record Identifier(
    SourceLocation loc,
    String name
) implements Node {
    public Identifier(String name) {
        this(null, name);
    }

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
