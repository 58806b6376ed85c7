package com.logprog.ast;

/**
 * A call to a builtin function such as {@code strptime} or {@code len}.
 * {@code args} is null when the call has no arguments.
 */
public record Builtin(
    SourceLocation loc,
    String name,
    ExpressionList args
) implements Node {
    public Builtin(String name, ExpressionList args) {
        this(null, name, args);
    }

    @Override
    public String type() {
        return "Builtin";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
