package com.logprog.ast;

public record BinaryExpr(
    SourceLocation loc,
    Node lhs,
    Operator op,
    Node rhs
) implements Node {
    public BinaryExpr(Node lhs, Operator op, Node rhs) {
        this(null, lhs, op, rhs);
    }

    @Override
    public String type() {
        return "BinaryExpr";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
