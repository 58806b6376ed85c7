package com.logprog.ast;

public record IndexedExpr(
    SourceLocation loc,
    Node lhs,
    Node index
) implements Node {
    public IndexedExpr(Node lhs, Node index) {
        this(null, lhs, index);
    }

    @Override
    public String type() {
        return "IndexedExpr";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
