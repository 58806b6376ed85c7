package com.logprog.ast;

public record UnaryExpr(
    SourceLocation loc,
    Operator op,  // INC (postfix) | NOT (prefix)
    Node operand
) implements Node {
    public UnaryExpr(Operator op, Node operand) {
        this(null, op, operand);
    }

    @Override
    public String type() {
        return "UnaryExpr";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
