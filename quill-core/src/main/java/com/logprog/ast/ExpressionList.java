package com.logprog.ast;

import java.util.List;

/**
 * Comma separated expressions, e.g. the arguments of a builtin call.
 */
public record ExpressionList(
    SourceLocation loc,
    List<Node> children
) implements Node {
    public ExpressionList(List<Node> children) {
        this(null, children);
    }

    @Override
    public String type() {
        return "ExpressionList";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
