package com.logprog.ast;

import java.util.List;

/**
 * A sequence of statements, each rendered on its own line. The root of a parsed program.
 */
public record StatementList(
    SourceLocation loc,
    List<Node> children
) implements Node {
    public StatementList(List<Node> children) {
        this(null, children);
    }

    @Override
    public String type() {
        return "StatementList";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
