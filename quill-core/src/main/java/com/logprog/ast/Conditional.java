package com.logprog.ast;

import java.util.List;

/**
 * A guarded block.
 *
 * Example:
 * /^(?P<code>\d+) / {
 *   requests[$code]++
 * }
 *
 * The guard is null for an unconditional block.
 */
public record Conditional(
    SourceLocation loc,
    Node cond,
    List<Node> children
) implements Node {
    public Conditional(Node cond, List<Node> children) {
        this(null, cond, children);
    }

    @Override
    public String type() {
        return "Conditional";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
