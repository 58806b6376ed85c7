package com.logprog.ast;

import java.util.List;

/**
 * A metric declaration.
 *
 * Example:
 * counter requests by code, method
 */
public record Declaration(
    SourceLocation loc,
    MetricKind kind,
    String name,
    List<String> keys
) implements Node {
    public Declaration(MetricKind kind, String name, List<String> keys) {
        this(null, kind, name, keys);
    }

    public Declaration(MetricKind kind, String name) {
        this(null, kind, name, List.of());
    }

    @Override
    public String type() {
        return "Declaration";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
