package com.logprog.ast;

import java.util.List;

/**
 * Application of a {@link FunctionDef} to a block. The block's statements replace
 * the {@code next} keyword inside the definition.
 */
public record Decorator(
    SourceLocation loc,
    String name,
    List<Node> children
) implements Node {
    public Decorator(String name, List<Node> children) {
        this(null, name, children);
    }

    @Override
    public String type() {
        return "Decorator";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
