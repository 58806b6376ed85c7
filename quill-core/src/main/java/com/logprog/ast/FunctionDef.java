package com.logprog.ast;

import java.util.List;

/**
 * Definition of a decorator body, invoked later with {@code @name { ... }}.
 *
 * Example:
 * def syslog {
 *   /^(?P<date>\w+\s+\d+\s+\d+:\d+:\d+)/ {
 *     next
 *   }
 * }
 */
public record FunctionDef(
    SourceLocation loc,
    String name,
    List<Node> children
) implements Node {
    public FunctionDef(String name, List<Node> children) {
        this(null, name, children);
    }

    @Override
    public String type() {
        return "FunctionDef";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
