package com.logprog.ast;

/**
 * A regular expression literal. The pattern is stored without its delimiting slashes.
 */
public record Regex(
    SourceLocation loc,
    String pattern
) implements Node {
    public Regex(String pattern) {
        this(null, pattern);
    }

    @Override
    public String type() {
        return "Regex";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
