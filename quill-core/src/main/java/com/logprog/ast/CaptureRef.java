package com.logprog.ast;

/**
 * Reference to a regex capture group, written {@code $name} or {@code $1}.
 * The name is stored without the dollar sign.
 */
public record CaptureRef(
    SourceLocation loc,
    String name
) implements Node {
    public CaptureRef(String name) {
        this(null, name);
    }

    @Override
    public String type() {
        return "CaptureRef";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
