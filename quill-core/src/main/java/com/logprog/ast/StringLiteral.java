package com.logprog.ast;

/**
 * A string constant. The text is stored unquoted and unescaped.
 */
public record StringLiteral(
    SourceLocation loc,
    String text
) implements Node {
    public StringLiteral(String text) {
        this(null, text);
    }

    @Override
    public String type() {
        return "StringLiteral";
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
