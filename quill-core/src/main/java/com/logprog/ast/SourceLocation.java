package com.logprog.ast;

/**
 * Span of program text a node was parsed from. Lines are 1-based, columns 0-based.
 */
public record SourceLocation(Position start, Position end) {
    public record Position(int line, int column) {}

    public static SourceLocation of(int line, int startCol, int endCol) {
        return new SourceLocation(new Position(line, startCol), new Position(line, endCol));
    }
}
