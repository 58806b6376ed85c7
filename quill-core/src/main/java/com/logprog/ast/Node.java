package com.logprog.ast;

/**
 * Base interface for all program AST nodes.
 *
 * <p>The set of variants is closed: every node handed to the unparser is one of
 * the records permitted here, and every {@link NodeVisitor} must handle each of them.</p>
 */
public sealed interface Node permits
    StatementList,
    ExpressionList,
    Conditional,
    Regex,
    BinaryExpr,
    UnaryExpr,
    StringLiteral,
    Identifier,
    CaptureRef,
    Builtin,
    IndexedExpr,
    Declaration,
    NumericExpr,
    FunctionDef,
    Decorator,
    Next {

    String type();
    SourceLocation loc();

    <T> T accept(NodeVisitor<T> visitor);
}
