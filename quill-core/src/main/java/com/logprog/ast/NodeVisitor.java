package com.logprog.ast;

/**
 * Visitor over the closed set of {@link Node} variants.
 *
 * @param <T> the result type of each visit
 */
public interface NodeVisitor<T> {
    T visit(StatementList node);
    T visit(ExpressionList node);
    T visit(Conditional node);
    T visit(Regex node);
    T visit(BinaryExpr node);
    T visit(UnaryExpr node);
    T visit(StringLiteral node);
    T visit(Identifier node);
    T visit(CaptureRef node);
    T visit(Builtin node);
    T visit(IndexedExpr node);
    T visit(Declaration node);
    T visit(NumericExpr node);
    T visit(FunctionDef node);
    T visit(Decorator node);
    T visit(Next node);
}
