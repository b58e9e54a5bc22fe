package io.github.cyfko.flatdae.core.ast;

/**
 * Exhaustive matcher over {@link Expression} node kinds.
 *
 * @param <R> result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionVisitor<R> {

    R visitTerminal(Terminal terminal);

    R visitComponentReference(ComponentReference reference);

    R visitBinary(Binary binary);

    R visitUnary(Unary unary);

    R visitFunctionCall(FunctionCall call);
}
