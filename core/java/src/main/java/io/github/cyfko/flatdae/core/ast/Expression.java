package io.github.cyfko.flatdae.core.ast;

/**
 * Expression node of the abstract syntax tree.
 * <p>
 * The set of node kinds is closed: {@link Terminal}, {@link ComponentReference},
 * {@link Binary}, {@link Unary} and {@link FunctionCall}. Consumers dispatch through
 * {@link ExpressionVisitor}, so adding a kind is a compile-time obligation for every
 * consumer (flattener, evaluator, renderers).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExpressionVisitor
 */
public interface Expression {

    /**
     * Dispatches to the visitor method matching this node kind.
     *
     * @param visitor the visitor
     * @param <R>     result type
     * @return the visitor result
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
