package io.github.cyfko.flatdae.core.ast;

/**
 * Exhaustive matcher over {@link Equation} kinds.
 *
 * @param <R> result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface EquationVisitor<R> {

    R visitSimple(SimpleEquation equation);

    R visitFunctionCall(FunctionCallEquation equation);
}
