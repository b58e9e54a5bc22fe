package io.github.cyfko.flatdae.core.ast;

/**
 * Equation node. Kinds: {@link SimpleEquation} and {@link FunctionCallEquation}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see EquationVisitor
 */
public interface Equation {

    <R> R accept(EquationVisitor<R> visitor);

    /** @return the optional description string, empty when absent */
    String description();
}
