package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;

/**
 * Equality equation {@code lhs = rhs}.
 *
 * @param lhs         left-hand side
 * @param rhs         right-hand side
 * @param description description string, empty when absent
 * @param position    position of the left-hand side
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SimpleEquation(Expression lhs, Expression rhs, String description, SourcePosition position)
        implements Equation {

    public SimpleEquation {
        Objects.requireNonNull(lhs, "lhs cannot be null");
        Objects.requireNonNull(rhs, "rhs cannot be null");
        description = description == null ? "" : description;
        position = position == null ? SourcePosition.SYNTHETIC : position;
    }

    public SimpleEquation(Expression lhs, Expression rhs) {
        this(lhs, rhs, "", SourcePosition.SYNTHETIC);
    }

    @Override
    public <R> R accept(EquationVisitor<R> visitor) {
        return visitor.visitSimple(this);
    }
}
