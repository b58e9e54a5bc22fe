package io.github.cyfko.flatdae.core.dae;

import io.github.cyfko.flatdae.core.ast.Binary;
import io.github.cyfko.flatdae.core.ast.BinaryOperator;
import io.github.cyfko.flatdae.core.ast.Expression;

import java.util.Objects;

/**
 * One entry of {@code fx}; the model requires {@code lhs - rhs = 0}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Residual(Expression lhs, Expression rhs, String description) {

    public Residual {
        Objects.requireNonNull(lhs, "lhs cannot be null");
        Objects.requireNonNull(rhs, "rhs cannot be null");
        description = description == null ? "" : description;
    }

    public Residual(Expression lhs, Expression rhs) {
        this(lhs, rhs, "");
    }

    /**
     * @return the residual expression {@code lhs - rhs}
     */
    public Expression expression() {
        return new Binary(BinaryOperator.SUB, lhs, rhs);
    }
}
