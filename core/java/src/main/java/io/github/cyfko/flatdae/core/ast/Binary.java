package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;

/**
 * Binary operation {@code lhs op rhs}.
 *
 * @param op  operator
 * @param lhs left operand
 * @param rhs right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Binary(BinaryOperator op, Expression lhs, Expression rhs) implements Expression {

    public Binary {
        Objects.requireNonNull(op, "op cannot be null");
        Objects.requireNonNull(lhs, "lhs cannot be null");
        Objects.requireNonNull(rhs, "rhs cannot be null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
