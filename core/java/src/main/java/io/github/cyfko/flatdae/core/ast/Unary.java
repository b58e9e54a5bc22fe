package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;

/**
 * Prefix operation {@code op operand}.
 *
 * @param op      operator
 * @param operand operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Unary(UnaryOperator op, Expression operand) implements Expression {

    public Unary {
        Objects.requireNonNull(op, "op cannot be null");
        Objects.requireNonNull(operand, "operand cannot be null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
