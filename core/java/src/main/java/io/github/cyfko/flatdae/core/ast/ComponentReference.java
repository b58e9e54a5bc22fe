package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;

/**
 * Reference to a declared component, possibly dotted ({@code ball.h}) or
 * absolute ({@code .ball.h}).
 *
 * @param name referenced name
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ComponentReference(Name name) implements Expression {

    public ComponentReference {
        Objects.requireNonNull(name, "name cannot be null");
    }

    /**
     * Shorthand for a single-identifier reference.
     *
     * @param identifier the identifier
     * @return the reference
     */
    public static ComponentReference of(String identifier) {
        return new ComponentReference(Name.of(identifier));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitComponentReference(this);
    }

    @Override
    public String toString() {
        return name.toString();
    }
}
