package io.github.cyfko.flatdae.core.render;

/**
 * How a target groups a chain of operators of equal precedence.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Associativity {
    LEFT,
    RIGHT,
    /** Chains are not allowed, or mean something else (Python comparison chaining). */
    NONE
}
