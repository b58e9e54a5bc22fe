package io.github.cyfko.flatdae.core.config;

/**
 * How renderers wrap operator nodes in parentheses.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Parenthesization {

    /** Wrap a child only when the target's precedence or associativity requires it: {@code a + b * c}. */
    MINIMAL,

    /** Wrap every binary and unary node: {@code (a + (b * c))}. */
    MAXIMAL
}
