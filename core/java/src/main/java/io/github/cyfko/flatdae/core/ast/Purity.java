package io.github.cyfko.flatdae.core.ast;

/**
 * Optional {@code pure}/{@code impure} prefix of a function class.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Purity {
    UNSPECIFIED,
    PURE,
    IMPURE
}
