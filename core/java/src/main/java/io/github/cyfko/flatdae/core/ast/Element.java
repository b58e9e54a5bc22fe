package io.github.cyfko.flatdae.core.ast;

/**
 * Entry of a class element list: a {@link ComponentClause} or a nested {@link ClassDefinition}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Element {
}
