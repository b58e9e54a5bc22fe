package io.github.cyfko.flatdae.core.dae;

import io.github.cyfko.flatdae.core.ast.Expression;

import java.util.Objects;

/**
 * Assignment {@code target := value} applied when a reset fires. The value reads
 * pre-event quantities.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ResetAssignment(String target, Expression value) {

    public ResetAssignment {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }
}
