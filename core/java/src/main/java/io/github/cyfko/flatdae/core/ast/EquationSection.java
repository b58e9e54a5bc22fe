package io.github.cyfko.flatdae.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code [initial] equation} section.
 *
 * @param initial   {@code true} for an {@code initial equation} section
 * @param equations equations in source order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EquationSection(boolean initial, List<Equation> equations) {

    public EquationSection {
        Objects.requireNonNull(equations, "equations cannot be null");
        equations = List.copyOf(equations);
    }
}
