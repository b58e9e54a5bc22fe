package io.github.cyfko.flatdae.core.dae;

import java.util.List;
import java.util.Objects;

/**
 * Ordered assignments executed together when the matching condition fires.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ResetBlock(List<ResetAssignment> assignments) {

    public ResetBlock {
        Objects.requireNonNull(assignments, "assignments cannot be null");
        if (assignments.isEmpty()) {
            throw new IllegalArgumentException("A reset block needs at least one assignment");
        }
        assignments = List.copyOf(assignments);
    }

    public static ResetBlock of(ResetAssignment... assignments) {
        return new ResetBlock(List.of(assignments));
    }
}
