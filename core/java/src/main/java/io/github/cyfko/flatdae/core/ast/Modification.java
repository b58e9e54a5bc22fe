package io.github.cyfko.flatdae.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Modification of a declaration: {@code (start = 1, fixed = true) = expr}.
 * Either part may be absent, not both.
 *
 * @param arguments class-modification arguments in source order
 * @param binding   binding expression after {@code =}, or {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Modification(List<ElementModification> arguments, Expression binding) {

    public Modification {
        Objects.requireNonNull(arguments, "arguments cannot be null");
        arguments = List.copyOf(arguments);
    }

    public static Modification binding(Expression binding) {
        return new Modification(List.of(), Objects.requireNonNull(binding, "binding cannot be null"));
    }

    public Optional<Expression> bindingOpt() {
        return Optional.ofNullable(binding);
    }

    /**
     * Finds the argument modifying {@code name}.
     *
     * @param name simple argument name
     * @return the argument, if present
     */
    public Optional<ElementModification> argument(String name) {
        return arguments.stream()
                .filter(arg -> arg.name().isSimple() && arg.name().first().equals(name))
                .findFirst();
    }
}
