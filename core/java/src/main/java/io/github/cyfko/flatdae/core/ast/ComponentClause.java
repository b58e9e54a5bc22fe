package io.github.cyfko.flatdae.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Component clause such as {@code parameter Real e = 0.8, h0 = 1;}.
 *
 * @param typePrefix type prefix shared by all declarations
 * @param typeName   declared type
 * @param components declarations in source order, at least one
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ComponentClause(TypePrefix typePrefix, Name typeName, List<ComponentDeclaration> components)
        implements Element {

    public ComponentClause {
        Objects.requireNonNull(typePrefix, "typePrefix cannot be null");
        Objects.requireNonNull(typeName, "typeName cannot be null");
        Objects.requireNonNull(components, "components cannot be null");
        if (components.isEmpty()) {
            throw new IllegalArgumentException("A component clause declares at least one component");
        }
        components = List.copyOf(components);
    }
}
