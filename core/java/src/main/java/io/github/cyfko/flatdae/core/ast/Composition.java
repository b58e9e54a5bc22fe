package io.github.cyfko.flatdae.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Body of a long class specifier: an element list followed by equation sections.
 *
 * @param elements         components and nested classes in declaration order
 * @param equationSections equation sections in source order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Composition(List<Element> elements, List<EquationSection> equationSections) {

    public Composition {
        Objects.requireNonNull(elements, "elements cannot be null");
        Objects.requireNonNull(equationSections, "equationSections cannot be null");
        elements = List.copyOf(elements);
        equationSections = List.copyOf(equationSections);
    }

    /** @return the component clauses, in declaration order */
    public List<ComponentClause> componentClauses() {
        return elements.stream()
                .filter(ComponentClause.class::isInstance)
                .map(ComponentClause.class::cast)
                .toList();
    }

    /** @return nested class definitions, in declaration order */
    public List<ClassDefinition> classes() {
        return elements.stream()
                .filter(ClassDefinition.class::isInstance)
                .map(ClassDefinition.class::cast)
                .toList();
    }
}
