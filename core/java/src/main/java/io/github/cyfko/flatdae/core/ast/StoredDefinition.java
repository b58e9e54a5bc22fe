package io.github.cyfko.flatdae.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of one compilation unit: an optional {@code within} clause followed by
 * class definitions.
 *
 * @param within  package named by the {@code within} clause, or {@code null}
 * @param classes top-level classes in source order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record StoredDefinition(Name within, List<ClassDefinition> classes) {

    public StoredDefinition {
        Objects.requireNonNull(classes, "classes cannot be null");
        classes = List.copyOf(classes);
    }

    public Optional<Name> withinName() {
        return Optional.ofNullable(within);
    }

    /**
     * Resolves a class by dotted name through nested class definitions.
     *
     * @param dottedName name such as {@code "Pkg.Model"}
     * @return the class, if found
     */
    public Optional<ClassDefinition> findClass(String dottedName) {
        Name name = Name.parse(dottedName);
        Optional<ClassDefinition> current = classes.stream()
                .filter(c -> c.name().equals(name.first()))
                .findFirst();
        for (String part : name.parts().subList(1, name.parts().size())) {
            if (current.isEmpty()) break;
            current = current.get().nestedClass(part);
        }
        return current;
    }
}
