package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;

/**
 * One declaration of a component list with its description string.
 *
 * @param declaration the declaration
 * @param description description string, empty when absent
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ComponentDeclaration(Declaration declaration, String description) {

    public ComponentDeclaration {
        Objects.requireNonNull(declaration, "declaration cannot be null");
        description = description == null ? "" : description;
    }

    public String ident() {
        return declaration.ident();
    }
}
