package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Class definition with a long class specifier:
 * <pre>
 * [encapsulated] [partial] &lt;kind&gt; IDENT ["description"]
 *     composition
 * end IDENT;
 * </pre>
 * <p>
 * {@code endName} keeps the identifier written after {@code end}; checking that it
 * matches {@code name} belongs to the flattener, not the parser.
 * </p>
 *
 * @param name         class name
 * @param kind         class restriction
 * @param encapsulated {@code encapsulated} prefix present
 * @param partial      {@code partial} prefix present
 * @param isFinal      {@code final} prefix present
 * @param purity       function purity prefix
 * @param description  description string, empty when absent
 * @param composition  class body
 * @param endName      identifier after {@code end}
 * @param position     position of the class name
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ClassDefinition(
        String name,
        ClassKind kind,
        boolean encapsulated,
        boolean partial,
        boolean isFinal,
        Purity purity,
        String description,
        Composition composition,
        String endName,
        SourcePosition position
) implements Element {

    public ClassDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(composition, "composition cannot be null");
        Objects.requireNonNull(endName, "endName cannot be null");
        purity = purity == null ? Purity.UNSPECIFIED : purity;
        description = description == null ? "" : description;
        position = position == null ? SourcePosition.SYNTHETIC : position;
    }

    /**
     * Looks up a directly nested class.
     *
     * @param simpleName class name
     * @return the nested class, if declared
     */
    public Optional<ClassDefinition> nestedClass(String simpleName) {
        return composition.classes().stream()
                .filter(c -> c.name().equals(simpleName))
                .findFirst();
    }
}
