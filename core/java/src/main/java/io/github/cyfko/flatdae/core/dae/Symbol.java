package io.github.cyfko.flatdae.core.dae;

import io.github.cyfko.flatdae.core.ast.Expression;
import io.github.cyfko.flatdae.core.ast.Terminal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A declared quantity after flattening.
 *
 * @param name        flat name, unique within one model
 * @param role        semantic role
 * @param typeName    builtin type name ({@code Real}, {@code Integer}, {@code Boolean})
 * @param start       start expression, or null when none was declared
 * @param fixed       value of the {@code fixed} attribute, or null when absent
 * @param description description string, possibly empty
 * @param attributes  remaining attributes such as {@code unit} or {@code min}, declaration order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Symbol(
        String name,
        SymbolRole role,
        String typeName,
        Expression start,
        Boolean fixed,
        String description,
        Map<String, Expression> attributes
) {

    public static final String REAL = "Real";
    public static final String INTEGER = "Integer";
    public static final String BOOLEAN = "Boolean";

    public Symbol {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Symbol name cannot be null or blank");
        }
        Objects.requireNonNull(role, "role cannot be null");
        Objects.requireNonNull(typeName, "typeName cannot be null");
        description = description == null ? "" : description;
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Symbol(String name, SymbolRole role, String typeName, Expression start) {
        this(name, role, typeName, start, null, "", Map.of());
    }

    public Optional<Expression> startOpt() {
        return Optional.ofNullable(start);
    }

    /**
     * Start expression, falling back to the type default: {@code 0.0} for Real,
     * {@code 0} for Integer, {@code false} for Boolean.
     *
     * @return a non-null expression
     */
    public Expression startOrDefault() {
        if (start != null) {
            return start;
        }
        return switch (typeName) {
            case INTEGER -> Terminal.integer(0);
            case BOOLEAN -> Terminal.bool(false);
            default -> Terminal.real("0.0");
        };
    }

    public Symbol withRole(SymbolRole newRole) {
        return new Symbol(name, newRole, typeName, start, fixed, description, attributes);
    }

    public Symbol withStart(Expression newStart) {
        return new Symbol(name, role, typeName, newStart, fixed, description, attributes);
    }
}
