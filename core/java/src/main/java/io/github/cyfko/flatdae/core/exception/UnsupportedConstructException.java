package io.github.cyfko.flatdae.core.exception;

import io.github.cyfko.flatdae.core.ast.SourcePosition;

import java.util.Set;

/**
 * Exception thrown when the source uses a construct of the language that lies outside
 * the supported subset ({@code when}/{@code if}/{@code for} equations, {@code extends},
 * arrays, algorithm sections, annotations, ...).
 * <p>
 * These constructs are rejected at parse time rather than truncated, so a model is
 * never compiled with parts of it missing.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnsupportedConstructException extends ParseException {

    private final String construct;

    /**
     * @param construct name of the rejected construct, e.g. {@code "when-equation"}
     * @param position  position where it starts
     * @param found     text of the token that introduced it
     */
    public UnsupportedConstructException(String construct, SourcePosition position, String found) {
        super(String.format("Unsupported construct: %s at %s (found '%s')", construct, position, found),
                position, found, Set.of());
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}
