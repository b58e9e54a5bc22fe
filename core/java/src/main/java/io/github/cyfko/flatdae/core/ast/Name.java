package io.github.cyfko.flatdae.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, non-empty sequence of identifiers joined by {@code '.'}.
 * <p>
 * A leading dot in the source ({@code .Modelica.Constants.pi}) makes the name
 * absolute, meaning it is resolved from the root scope instead of the enclosing one.
 * </p>
 *
 * <pre>{@code
 * Name name = Name.of("ball", "h");
 * name.toString();   // "ball.h"
 * name.parts();      // ["ball", "h"]
 * }</pre>
 *
 * @param absolute {@code true} when written with a leading dot
 * @param parts    identifiers in source order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Name(boolean absolute, List<String> parts) {

    public Name {
        Objects.requireNonNull(parts, "parts cannot be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("A name requires at least one identifier");
        }
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                throw new IllegalArgumentException("Name parts cannot be null or blank: " + parts);
            }
        }
        parts = List.copyOf(parts);
    }

    /**
     * Creates a relative name.
     *
     * @param parts identifiers, at least one
     * @return the name
     */
    public static Name of(String... parts) {
        return new Name(false, List.of(parts));
    }

    /**
     * Splits a dotted string ({@code "a.b.c"} or {@code ".a.b"}) into a name.
     *
     * @param dotted dotted text
     * @return the name
     * @throws IllegalArgumentException if a segment is empty
     */
    public static Name parse(String dotted) {
        Objects.requireNonNull(dotted, "dotted cannot be null");
        boolean absolute = dotted.startsWith(".");
        String body = absolute ? dotted.substring(1) : dotted;
        return new Name(absolute, List.of(body.split("\\.", -1)));
    }

    /** @return the first identifier */
    public String first() {
        return parts.get(0);
    }

    /** @return the last identifier */
    public String last() {
        return parts.get(parts.size() - 1);
    }

    /** @return {@code true} for a single, relative identifier */
    public boolean isSimple() {
        return !absolute && parts.size() == 1;
    }

    @Override
    public String toString() {
        return (absolute ? "." : "") + String.join(".", parts);
    }
}
