package io.github.cyfko.flatdae.core.config;

import java.util.Objects;

/**
 * Rendering options shared by every target.
 *
 * <h2>Options</h2>
 * <ul>
 *   <li><strong>parenthesization</strong>: {@link Parenthesization#MINIMAL} (default) or {@link Parenthesization#MAXIMAL}</li>
 *   <li><strong>placeholderPrefix</strong>: marker emitted in place of unsupported nodes (default: {@code __UNSUPPORTED__})</li>
 *   <li><strong>indent</strong>: one indentation level of generated code (default: four spaces)</li>
 * </ul>
 *
 * <pre>{@code
 * RenderPolicy policy = RenderPolicy.defaults();
 * RenderPolicy policy = RenderPolicy.maximal();
 * RenderPolicy policy = RenderPolicy.builder().indent("  ").build();
 * }</pre>
 *
 * @param parenthesization  parenthesization strategy
 * @param placeholderPrefix greppable marker for unsupported nodes
 * @param indent            one indentation level
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RenderPolicy(
        Parenthesization parenthesization,
        String placeholderPrefix,
        String indent
) {

    public static final String DEFAULT_PLACEHOLDER_PREFIX = "__UNSUPPORTED__";

    public RenderPolicy {
        Objects.requireNonNull(parenthesization, "parenthesization cannot be null");
        if (placeholderPrefix == null || placeholderPrefix.isBlank()) {
            throw new IllegalArgumentException("placeholderPrefix is required");
        }
        if (indent == null || indent.isEmpty() || !indent.isBlank()) {
            throw new IllegalArgumentException("indent must be non-empty whitespace");
        }
    }

    /** @return minimal parenthesization, default placeholder, four-space indent */
    public static RenderPolicy defaults() {
        return new RenderPolicy(Parenthesization.MINIMAL, DEFAULT_PLACEHOLDER_PREFIX, "    ");
    }

    /** @return maximal parenthesization, otherwise as {@link #defaults()} */
    public static RenderPolicy maximal() {
        return new RenderPolicy(Parenthesization.MAXIMAL, DEFAULT_PLACEHOLDER_PREFIX, "    ");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Parenthesization _parenthesization = Parenthesization.MINIMAL;
        private String _placeholderPrefix = DEFAULT_PLACEHOLDER_PREFIX;
        private String _indent = "    ";

        private Builder() {}

        public RenderPolicy build() {
            return new RenderPolicy(_parenthesization, _placeholderPrefix, _indent);
        }

        public Builder parenthesization(Parenthesization parenthesization) { this._parenthesization = parenthesization; return this; }
        public Builder placeholderPrefix(String placeholderPrefix) { this._placeholderPrefix = placeholderPrefix; return this; }
        public Builder indent(String indent) { this._indent = indent; return this; }
    }
}
