package io.github.cyfko.flatdae.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Side-channel configuration of the flattener.
 * <p>
 * The supported grammar has no {@code when}-equation, so the condition that triggers a
 * {@code reinit} cannot come from the model text. It is supplied here, keyed by the
 * deterministic reset name the flattener generates: {@code __c0} for the first
 * {@code reinit} statement met in equation order, {@code __c1} for the second, and so on.
 * The value is condition source text, parsed with the expression grammar.
 * </p>
 *
 * <pre>{@code
 * FlattenPolicy policy = FlattenPolicy.builder()
 *     .resetCondition("__c0", "h < 0")
 *     .build();
 * }</pre>
 *
 * @param resetConditions reset name to condition source text, iteration order preserved
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FlattenPolicy(Map<String, String> resetConditions) {

    /** Prefix of generated reset and condition names. */
    public static final String RESET_NAME_PREFIX = "__c";

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if a key or condition is null or blank
     */
    public FlattenPolicy {
        if (resetConditions == null) {
            throw new IllegalArgumentException("resetConditions is required");
        }
        Map<String, String> copy = new LinkedHashMap<>();
        resetConditions.forEach((name, condition) -> {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Reset name cannot be null or blank");
            }
            if (condition == null || condition.isBlank()) {
                throw new IllegalArgumentException("Condition for reset '" + name + "' cannot be null or blank");
            }
            copy.put(name, condition);
        });
        resetConditions = Collections.unmodifiableMap(copy);
    }

    /**
     * No reset conditions: any {@code reinit} makes flattening fail.
     *
     * @return default configuration
     */
    public static FlattenPolicy defaults() {
        return new FlattenPolicy(Map.of());
    }

    /**
     * Name generated for the {@code index}-th {@code reinit} statement.
     *
     * @param index 0-based order of appearance
     * @return the reset name
     */
    public static String resetName(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        return RESET_NAME_PREFIX + index;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> _resetConditions = new LinkedHashMap<>();

        private Builder() {}

        public FlattenPolicy build() {
            return new FlattenPolicy(_resetConditions);
        }

        public Builder resetCondition(String resetName, String condition) { this._resetConditions.put(resetName, condition); return this; }
        public Builder resetConditions(Map<String, String> conditions) { this._resetConditions.putAll(conditions); return this; }
    }
}
