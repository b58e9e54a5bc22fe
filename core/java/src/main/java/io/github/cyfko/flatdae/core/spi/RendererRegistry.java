package io.github.cyfko.flatdae.core.spi;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of {@link ModelRenderer} implementations, keyed by target name.
 * <p>
 * Target names are case-insensitive. Registering a second renderer for the same target
 * is rejected; unregister the first one explicitly to replace it.
 * </p>
 *
 * <pre>{@code
 * RendererRegistry.register(new SympyModelRenderer());
 * ModelRenderer renderer = RendererRegistry.getRenderer("sympy").orElseThrow();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RendererRegistry {
    private static final Map<String, ModelRenderer> RENDERERS = new ConcurrentHashMap<>();

    private RendererRegistry() {
    }

    /**
     * @throws IllegalArgumentException if the target name is blank or already taken
     */
    public static void register(ModelRenderer renderer) {
        String target = key(Objects.requireNonNull(renderer, "renderer cannot be null").target());
        if (target.isEmpty()) {
            throw new IllegalArgumentException("Renderer target cannot be blank");
        }
        var previous = RENDERERS.putIfAbsent(target, renderer);
        if (previous != null && previous != renderer) {
            throw new IllegalArgumentException("Target [" + target + "] is already registered.");
        }
    }

    public static void unregister(String target) {
        if (target != null) {
            RENDERERS.remove(key(target));
        }
    }

    public static Optional<ModelRenderer> getRenderer(String target) {
        if (target == null || target.isBlank()) return Optional.empty();
        return Optional.ofNullable(RENDERERS.get(key(target)));
    }

    public static Set<String> getRegisteredTargets() {
        return Collections.unmodifiableSet(new TreeSet<>(RENDERERS.keySet()));
    }

    public static void unregisterAll() {
        RENDERERS.clear();
    }

    private static String key(String target) {
        return target == null ? "" : target.trim().toLowerCase(Locale.ROOT);
    }
}
