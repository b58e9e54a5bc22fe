package io.github.cyfko.flatdae.core.spi;

import io.github.cyfko.flatdae.core.dae.DaeModel;

/**
 * Contract for turning a flat DAE model into target source text.
 * <p>
 * A renderer is a pure function of its input: rendering the same model twice yields the
 * same text, and no rendering fails on a supported model. Nodes a target cannot express
 * are emitted as a greppable placeholder instead (see
 * {@link io.github.cyfko.flatdae.core.config.RenderPolicy#placeholderPrefix()}).
 * </p>
 *
 * <h3>Example Implementation:</h3>
 * <pre>{@code
 * public class JsonModelRenderer implements ModelRenderer {
 *     public String target() { return "json"; }
 *     public String render(DaeModel model) { ... }
 * }
 *
 * RendererRegistry.register(new JsonModelRenderer());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ModelRenderer {

    /**
     * Name under which the renderer is registered, such as {@code "sympy"}.
     *
     * @return a non-blank target name
     */
    String target();

    /**
     * Renders the whole model.
     *
     * @param model flat DAE model
     * @return generated source text
     */
    String render(DaeModel model);
}
