package io.github.cyfko.flatdae.core;

import io.github.cyfko.flatdae.core.api.Flattener;
import io.github.cyfko.flatdae.core.api.ModelParser;
import io.github.cyfko.flatdae.core.ast.StoredDefinition;
import io.github.cyfko.flatdae.core.config.FlattenPolicy;
import io.github.cyfko.flatdae.core.config.ParserPolicy;
import io.github.cyfko.flatdae.core.dae.DaeModel;
import io.github.cyfko.flatdae.core.exception.FlatteningException;
import io.github.cyfko.flatdae.core.exception.LexException;
import io.github.cyfko.flatdae.core.exception.ParseException;
import io.github.cyfko.flatdae.core.flatten.BasicFlattener;
import io.github.cyfko.flatdae.core.parsing.RecursiveDescentParser;
import io.github.cyfko.flatdae.core.spi.ModelRenderer;
import io.github.cyfko.flatdae.core.spi.RendererRegistry;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade chaining parsing, flattening and rendering.
 *
 * <p><strong>Pipeline:</strong></p>
 * <ol>
 *   <li><strong>Parse:</strong> source text to {@link StoredDefinition} using {@link ModelParser}</li>
 *   <li><strong>Flatten:</strong> selected class to {@link DaeModel} using {@link Flattener}</li>
 *   <li><strong>Render:</strong> model to target text using a {@link ModelRenderer}</li>
 * </ol>
 *
 * <pre>{@code
 * ModelCompiler compiler = ModelCompiler.of(FlattenPolicy.builder()
 *     .resetCondition("__c0", "h < 0")
 *     .build());
 *
 * DaeModel model = compiler.compile(source, "BouncingBall");
 * String python = compiler.generate(source, "BouncingBall", "sympy");
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link LexException}, {@link ParseException}: the source is not valid in the supported grammar</li>
 *   <li>{@link FlatteningException} and subclasses: the model cannot be classified</li>
 *   <li>{@link IllegalArgumentException}: no renderer registered for the requested target</li>
 * </ul>
 *
 * <p>Instances are immutable and can be shared.</p>
 *
 * @see RecursiveDescentParser
 * @see BasicFlattener
 * @see RendererRegistry
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ModelCompiler {

    private static final Logger log = Logger.getLogger(ModelCompiler.class.getName());

    private final ModelParser parser;
    private final Flattener flattener;

    private ModelCompiler(ModelParser parser, Flattener flattener) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.flattener = Objects.requireNonNull(flattener, "flattener cannot be null");
    }

    /**
     * Default parser policy and no reset conditions.
     */
    public static ModelCompiler defaults() {
        return of(FlattenPolicy.defaults());
    }

    public static ModelCompiler of(FlattenPolicy flattenPolicy) {
        return of(ParserPolicy.defaults(), flattenPolicy);
    }

    public static ModelCompiler of(ParserPolicy parserPolicy, FlattenPolicy flattenPolicy) {
        ModelParser parser = new RecursiveDescentParser(parserPolicy);
        return new ModelCompiler(parser, new BasicFlattener(flattenPolicy, parser));
    }

    /**
     * Full customization of both stages.
     */
    public static ModelCompiler of(ModelParser parser, Flattener flattener) {
        return new ModelCompiler(parser, flattener);
    }

    /**
     * Parses {@code source} and flattens the class named {@code modelName}.
     *
     * @param source    one compilation unit
     * @param modelName dotted class name
     * @return the flat model
     */
    public DaeModel compile(String source, String modelName) {
        StoredDefinition unit = parser.parse(source);
        log.fine(() -> String.format("Parsed %d top-level class(es)", unit.classes().size()));

        DaeModel model = flattener.flatten(unit, modelName);
        log.info(() -> String.format("Compiled %s", model));
        return model;
    }

    /**
     * Compiles and renders with the given renderer.
     */
    public String generate(String source, String modelName, ModelRenderer renderer) {
        Objects.requireNonNull(renderer, "renderer cannot be null");
        DaeModel model = compile(source, modelName);
        String text = renderer.render(model);
        log.fine(() -> String.format("Rendered '%s' for target '%s' (%d chars)",
                model.name(), renderer.target(), text.length()));
        return text;
    }

    /**
     * Compiles and renders with the renderer registered for {@code target}.
     *
     * @throws IllegalArgumentException if no renderer is registered for the target
     */
    public String generate(String source, String modelName, String target) {
        ModelRenderer renderer = RendererRegistry.getRenderer(target)
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                        "No renderer registered for target '%s'. Registered targets: %s",
                        target, RendererRegistry.getRegisteredTargets())));
        return generate(source, modelName, renderer);
    }
}
