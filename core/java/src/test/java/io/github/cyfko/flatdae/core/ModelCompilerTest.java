package io.github.cyfko.flatdae.core;

import io.github.cyfko.flatdae.core.api.Flattener;
import io.github.cyfko.flatdae.core.api.ModelParser;
import io.github.cyfko.flatdae.core.ast.StoredDefinition;
import io.github.cyfko.flatdae.core.config.FlattenPolicy;
import io.github.cyfko.flatdae.core.config.ParserPolicy;
import io.github.cyfko.flatdae.core.dae.DaeModel;
import io.github.cyfko.flatdae.core.exception.ParseException;
import io.github.cyfko.flatdae.core.exception.ResetWithoutConditionException;
import io.github.cyfko.flatdae.core.render.DaeModelPrinter;
import io.github.cyfko.flatdae.core.spi.ModelRenderer;
import io.github.cyfko.flatdae.core.spi.RendererRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the {@link ModelCompiler} facade.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("ModelCompiler Tests")
class ModelCompilerTest {

    private static final String BOUNCING_BALL = String.join("\n",
            "model BouncingBall",
            "  parameter Real e = 0.8;",
            "  Real h(start = 1);",
            "  Real v;",
            "equation",
            "  der(h) = v;",
            "  der(v) = -9.81;",
            "  reinit(v, -e*pre(v));",
            "end BouncingBall;");

    @Mock
    private ModelParser parser;

    @Mock
    private Flattener flattener;

    @Mock
    private ModelRenderer renderer;

    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        RendererRegistry.unregisterAll();
    }

    @AfterEach
    void tearDown() throws Exception {
        RendererRegistry.unregisterAll();
        mocks.close();
    }

    @Nested
    @DisplayName("Pipeline wiring")
    class Wiring {

        @Test
        @DisplayName("Should hand the parsed unit to the flattener")
        void testCompileDelegates() {
            StoredDefinition unit = new StoredDefinition(null, List.of());
            DaeModel model = DaeModel.builder("M").build();
            when(parser.parse("source")).thenReturn(unit);
            when(flattener.flatten(unit, "M")).thenReturn(model);

            DaeModel result = ModelCompiler.of(parser, flattener).compile("source", "M");

            assertSame(model, result);
            verify(parser).parse("source");
            verify(flattener).flatten(unit, "M");
            verifyNoMoreInteractions(parser, flattener);
        }

        @Test
        @DisplayName("Should not flatten when parsing fails")
        void testParseFailureStops() {
            when(parser.parse(anyString())).thenThrow(new ParseException("boom", null, "", null));

            assertThrows(ParseException.class, () -> ModelCompiler.of(parser, flattener).compile("x", "M"));
            verifyNoInteractions(flattener);
        }

        @Test
        @DisplayName("Should render with the given renderer")
        void testGenerateWithRenderer() {
            StoredDefinition unit = new StoredDefinition(null, List.of());
            DaeModel model = DaeModel.builder("M").build();
            when(parser.parse("source")).thenReturn(unit);
            when(flattener.flatten(unit, "M")).thenReturn(model);
            when(renderer.render(model)).thenReturn("rendered");
            when(renderer.target()).thenReturn("mock");

            assertEquals("rendered", ModelCompiler.of(parser, flattener).generate("source", "M", renderer));
            verify(renderer).render(model);
        }

        @Test
        @DisplayName("Should require both stages")
        void testNullStages() {
            assertThrows(NullPointerException.class, () -> ModelCompiler.of(null, flattener));
            assertThrows(NullPointerException.class, () -> ModelCompiler.of(parser, null));
        }
    }

    @Nested
    @DisplayName("Default pipeline")
    class Defaults {

        @Test
        @DisplayName("Should compile with configured reset conditions")
        void testCompile() {
            ModelCompiler compiler = ModelCompiler.of(FlattenPolicy.builder().resetCondition("__c0", "h < 0").build());

            DaeModel model = compiler.compile(BOUNCING_BALL, "BouncingBall");

            assertEquals(2, model.x().size());
            assertEquals(1, model.c().size());
        }

        @Test
        @DisplayName("Should fail on reinit without condition")
        void testDefaultsRejectReinit() {
            assertThrows(ResetWithoutConditionException.class,
                    () -> ModelCompiler.defaults().compile(BOUNCING_BALL, "BouncingBall"));
        }

        @Test
        @DisplayName("Should apply the parser policy")
        void testParserPolicy() {
            ModelCompiler compiler = ModelCompiler.of(ParserPolicy.builder().maxSourceLength(20).build(),
                    FlattenPolicy.defaults());
            assertThrows(ParseException.class, () -> compiler.compile(BOUNCING_BALL, "BouncingBall"));
        }

        @Test
        @DisplayName("Should render through the registry by target name")
        void testGenerateByTarget() {
            RendererRegistry.register(new DaeModelPrinter());
            ModelCompiler compiler = ModelCompiler.of(FlattenPolicy.builder().resetCondition("__c0", "h < 0").build());

            String listing = compiler.generate(BOUNCING_BALL, "BouncingBall", "text");

            assertTrue(listing.startsWith("model BouncingBall\n"));
            assertTrue(listing.contains("__c0: v := -e * pre(v)"));
        }

        @Test
        @DisplayName("Should reject an unregistered target")
        void testUnknownTarget() {
            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                    () -> ModelCompiler.defaults().generate("model M end M;", "M", "cobol"));
            assertTrue(exception.getMessage().contains("cobol"));
        }
    }
}
