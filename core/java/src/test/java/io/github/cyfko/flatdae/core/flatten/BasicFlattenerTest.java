package io.github.cyfko.flatdae.core.flatten;

import io.github.cyfko.flatdae.core.api.ModelParser;
import io.github.cyfko.flatdae.core.ast.ComponentReference;
import io.github.cyfko.flatdae.core.ast.Expression;
import io.github.cyfko.flatdae.core.ast.StoredDefinition;
import io.github.cyfko.flatdae.core.ast.Terminal;
import io.github.cyfko.flatdae.core.config.FlattenPolicy;
import io.github.cyfko.flatdae.core.dae.DaeModel;
import io.github.cyfko.flatdae.core.dae.ResetAssignment;
import io.github.cyfko.flatdae.core.dae.Symbol;
import io.github.cyfko.flatdae.core.dae.SymbolRole;
import io.github.cyfko.flatdae.core.exception.ClassificationException;
import io.github.cyfko.flatdae.core.exception.FlatteningException;
import io.github.cyfko.flatdae.core.exception.ParseException;
import io.github.cyfko.flatdae.core.exception.ResetWithoutConditionException;
import io.github.cyfko.flatdae.core.exception.UnresolvedReferenceException;
import io.github.cyfko.flatdae.core.parsing.RecursiveDescentParser;
import io.github.cyfko.flatdae.core.render.SourceExpressionRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link BasicFlattener}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("BasicFlattener Tests")
class BasicFlattenerTest {

    private static final String BOUNCING_BALL = String.join("\n",
            "model BouncingBall",
            "  parameter Real e = 0.8;",
            "  parameter Real h0 = 1.0;",
            "  Real h(start = h0);",
            "  Real v;",
            "equation",
            "  v = der(h);",
            "  der(v) = -9.81;",
            "  reinit(v, -e*pre(v));",
            "end BouncingBall;");

    private static final FlattenPolicy BALL_POLICY = FlattenPolicy.builder()
            .resetCondition("__c0", "h < 0")
            .build();

    private final RecursiveDescentParser parser = new RecursiveDescentParser();
    private final SourceExpressionRenderer renderer = new SourceExpressionRenderer();

    private DaeModel flatten(String source, String modelName, FlattenPolicy policy) {
        return new BasicFlattener(policy).flatten(parser.parse(source), modelName);
    }

    private DaeModel flatten(String source, String modelName) {
        return flatten(source, modelName, FlattenPolicy.defaults());
    }

    private static List<String> names(List<Symbol> symbols) {
        return symbols.stream().map(Symbol::name).collect(Collectors.toList());
    }

    private List<String> residuals(DaeModel model) {
        return model.fx().stream().map(r -> renderer.render(r.expression())).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("Should classify a lone unknown as algebraic")
        void testSingleAlgebraic() {
            DaeModel model = flatten("model M Real a; equation a = 1; end M;", "M");

            assertEquals(List.of("a"), names(model.z()));
            assertTrue(model.x().isEmpty());
            assertEquals(List.of("a - 1"), residuals(model));
            assertTrue(model.c().isEmpty());
            assertTrue(model.fr().isEmpty());
        }

        @Test
        @DisplayName("Should flatten the bouncing ball")
        void testBouncingBall() {
            DaeModel model = flatten(BOUNCING_BALL, "BouncingBall", BALL_POLICY);

            assertEquals("BouncingBall", model.name());
            assertEquals(List.of("e", "h0"), names(model.p()));
            assertEquals(List.of("h", "v"), names(model.x()));
            assertEquals(List.of("der_h", "der_v"), names(model.xDot()));
            assertTrue(model.z().isEmpty());
            assertTrue(model.m().isEmpty());

            assertEquals(List.of("v - der_h", "der_v - (-9.81)"), residuals(model));
            assertEquals(ComponentReference.of("h0"), model.symbol("h").orElseThrow().start());
            assertEquals(Terminal.real("0.8"), model.symbol("e").orElseThrow().start());

            assertEquals("h < 0", renderer.render(model.c().get("__c0")));
            ResetAssignment assignment = model.fr().get("__c0").assignments().get(0);
            assertEquals("v", assignment.target());
            assertEquals("-e * pre(v)", renderer.render(assignment.value()));
            assertEquals(List.of("v"), new ArrayList<>(model.preReferences()));
        }

        @Test
        @DisplayName("Should map each prefix to its vector")
        void testPrefixes() {
            DaeModel model = flatten(String.join("\n",
                    "model M",
                    "  constant Real g = 9.81;",
                    "  parameter Real k = 2;",
                    "  input Real u;",
                    "  output Real y;",
                    "  Real z;",
                    "equation",
                    "  y = k * z;",
                    "  z = u + g;",
                    "end M;"), "M");

            assertEquals(List.of("g"), names(model.cp()));
            assertEquals(List.of("k"), names(model.p()));
            assertEquals(List.of("u"), names(model.u()));
            assertEquals(List.of("y"), names(model.y()));
            assertEquals(List.of("z"), names(model.z()));
        }

        @Test
        @DisplayName("Should promote outputs used under der() to states")
        void testOutputPromotion() {
            DaeModel model = flatten("model M output Real y; equation der(y) = 1; end M;", "M");

            assertEquals(List.of("y"), names(model.x()));
            assertTrue(model.y().isEmpty());
        }

        @Test
        @DisplayName("Should promote a variable once however often der() is applied")
        void testDerIdempotent() {
            DaeModel model = flatten(
                    "model M Real x; Real w; equation der(x) = -x; w = der(x) + der(x); end M;", "M");

            assertEquals(List.of("x"), names(model.x()));
            assertEquals(List.of("der_x"), names(model.xDot()));
            assertEquals("w - (der_x + der_x)", residuals(model).get(1));
        }

        @Test
        @DisplayName("Should let an initial equation replace the start value")
        void testInitialEquation() {
            DaeModel model = flatten(
                    "model M Real x(start = 1); initial equation x = 2; equation der(x) = -x; end M;", "M");

            assertEquals(Terminal.integer(2), model.symbol("x").orElseThrow().start());
            assertEquals(1, model.fx().size());
        }

        @Test
        @DisplayName("Should keep fixed and other attributes")
        void testAttributes() {
            DaeModel model = flatten(
                    "model M Real x(start = 1, fixed = true, unit = \"m\", min = 0); equation der(x) = 1; end M;", "M");

            Symbol x = model.symbol("x").orElseThrow();
            assertEquals(Boolean.TRUE, x.fixed());
            assertEquals(2, x.attributes().size());
            assertEquals(Terminal.integer(0), x.attributes().get("min"));
        }

        @Test
        @DisplayName("Should resolve 'time' and math functions")
        void testTimeAndFunctions() {
            DaeModel model = flatten("model M Real x; equation der(x) = sin(time) + max(x, 1); end M;", "M");
            assertEquals("der_x - (sin(time) + max(x, 1))", residuals(model).get(0));
        }

        @Test
        @DisplayName("Should flatten a class nested in a package")
        void testNestedModel() {
            DaeModel model = flatten("package P model M Real x; equation x = 1; end M; end P;", "P.M");
            assertEquals("M", model.name());
            assertEquals(List.of("x"), names(model.z()));
        }
    }

    @Nested
    @DisplayName("Expansion of class-typed components")
    class Expansion {

        private static final String PAIR = String.join("\n",
                "model Ball",
                "  parameter Real e = 0.8;",
                "  Real h(start = 1);",
                "equation",
                "  der(h) = -e;",
                "end Ball;",
                "model Pair",
                "  Ball b(e = 0.5);",
                "  Ball c;",
                "end Pair;");

        @Test
        @DisplayName("Should prefix members with the instance name")
        void testMemberNames() {
            DaeModel model = flatten(PAIR, "Pair");

            assertEquals(List.of("b_e", "c_e"), names(model.p()));
            assertEquals(List.of("b_h", "c_h"), names(model.x()));
            assertEquals(List.of("der_b_h - (-b_e)", "der_c_h - (-c_e)"), residuals(model));
        }

        @Test
        @DisplayName("Should let the instance modification override the member binding")
        void testModificationOverride() {
            DaeModel model = flatten(PAIR, "Pair");

            assertEquals(Terminal.real("0.5"), model.symbol("b_e").orElseThrow().start());
            assertEquals(Terminal.real("0.8"), model.symbol("c_e").orElseThrow().start());
        }

        @Test
        @DisplayName("Should resolve dotted and absolute member references")
        void testDottedReferences() {
            String source = "model B Real h; equation h = 1; end B; "
                    + "model M B b; Real q; Real r; equation q = b.h; r = .b.h + .q; end M;";
            DaeModel model = flatten(source, "M");

            assertEquals(List.of("b_h", "q", "r"), names(model.z()));
            assertEquals(List.of("b_h - 1", "q - b_h", "r - (b_h + q)"), residuals(model));
        }

        @Test
        @DisplayName("Should reject modification of an unknown member")
        void testUnknownMember() {
            String source = "model A Real x; equation x = 1; end A; model B A a(y = 1); end B;";
            assertThrows(ClassificationException.class, () -> flatten(source, "B"));
        }

        @Test
        @DisplayName("Should reject recursive instantiation")
        void testRecursion() {
            ClassificationException exception = assertThrows(ClassificationException.class,
                    () -> flatten("model R R r; end R;", "R"));
            assertTrue(exception.getMessage().contains("Recursive instantiation"));
        }

        @Test
        @DisplayName("Should reject unknown component types")
        void testUnknownType() {
            assertThrows(ClassificationException.class,
                    () -> flatten("model M Missing m; end M;", "M"));
        }
    }

    @Nested
    @DisplayName("Reset conditions")
    class Resets {

        @Test
        @DisplayName("Should fail when no condition is configured for a reinit")
        void testResetWithoutCondition() {
            ResetWithoutConditionException exception = assertThrows(ResetWithoutConditionException.class,
                    () -> flatten(BOUNCING_BALL, "BouncingBall"));
            assertEquals("__c0", exception.getResetName());
            assertEquals("v", exception.getTarget());
        }

        @Test
        @DisplayName("Should wrap an unparsable condition")
        void testInvalidCondition() {
            FlattenPolicy policy = FlattenPolicy.builder().resetCondition("__c0", "h <").build();
            FlatteningException exception = assertThrows(FlatteningException.class,
                    () -> flatten(BOUNCING_BALL, "BouncingBall", policy));
            assertInstanceOf(ParseException.class, exception.getCause());
        }

        @Test
        @DisplayName("Should reject a condition naming an unknown variable")
        void testConditionUnknownVariable() {
            FlattenPolicy policy = FlattenPolicy.builder().resetCondition("__c0", "q < 0").build();
            assertThrows(UnresolvedReferenceException.class, () -> flatten(BOUNCING_BALL, "BouncingBall", policy));
        }

        @Test
        @DisplayName("Should parse conditions with the configured parser")
        void testConditionParserUsed() {
            ModelParser conditionParser = mock(ModelParser.class);
            Expression condition = parser.parseExpression("h < 0");
            when(conditionParser.parseExpression("h < 0")).thenReturn(condition);

            StoredDefinition unit = parser.parse(BOUNCING_BALL);
            DaeModel model = new BasicFlattener(BALL_POLICY, conditionParser).flatten(unit, "BouncingBall");

            verify(conditionParser, times(1)).parseExpression("h < 0");
            verify(conditionParser, never()).parse(anyString());
            assertEquals(condition, model.c().get("__c0"));
        }

        @Test
        @DisplayName("Should warn about conditions that match no reinit")
        void testUnusedConditionWarning() {
            Logger logger = Logger.getLogger(BasicFlattener.class.getName());
            List<LogRecord> records = new ArrayList<>();
            Handler handler = new Handler() {
                @Override
                public void publish(LogRecord record) {
                    records.add(record);
                }

                @Override
                public void flush() {
                }

                @Override
                public void close() {
                }
            };
            logger.addHandler(handler);
            try {
                FlattenPolicy policy = FlattenPolicy.builder()
                        .resetCondition("__c0", "h < 0")
                        .resetCondition("__c1", "v > 10")
                        .build();
                flatten(BOUNCING_BALL, "BouncingBall", policy);
            } finally {
                logger.removeHandler(handler);
            }

            assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.WARNING
                    && r.getMessage().contains("__c1")));
        }

        @Test
        @DisplayName("Should only reinit states")
        void testReinitNonState() {
            FlattenPolicy policy = FlattenPolicy.builder().resetCondition("__c0", "a > 1").build();
            assertThrows(ClassificationException.class, () -> flatten(
                    "model M Real a; equation a = time; reinit(a, 0); end M;", "M", policy));
        }
    }

    @Nested
    @DisplayName("Rejected models")
    class Rejections {

        @ParameterizedTest
        @ValueSource(strings = {
                "model M discrete Real d; equation d = 1; end M;",
                "model M flow Real f; equation f = 1; end M;",
                "model M parameter input Real p; end M;",
                "model M Real x(foo = 1); equation x = 1; end M;",
                "model M Real x(fixed = 1); equation x = 1; end M;",
                "model M parameter Real p = 1; equation der(p) = 1; end M;",
                "model M Integer i; equation der(i) = 1; end M;",
                "model M Real x; parameter Real p = pre(x); equation x = 1; end M;",
                "model M Real x; equation x = reinit(x, 1); end M;",
                "model M Real x; equation x = atan2(1); end M;",
                "model M Real x; equation sin(x); end M;",
                "model M Real x; Real der_x; equation der(x) = 1; der_x = 2; end M;"
        })
        @DisplayName("Should raise ClassificationException")
        void testClassificationFailures(String source) {
            assertThrows(ClassificationException.class, () -> flatten(source, "M"));
        }

        @Test
        @DisplayName("Should reject an unknown variable")
        void testUnknownVariable() {
            UnresolvedReferenceException exception = assertThrows(UnresolvedReferenceException.class,
                    () -> flatten("model M Real x; equation x = y; end M;", "M"));
            assertEquals("y", exception.getReference());
        }

        @ParameterizedTest
        @ValueSource(strings = {"b_h", ".b_h"})
        @DisplayName("Should reject the flat name of an expanded member")
        void testFlatMemberNameNotDeclared(String reference) {
            String source = "model B Real h; equation h = 1; end B; "
                    + "model M B b; Real q; equation q = " + reference + "; end M;";
            UnresolvedReferenceException exception = assertThrows(UnresolvedReferenceException.class,
                    () -> flatten(source, "M"));
            assertEquals(reference, exception.getReference());
        }

        @Test
        @DisplayName("Should reject an absolute reference to a name outside the model")
        void testAbsoluteUnknown() {
            assertThrows(UnresolvedReferenceException.class,
                    () -> flatten("model M Real x; equation x = .y; end M;", "M"));
        }

        @Test
        @DisplayName("Should reject an unknown function")
        void testUnknownFunction() {
            UnresolvedReferenceException exception = assertThrows(UnresolvedReferenceException.class,
                    () -> flatten("model M Real x; equation x = foo(1); end M;", "M"));
            assertEquals("foo", exception.getReference());
        }

        @Test
        @DisplayName("Should reject an unknown model name")
        void testUnknownModel() {
            assertThrows(UnresolvedReferenceException.class,
                    () -> flatten("model M Real x; equation x = 1; end M;", "N"));
        }

        @Test
        @DisplayName("Should reject a mismatched end name")
        void testEndNameMismatch() {
            ClassificationException exception = assertThrows(ClassificationException.class,
                    () -> flatten("model A Real x; equation x = 1; end B;", "A"));
            assertTrue(exception.getMessage().contains("end B"));
        }

        @Test
        @DisplayName("Should refuse to flatten a package")
        void testPackage() {
            assertThrows(ClassificationException.class, () -> flatten("package P end P;", "P"));
        }

        @Test
        @DisplayName("Should validate arguments")
        void testArguments() {
            BasicFlattener flattener = new BasicFlattener();
            StoredDefinition unit = parser.parse("model M end M;");
            assertThrows(NullPointerException.class, () -> flattener.flatten(null, "M"));
            assertThrows(IllegalArgumentException.class, () -> flattener.flatten(unit, " "));
        }
    }
}
