package io.github.cyfko.flatdae.core.dae;

import io.github.cyfko.flatdae.core.ast.Binary;
import io.github.cyfko.flatdae.core.ast.BinaryOperator;
import io.github.cyfko.flatdae.core.ast.ComponentReference;
import io.github.cyfko.flatdae.core.ast.Expression;
import io.github.cyfko.flatdae.core.ast.FunctionCall;
import io.github.cyfko.flatdae.core.ast.Terminal;
import io.github.cyfko.flatdae.core.ast.Unary;
import io.github.cyfko.flatdae.core.ast.UnaryOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DaeModel} and its building blocks.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("DaeModel Tests")
class DaeModelTest {

    private DaeModel.Builder ball;

    @BeforeEach
    void setUp() {
        Expression condition = new Binary(BinaryOperator.LT, ComponentReference.of("h"), Terminal.integer(0));
        Expression bounce = new Unary(UnaryOperator.MINUS, FunctionCall.of("pre", ComponentReference.of("v")));
        ball = DaeModel.builder("Ball")
                .symbol(new Symbol("g", SymbolRole.CONSTANT, Symbol.REAL, Terminal.real("9.81")))
                .symbol(new Symbol("h", SymbolRole.STATE, Symbol.REAL, Terminal.integer(1)))
                .symbol(new Symbol("v", SymbolRole.STATE, Symbol.REAL, null))
                .residual(new Residual(ComponentReference.of("der_h"), ComponentReference.of("v")))
                .residual(new Residual(ComponentReference.of("der_v"),
                        new Unary(UnaryOperator.MINUS, ComponentReference.of("g"))))
                .pre("v")
                .reset("__c0", condition, ResetBlock.of(new ResetAssignment("v", bounce)));
    }

    @Nested
    @DisplayName("Vectors")
    class Vectors {

        @Test
        @DisplayName("Should derive one derivative per state, in state order")
        void testDerivatives() {
            DaeModel model = ball.build();
            assertEquals(List.of("der_h", "der_v"), model.xDot().stream().map(Symbol::name).toList());
            assertEquals(SymbolRole.STATE_DERIVATIVE, model.symbol("der_v").orElseThrow().role());
        }

        @Test
        @DisplayName("Should keep every vector, empty ones included")
        void testEmptyVectors() {
            DaeModel model = ball.build();
            for (SymbolRole role : SymbolRole.values()) {
                assertNotNull(model.vector(role), role.getVectorName());
            }
            assertTrue(model.m().isEmpty());
            assertTrue(model.u().isEmpty());
            assertEquals(5, model.symbols().size());
        }

        @Test
        @DisplayName("Should fill default start values by type")
        void testStartValues() {
            DaeModel model = ball.build();
            Map<String, Expression> starts = model.startValues(SymbolRole.STATE);
            assertEquals(Terminal.integer(1), starts.get("h"));
            assertEquals(Terminal.real("0.0"), starts.get("v"));

            assertEquals(Terminal.integer(0), new Symbol("i", SymbolRole.ALGEBRAIC, Symbol.INTEGER, null).startOrDefault());
            assertEquals(Terminal.bool(false), new Symbol("b", SymbolRole.ALGEBRAIC, Symbol.BOOLEAN, null).startOrDefault());
        }

        @Test
        @DisplayName("Should expose residuals as lhs - rhs")
        void testResidualExpression() {
            Residual residual = ball.build().fx().get(0);
            assertEquals(new Binary(BinaryOperator.SUB, ComponentReference.of("der_h"), ComponentReference.of("v")),
                    residual.expression());
        }

        @Test
        @DisplayName("Should summarize sizes in toString")
        void testToString() {
            assertEquals("DaeModel[Ball: u=0 p=0 cp=1 x=2 m=0 y=0 z=0 fx=2 c=1]", ball.build().toString());
        }

        @Test
        @DisplayName("Should share reset names between c and fr")
        void testResetNames() {
            DaeModel model = ball.build();
            assertEquals(model.c().keySet(), model.fr().keySet());
            assertEquals(List.of("v"), List.copyOf(model.preReferences()));
        }

        @Test
        @DisplayName("Should be immutable")
        void testImmutable() {
            DaeModel model = ball.build();
            assertThrows(UnsupportedOperationException.class, () -> model.x().clear());
            assertThrows(UnsupportedOperationException.class, () -> model.c().clear());
            assertThrows(UnsupportedOperationException.class, () -> model.preReferences().add("h"));
        }
    }

    @Nested
    @DisplayName("Builder validation")
    class Validation {

        @Test
        @DisplayName("Should reject duplicate symbols and explicit derivatives")
        void testSymbolRejections() {
            assertThrows(IllegalArgumentException.class,
                    () -> ball.symbol(new Symbol("h", SymbolRole.ALGEBRAIC, Symbol.REAL, null)));
            assertThrows(IllegalArgumentException.class,
                    () -> ball.symbol(new Symbol("der_q", SymbolRole.STATE_DERIVATIVE, Symbol.REAL, null)));
        }

        @Test
        @DisplayName("Should reject a symbol named like a state derivative")
        void testDerivativeClash() {
            ball.symbol(new Symbol("der_h", SymbolRole.ALGEBRAIC, Symbol.REAL, null));
            assertThrows(IllegalStateException.class, () -> ball.build());
        }

        @Test
        @DisplayName("Should reject resets of non-states and pre of unknown symbols")
        void testResetAndPreTargets() {
            DaeModel.Builder badReset = DaeModel.builder("M")
                    .symbol(new Symbol("a", SymbolRole.ALGEBRAIC, Symbol.REAL, null))
                    .reset("__c0", Terminal.bool(true), ResetBlock.of(new ResetAssignment("a", Terminal.integer(0))));
            assertThrows(IllegalStateException.class, badReset::build);

            DaeModel.Builder badPre = DaeModel.builder("M").pre("ghost");
            assertThrows(IllegalStateException.class, badPre::build);
        }

        @Test
        @DisplayName("Should reject duplicate resets, blank names and empty blocks")
        void testMisc() {
            assertThrows(IllegalArgumentException.class,
                    () -> ball.reset("__c0", Terminal.bool(true), ResetBlock.of(new ResetAssignment("h", Terminal.integer(0)))));
            assertThrows(IllegalArgumentException.class, () -> DaeModel.builder(" "));
            assertThrows(IllegalArgumentException.class, () -> new ResetBlock(List.of()));
        }
    }

    @Test
    @DisplayName("Should know the builtin math functions and their arity")
    void testBuiltins() {
        assertEquals(1, Builtins.mathArity("sin").orElseThrow());
        assertEquals(2, Builtins.mathArity("atan2").orElseThrow());
        assertTrue(Builtins.mathArity("der").isEmpty());
        assertFalse(Builtins.isMathFunction("reinit"));
    }
}
