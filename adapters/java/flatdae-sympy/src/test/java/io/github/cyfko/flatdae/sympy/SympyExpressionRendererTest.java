package io.github.cyfko.flatdae.sympy;

import io.github.cyfko.flatdae.core.ast.*;
import io.github.cyfko.flatdae.core.config.RenderPolicy;
import io.github.cyfko.flatdae.core.parsing.RecursiveDescentParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SympyExpressionRenderer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("SympyExpressionRenderer Tests")
class SympyExpressionRendererTest {

    private final RecursiveDescentParser parser = new RecursiveDescentParser();
    private final SympyExpressionRenderer renderer = new SympyExpressionRenderer();

    private String render(String source) {
        return renderer.render(parser.parseExpression(source));
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "a + b * c        | a + b * c",
                "a - (b - c)      | a - (b - c)",
                "a ^ 2            | a ** 2",
                "a ^ b ^ c        | (a ** b) ** c",
                "a ^ (b ^ c)      | a ** b ** c",
                "-a ^ 2           | -a ** 2",
                "(-a) ^ 2         | (-a) ** 2",
                "-a * b           | -(a * b)",
                "a .* b ./ c      | a * b / c",
                "x < 1            | x < 1",
                "x >= y + 1       | x >= y + 1"
        })
        @DisplayName("Should use Python operators and precedence")
        void testArithmetic(String source, String expected) {
            assertEquals(expected, render(source));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "a == b                | sympy.Eq(a, b)",
                "a <> b                | sympy.Ne(a, b)",
                "x > 0 and y < 1       | sympy.And(x > 0, y < 1)",
                "x > 0 or not y < 1    | sympy.Or(x > 0, sympy.Not(y < 1))",
                "(a == b) and true     | sympy.And(sympy.Eq(a, b), sympy.true)"
        })
        @DisplayName("Should build symbolic equality and logic")
        void testLogic(String source, String expected) {
            assertEquals(expected, render(source));
        }

        @Test
        @DisplayName("Should not parenthesize symbolic calls inside arithmetic")
        void testSymbolicCallAsOperand() {
            Expression expression = new Binary(BinaryOperator.MUL, Terminal.integer(2),
                    new Binary(BinaryOperator.EQ, ComponentReference.of("a"), ComponentReference.of("b")));
            assertEquals("2 * sympy.Eq(a, b)", renderer.render(expression));
        }
    }

    @Nested
    @DisplayName("Names and functions")
    class Names {

        @Test
        @DisplayName("Should map builtin functions to sympy")
        void testFunctions() {
            assertEquals("sympy.sin(x) + sympy.Abs(y)", render("sin(x) + abs(y)"));
            assertEquals("sympy.log(x, 10)", render("log10(x)"));
            assertEquals("sympy.Max(x, 1) - sympy.Min(x, 0)", render("max(x, 1) - min(x, 0)"));
            assertEquals("sympy.atan2(y, x)", render("atan2(y, x)"));
        }

        @Test
        @DisplayName("Should turn pre() into a pre symbol")
        void testPre() {
            assertEquals("-(e * pre_v)", render("-e * pre(v)"));
        }

        @Test
        @DisplayName("Should escape Python keywords and generator names")
        void testKeywords() {
            assertEquals("lambda_ + self_ + x", render("lambda + self + x"));
            assertEquals("np_", SympyExpressionRenderer.pythonName("np"));
            assertEquals("x_vec_", SympyExpressionRenderer.pythonName("x_vec"));
            assertEquals("pre_x_vec_", SympyExpressionRenderer.pythonName("pre_x_vec"));
            assertEquals("h", SympyExpressionRenderer.pythonName("h"));
        }

        @Test
        @DisplayName("Should emit placeholders for what Python cannot express")
        void testPlaceholders() {
            assertEquals("__UNSUPPORTED__(function foo)", renderer.render(FunctionCall.of("foo", ComponentReference.of("x"))));
            assertEquals("__UNSUPPORTED__(string literal hi)", renderer.render(new Terminal(TerminalType.STRING, "hi")));

            SympyExpressionRenderer custom = new SympyExpressionRenderer(
                    RenderPolicy.builder().placeholderPrefix("MISSING").build());
            assertEquals("MISSING(reinit in expression position)",
                    custom.render(FunctionCall.of("reinit", ComponentReference.of("x"), Terminal.integer(0))));
        }
    }

    @Test
    @DisplayName("Should wrap every arithmetic node in maximal mode")
    void testMaximal() {
        SympyExpressionRenderer maximal = new SympyExpressionRenderer(RenderPolicy.maximal());
        assertEquals("(a + (b ** 2))", maximal.render(parser.parseExpression("a + b ^ 2")));
        assertEquals("sympy.Eq((a + 1), b)", maximal.render(parser.parseExpression("a + 1 == b")));
    }
}
