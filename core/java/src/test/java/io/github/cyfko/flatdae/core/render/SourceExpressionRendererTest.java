package io.github.cyfko.flatdae.core.render;

import io.github.cyfko.flatdae.core.ast.*;
import io.github.cyfko.flatdae.core.config.RenderPolicy;
import io.github.cyfko.flatdae.core.parsing.RecursiveDescentParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SourceExpressionRenderer} and the parenthesization rules of {@link ExpressionRenderer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("SourceExpressionRenderer Tests")
class SourceExpressionRendererTest {

    private static final ComponentReference A = ComponentReference.of("a");
    private static final ComponentReference B = ComponentReference.of("b");
    private static final ComponentReference C = ComponentReference.of("c");

    private final RecursiveDescentParser parser = new RecursiveDescentParser();
    private final SourceExpressionRenderer minimal = new SourceExpressionRenderer();
    private final SourceExpressionRenderer maximal = new SourceExpressionRenderer(RenderPolicy.maximal());

    @Nested
    @DisplayName("Minimal parenthesization")
    class Minimal {

        @Test
        @DisplayName("Should drop parentheses implied by precedence")
        void testPrecedence() {
            assertEquals("a + b * c", minimal.render(parser.parseExpression("a + (b * c)")));
            assertEquals("(a + b) * c", minimal.render(parser.parseExpression("(a + b) * c")));
        }

        @Test
        @DisplayName("Should keep parentheses on the right of a left-associative operator")
        void testAssociativity() {
            assertEquals("a - b - c", minimal.render(new Binary(BinaryOperator.SUB, new Binary(BinaryOperator.SUB, A, B), C)));
            assertEquals("a - (b - c)", minimal.render(new Binary(BinaryOperator.SUB, A, new Binary(BinaryOperator.SUB, B, C))));
            assertEquals("a ^ b ^ c", minimal.render(new Binary(BinaryOperator.EXP, new Binary(BinaryOperator.EXP, A, B), C)));
            assertEquals("a ^ (b ^ c)", minimal.render(new Binary(BinaryOperator.EXP, A, new Binary(BinaryOperator.EXP, B, C))));
        }

        @Test
        @DisplayName("Should wrap both sides of nested relations")
        void testRelations() {
            Binary nested = new Binary(BinaryOperator.EQ, new Binary(BinaryOperator.LT, A, B), C);
            assertEquals("(a < b) == c", minimal.render(nested));
        }

        @Test
        @DisplayName("Should wrap unary operands and unary right-hand sides")
        void testUnary() {
            assertEquals("-(a + b)", minimal.render(new Unary(UnaryOperator.MINUS, new Binary(BinaryOperator.ADD, A, B))));
            assertEquals("-a * b", minimal.render(new Unary(UnaryOperator.MINUS, new Binary(BinaryOperator.MUL, A, B))));
            assertEquals("-a + b", minimal.render(new Binary(BinaryOperator.ADD, new Unary(UnaryOperator.MINUS, A), B)));
            assertEquals("a * (-b)", minimal.render(new Binary(BinaryOperator.MUL, A, new Unary(UnaryOperator.MINUS, B))));
            assertEquals("a - (-b)", minimal.render(new Binary(BinaryOperator.SUB, A, new Unary(UnaryOperator.MINUS, B))));
            assertEquals("-(-a)", minimal.render(new Unary(UnaryOperator.MINUS, new Unary(UnaryOperator.MINUS, A))));
            assertEquals("not a < b", minimal.render(new Unary(UnaryOperator.NOT, new Binary(BinaryOperator.LT, A, B))));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "a + b * c - d / e",
                "(a + b) * (c - d)",
                "a ^ b ^ c",
                "a ^ (b ^ c)",
                "-a * b + c",
                "x > 0 and (y < 1 or not z == 2)",
                "sin(a + b) * max(c, -d * e)",
                "a .* b .^ 2"
        })
        @DisplayName("Should print text that parses back to the same tree")
        void testReparse(String source) {
            Expression tree = parser.parseExpression(source);
            assertEquals(tree, parser.parseExpression(minimal.render(tree)));
        }
    }

    @Nested
    @DisplayName("Maximal parenthesization")
    class Maximal {

        @Test
        @DisplayName("Should wrap every operator node")
        void testWrapEverything() {
            assertEquals("(a + (b * c))", maximal.render(parser.parseExpression("a + b * c")));
            assertEquals("(-a)", maximal.render(new Unary(UnaryOperator.MINUS, A)));
            assertEquals("f((a - b), c)", maximal.render(new FunctionCall(Name.of("f"),
                    List.of(new Binary(BinaryOperator.SUB, A, B), C))));
        }

        @Test
        @DisplayName("Should leave atoms bare")
        void testAtoms() {
            assertEquals("a", maximal.render(A));
            assertEquals("1.5", maximal.render(Terminal.real("1.5")));
        }
    }

    @Nested
    @DisplayName("Literals and placeholders")
    class Literals {

        @Test
        @DisplayName("Should quote and escape strings")
        void testString() {
            assertEquals("\"say \\\"hi\\\"\\n\"", minimal.render(new Terminal(TerminalType.STRING, "say \"hi\"\n")));
        }

        @Test
        @DisplayName("Should render reinit in expression position as a placeholder")
        void testPlaceholder() {
            FunctionCall reinit = FunctionCall.of("reinit", A, B);
            assertEquals("__UNSUPPORTED__(reinit in expression position)", minimal.render(reinit));

            SourceExpressionRenderer custom = new SourceExpressionRenderer(
                    RenderPolicy.builder().placeholderPrefix("NOT_RENDERED").build());
            assertEquals("NOT_RENDERED(reinit in expression position) + 1", custom.render(
                    new Binary(BinaryOperator.ADD, reinit, Terminal.integer(1))));
        }

        @Test
        @DisplayName("Should let subclasses declare right associativity")
        void testRightAssociativeTarget() {
            ExpressionRenderer rightPower = new SourceExpressionRenderer() {
                @Override
                protected Associativity associativity(BinaryOperator op) {
                    return op == BinaryOperator.EXP ? Associativity.RIGHT : super.associativity(op);
                }
            };
            assertEquals("(a ^ b) ^ c", rightPower.render(new Binary(BinaryOperator.EXP, new Binary(BinaryOperator.EXP, A, B), C)));
            assertEquals("a ^ b ^ c", rightPower.render(new Binary(BinaryOperator.EXP, A, new Binary(BinaryOperator.EXP, B, C))));
        }
    }
}
