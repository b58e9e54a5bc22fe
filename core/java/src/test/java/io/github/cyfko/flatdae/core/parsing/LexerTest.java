package io.github.cyfko.flatdae.core.parsing;

import io.github.cyfko.flatdae.core.config.ParserPolicy;
import io.github.cyfko.flatdae.core.exception.LexException;
import io.github.cyfko.flatdae.core.exception.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Lexer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Lexer Tests")
class LexerTest {

    private static List<TokenKind> kinds(String source) {
        return new Lexer(source).tokenize().stream().map(Token::kind).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Token recognition")
    class Recognition {

        @Test
        @DisplayName("Should separate keywords from identifiers")
        void testKeywordsAndIdentifiers() {
            assertEquals(List.of(TokenKind.MODEL, TokenKind.IDENT, TokenKind.END, TokenKind.IDENT,
                    TokenKind.SEMICOLON, TokenKind.EOF), kinds("model Ball end Ball;"));
        }

        @Test
        @DisplayName("Should accept underscores and digits inside identifiers")
        void testIdentifierCharacters() {
            List<Token> tokens = new Lexer("_x1 der_h").tokenize();
            assertEquals("_x1", tokens.get(0).text());
            assertEquals("der_h", tokens.get(1).text());
        }

        @Test
        @DisplayName("Should distinguish integer and real literals")
        void testNumbers() {
            assertEquals(List.of(TokenKind.UNSIGNED_INTEGER, TokenKind.UNSIGNED_REAL, TokenKind.UNSIGNED_REAL,
                    TokenKind.UNSIGNED_REAL, TokenKind.EOF), kinds("42 9.81 1e-3 2.5E+2"));
        }

        @Test
        @DisplayName("Should keep element-wise operator after integer")
        void testIntegerFollowedByDotOperator() {
            assertEquals(List.of(TokenKind.UNSIGNED_INTEGER, TokenKind.DOT_STAR, TokenKind.IDENT, TokenKind.EOF),
                    kinds("2.*x"));
        }

        @Test
        @DisplayName("Should prefer two-character operators")
        void testTwoCharacterOperators() {
            assertEquals(List.of(TokenKind.LE, TokenKind.GE, TokenKind.NOT_EQ, TokenKind.EQ_EQ,
                    TokenKind.COLON_ASSIGN, TokenKind.DOT_CARET, TokenKind.LT, TokenKind.EOF),
                    kinds("<= >= <> == := .^ <"));
        }

        @Test
        @DisplayName("Should unescape string literals")
        void testStringLiteral() {
            Token token = new Lexer("\"height \\\"h\\\"\\n\"").tokenize().get(0);
            assertEquals(TokenKind.STRING, token.kind());
            assertEquals("height \"h\"\n", token.text());
        }

        @Test
        @DisplayName("Should skip line and block comments")
        void testComments() {
            assertEquals(List.of(TokenKind.IDENT, TokenKind.IDENT, TokenKind.EOF),
                    kinds("a // trailing\n/* block\n comment */ b"));
        }

        @Test
        @DisplayName("Should track lines and columns")
        void testPositions() {
            List<Token> tokens = new Lexer("model M\n  Real x;\nend M;").tokenize();
            Token real = tokens.get(2);
            assertEquals("Real", real.text());
            assertEquals(2, real.position().line());
            assertEquals(3, real.position().column());
        }
    }

    @Nested
    @DisplayName("Lexical errors")
    class Errors {

        @ParameterizedTest
        @ValueSource(strings = {"x = 1 # 2", "x = @", "x = $y"})
        @DisplayName("Should reject unrecognized characters")
        void testUnrecognizedCharacter(String source) {
            LexException exception = assertThrows(LexException.class, () -> new Lexer(source).tokenize());
            assertTrue(exception.getMessage().startsWith("Unrecognized character"));
        }

        @Test
        @DisplayName("Should report line, column and byte offset")
        void testErrorLocation() {
            LexException exception = assertThrows(LexException.class,
                    () -> new Lexer("a // é\n  b #").tokenize());
            assertEquals(2, exception.getLine());
            assertEquals(5, exception.getColumn());
            // 'é' takes two bytes in UTF-8
            assertEquals(11, exception.getByteOffset());
        }

        @Test
        @DisplayName("Should reject unterminated strings and comments")
        void testUnterminated() {
            assertThrows(LexException.class, () -> new Lexer("\"open").tokenize());
            assertThrows(LexException.class, () -> new Lexer("/* open").tokenize());
        }

        @Test
        @DisplayName("Should reject malformed exponents")
        void testMalformedExponent() {
            LexException exception = assertThrows(LexException.class, () -> new Lexer("1e+").tokenize());
            assertTrue(exception.getMessage().contains("Malformed exponent"));
        }

        @Test
        @DisplayName("Should enforce maximum source length")
        void testSourceTooLong() {
            ParserPolicy policy = ParserPolicy.builder().maxSourceLength(10).build();
            ParseException exception = assertThrows(ParseException.class,
                    () -> new Lexer("a".repeat(11), policy));
            assertTrue(exception.getMessage().contains("max: 10"));
            assertTrue(exception.getMessage().contains("CUSTOM_POLICY"));
        }
    }
}
