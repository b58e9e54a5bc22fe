package io.github.cyfko.flatdae.core.parsing;

import io.github.cyfko.flatdae.core.ast.SourcePosition;

import java.util.Objects;

/**
 * Lexical token.
 *
 * @param kind     token kind
 * @param text     source text; string literals are unescaped and unquoted
 * @param position start position
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenKind kind, String text, SourcePosition position) {

    public Token {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(position, "position cannot be null");
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind == TokenKind.EOF ? "<EOF>" : text;
    }
}
