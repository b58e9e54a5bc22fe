package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;

/**
 * Literal value. {@code text} keeps the exact source spelling ({@code "9.81"},
 * {@code "1e-3"}, {@code "true"}); string literals are stored without quotes.
 *
 * @param type literal category
 * @param text literal text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Terminal(TerminalType type, String text) implements Expression {

    public Terminal {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
    }

    public static Terminal integer(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Terminals are unsigned, got: " + value);
        }
        return new Terminal(TerminalType.UNSIGNED_INTEGER, Long.toString(value));
    }

    public static Terminal real(String text) {
        return new Terminal(TerminalType.UNSIGNED_REAL, text);
    }

    public static Terminal bool(boolean value) {
        return new Terminal(TerminalType.BOOLEAN, Boolean.toString(value));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitTerminal(this);
    }
}
