package io.github.cyfko.flatdae.core.ast;

/**
 * Literal categories recognized by the grammar.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TerminalType {
    UNSIGNED_INTEGER,
    UNSIGNED_REAL,
    STRING,
    BOOLEAN;

    /** @return {@code true} for integer and real literals */
    public boolean isNumeric() {
        return this == UNSIGNED_INTEGER || this == UNSIGNED_REAL;
    }
}
