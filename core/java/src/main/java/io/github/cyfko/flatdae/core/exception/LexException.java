package io.github.cyfko.flatdae.core.exception;

/**
 * Exception thrown when the lexer meets a character that starts no token.
 * <p>
 * Lexing has no recovery mode: the first unrecognized character aborts the whole
 * compilation unit. The offset is reported in UTF-8 bytes, so it can be used directly
 * against the raw source file; line and column are given for humans.
 * </p>
 *
 * <pre>{@code
 * new Lexer("model M Real a $ ; end M;").tokenize();
 * // → LexException: Unrecognized character '$' at 1:16 (byte offset 15)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexException extends RuntimeException {

    private final int byteOffset;
    private final int line;
    private final int column;

    /**
     * @param message    description of the failure
     * @param byteOffset UTF-8 byte offset of the offending character
     * @param line       1-based line
     * @param column     1-based column
     */
    public LexException(String message, int byteOffset, int line, int column) {
        super(message);
        this.byteOffset = byteOffset;
        this.line = line;
        this.column = column;
    }

    public int getByteOffset() {
        return byteOffset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
