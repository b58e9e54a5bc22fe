package io.github.cyfko.flatdae.core.ast;

/**
 * Location of a token or node in the source text.
 *
 * @param offset character offset from the start of the source (0-based)
 * @param line   line number (1-based)
 * @param column column number (1-based)
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SourcePosition(int offset, int line, int column) {

    /** Position used for nodes synthesized by the flattener. */
    public static final SourcePosition SYNTHETIC = new SourcePosition(-1, 0, 0);

    public SourcePosition {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line and column must not be negative");
        }
    }

    @Override
    public String toString() {
        return this == SYNTHETIC ? "<synthetic>" : line + ":" + column;
    }
}
