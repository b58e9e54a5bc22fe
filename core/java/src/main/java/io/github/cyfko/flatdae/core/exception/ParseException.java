package io.github.cyfko.flatdae.core.exception;

import io.github.cyfko.flatdae.core.ast.SourcePosition;

import java.util.Set;

/**
 * Exception thrown when the token stream does not match the grammar.
 * <p>
 * Parsing is fail-fast: there is no error recovery and no batching of several errors.
 * The exception carries the position and text of the token actually found together with
 * the set of tokens or constructs that would have been accepted there.
 * </p>
 *
 * <p><strong>Error Examples:</strong></p>
 * <pre>{@code
 * parser.parse("model M Real a end M;");
 * // → "Expected ';' but found 'end' at 1:16"
 *
 * parser.parse("model M Real a; equation a = b < c < d; end M;");
 * // → "Relational operators do not chain: found '<' at 1:36"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see UnsupportedConstructException
 */
public class ParseException extends RuntimeException {

    private final SourcePosition position;
    private final String found;
    private final Set<String> expected;

    /**
     * @param message  description of the failure
     * @param position position of the offending token
     * @param found    text of the offending token
     * @param expected accepted alternatives, possibly empty
     */
    public ParseException(String message, SourcePosition position, String found, Set<String> expected) {
        super(message);
        this.position = position;
        this.found = found;
        this.expected = expected == null ? Set.of() : Set.copyOf(expected);
    }

    public SourcePosition getPosition() {
        return position;
    }

    public String getFound() {
        return found;
    }

    public Set<String> getExpected() {
        return expected;
    }
}
