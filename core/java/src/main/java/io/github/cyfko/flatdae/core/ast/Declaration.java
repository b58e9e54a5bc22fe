package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code IDENT [modification]}.
 *
 * @param ident        declared identifier
 * @param modification modification, or {@code null}
 * @param position     position of the identifier
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Declaration(String ident, Modification modification, SourcePosition position) {

    public Declaration {
        Objects.requireNonNull(ident, "ident cannot be null");
        position = position == null ? SourcePosition.SYNTHETIC : position;
    }

    public Optional<Modification> modificationOpt() {
        return Optional.ofNullable(modification);
    }
}
