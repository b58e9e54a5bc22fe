package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Class-modification argument {@code [each] [final] name [modification]}.
 *
 * @param name         modified element, possibly dotted
 * @param each         {@code each} prefix present
 * @param isFinal      {@code final} prefix present
 * @param modification nested modification, or {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ElementModification(Name name, boolean each, boolean isFinal, Modification modification) {

    public ElementModification {
        Objects.requireNonNull(name, "name cannot be null");
    }

    /** @return the value bound by {@code name = value}, if any */
    public Optional<Expression> value() {
        return modification == null ? Optional.empty() : modification.bindingOpt();
    }
}
